// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.classifier;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.time.Instant;
import org.junit.Test;

public class TimestampParserTest {

  private static final Instant EXPECTED = Instant.parse("2026-03-04T05:06:07Z");

  @Test
  public void testSupportedFormats() {
    assertEquals(EXPECTED, TimestampParser.parse("endTime", "2026-03-04T05:06:07Z"));
    assertEquals(EXPECTED, TimestampParser.parse("endTime", "2026-03-04T05:06:07.000Z"));
    assertEquals(EXPECTED, TimestampParser.parse("endTime", "2026-03-04T07:06:07+02:00"));
    assertEquals(EXPECTED, TimestampParser.parse("endTime", "2026-03-04T05:06:07"));
    assertEquals(EXPECTED, TimestampParser.parse("endTime", "3/4/2026 5:06:07 AM"));
    assertEquals(EXPECTED, TimestampParser.parse("endTime", "3/4/2026 5:06:07"));
    assertEquals(EXPECTED, TimestampParser.parse("endTime", String.valueOf(EXPECTED.toEpochMilli())));
    assertEquals(Instant.parse("2026-03-04T00:00:00Z"), TimestampParser.parse("endTime", "2026-03-04"));
    assertEquals(Instant.parse("2026-03-04T17:06:07Z"), TimestampParser.parse("endTime", " 3/4/2026 5:06:07 pm "));
  }

  @Test
  public void testEpochSecondsAndMillis() {
    assertEquals(Instant.parse("2030-01-01T00:00:00Z"), TimestampParser.parse("endTime", "1893456000"));
    assertEquals(Instant.parse("2030-01-01T00:00:00Z"), TimestampParser.parse("endTime", "1893456000000"));
    assertEquals(EXPECTED, TimestampParser.parse("endTime", String.valueOf(EXPECTED.getEpochSecond())));
  }

  @Test(expected = MalformedDataException.class)
  public void testEpochMillisOutOfRange() {
    TimestampParser.parse("endTime", "99999999999999999999999");
  }

  @Test
  public void testMissingValues() {
    assertNull(TimestampParser.parse("endTime", null));
    assertNull(TimestampParser.parse("endTime", " "));
  }

  @Test(expected = MalformedDataException.class)
  public void testMalformedValue() {
    TimestampParser.parse("endTime", "31/31/2026");
  }
}
