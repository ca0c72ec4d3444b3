// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.engine.classifier;

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the timestamp formats found in assignment exports. Values without an offset are
 * interpreted as UTC. Numeric values of 10 to 12 digits are epoch seconds, longer ones epoch
 * milliseconds.
 */
public final class TimestampParser {

  private static final Logger log = LoggerFactory.getLogger(TimestampParser.class);

  private static final Pattern EPOCH_SECONDS = Pattern.compile("^-?\\d{10,12}$");
  private static final Pattern EPOCH_MILLIS = Pattern.compile("^-?\\d{13,}$");

  private static final DateTimeFormatter US_DATE_TIME_24H =
      DateTimeFormatter.ofPattern("M/d/yyyy H:mm[:ss]", Locale.US);
  private static final DateTimeFormatter US_DATE_TIME_12H =
      DateTimeFormatter.ofPattern("M/d/yyyy h:mm[:ss] a", Locale.US);

  private static final List<Function<String, Instant>> PARSERS = ImmutableList.of(
      Instant::parse,
      value -> OffsetDateTime.parse(value).toInstant(),
      value -> ZonedDateTime.parse(value).toInstant(),
      value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
      value -> LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant(),
      value -> LocalDateTime.parse(value.toUpperCase(Locale.ROOT), US_DATE_TIME_12H).toInstant(ZoneOffset.UTC),
      value -> LocalDateTime.parse(value, US_DATE_TIME_24H).toInstant(ZoneOffset.UTC)
  );

  private TimestampParser() {
  }

  /**
   * @return the parsed instant, or null for null or blank values
   * @throws MalformedDataException if the value matches none of the supported formats
   */
  public static Instant parse(String field, String value) {
    if (value == null || value.trim().isEmpty())
      return null;
    String trimmed = value.trim();
    if (EPOCH_SECONDS.matcher(trimmed).matches())
      return Instant.ofEpochSecond(Long.parseLong(trimmed));
    if (EPOCH_MILLIS.matcher(trimmed).matches()) {
      try {
        return Instant.ofEpochMilli(Long.parseLong(trimmed));
      } catch (NumberFormatException e) {
        throw new MalformedDataException(field, "Timestamp out of range in " + field + ": " + trimmed);
      }
    }
    for (Function<String, Instant> parser : PARSERS) {
      try {
        return parser.apply(trimmed);
      } catch (DateTimeParseException e) {
        log.trace("Timestamp {} of {} does not match format: {}", trimmed, field, e.getMessage());
      }
    }
    throw new MalformedDataException(field, "Unparseable timestamp in " + field + ": " + trimmed);
  }
}
