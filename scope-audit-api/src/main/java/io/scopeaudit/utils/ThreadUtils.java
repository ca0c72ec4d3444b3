// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.utils;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.kafka.common.utils.KafkaThread;

public final class ThreadUtils {

  private ThreadUtils() {
  }

  /**
   * Creates a thread factory naming threads from a pattern containing a single {@code %d}.
   */
  public static ThreadFactory createThreadFactory(String pattern, boolean daemon) {
    AtomicInteger threadIndex = new AtomicInteger();
    return runnable -> new KafkaThread(String.format(pattern, threadIndex.getAndIncrement()),
        runnable, daemon);
  }
}
