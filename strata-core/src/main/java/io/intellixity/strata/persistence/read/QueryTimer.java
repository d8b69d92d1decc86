package io.intellixity.strata.persistence.read;

import org.slf4j.Logger;

import java.time.Duration;
import java.util.function.Supplier;

/** Times resolver queries: WARN above the slow threshold, DEBUG otherwise. */
public final class QueryTimer {
  public static final Duration SLOW = Duration.ofSeconds(1);

  private QueryTimer() {}

  public static <T> T time(Logger log, String kind, String name, int batchSize, Supplier<T> work) {
    long t0 = System.nanoTime();
    try {
      return work.get();
    } finally {
      long ms = (System.nanoTime() - t0) / 1_000_000L;
      if (ms > SLOW.toMillis()) {
        log.warn("strata.read slow kind={} resolver={} batch={} durationMs={}", kind, name, batchSize, ms);
      } else if (log.isDebugEnabled()) {
        log.debug("strata.read kind={} resolver={} batch={} durationMs={}", kind, name, batchSize, ms);
      }
    }
  }
}
