package io.intellixity.strata.persistence.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff.\n
 *
 * Delay before retry {@code n} (1-based) is {@code initialDelay * multiplier^(n-1)}, capped at {@code maxDelay}.
 * The default gives 4 retries at 100, 200, 200, 200 ms.
 */
public record RetryPolicy(int maxRetries, Duration initialDelay, Duration maxDelay, double multiplier) {
  public static final RetryPolicy DEFAULT =
      new RetryPolicy(4, Duration.ofMillis(100), Duration.ofMillis(200), 2.0);

  public static final RetryPolicy NONE = new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 1.0);

  public RetryPolicy {
    if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
    Objects.requireNonNull(initialDelay, "initialDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (initialDelay.isNegative() || maxDelay.isNegative()) throw new IllegalArgumentException("delays must be >= 0");
    if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1.0");
  }

  public Duration delayBefore(int retry) {
    if (retry < 1) throw new IllegalArgumentException("retry is 1-based");
    double ms = initialDelay.toMillis() * Math.pow(multiplier, retry - 1);
    long capped = (long) Math.min(ms, (double) maxDelay.toMillis());
    return Duration.ofMillis(capped);
  }
}
