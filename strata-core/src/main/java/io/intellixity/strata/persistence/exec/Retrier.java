package io.intellixity.strata.persistence.exec;

import io.intellixity.strata.persistence.error.SaveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Drives a unit of work returning {@link Attempt} until it succeeds, fails fatally or runs out of retries.\n
 *
 * No exception-based control flow: the unit reports retryable conditions as values. Exhausted retries
 * throw the last {@link Attempt.Retryable#reason()}.
 */
public final class Retrier {
  private static final Logger log = LoggerFactory.getLogger(Retrier.class);

  /** Pause between tries. Tests pass a recording sleeper. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
  }

  private final RetryPolicy policy;
  private final Sleeper sleeper;

  public Retrier(RetryPolicy policy) {
    this(policy, d -> Thread.sleep(d.toMillis()));
  }

  public Retrier(RetryPolicy policy, Sleeper sleeper) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }


  public <T> T run(String unit, Supplier<Attempt<T>> work) {
    Objects.requireNonNull(work, "work");
    int retry = 0;
    while (true) {
      Attempt<T> a = work.get();
      if (a instanceof Attempt.Ok<T> ok) return ok.value();
      if (a instanceof Attempt.Fatal<T> f) throw f.error();

      SaveException reason = ((Attempt.Retryable<T>) a).reason();
      if (retry >= policy.maxRetries()) {
        log.warn("strata.retry exhausted unit={} attempts={} kind={}", unit, retry + 1, reason.kind());
        throw reason;
      }
      retry++;
      Duration delay = policy.delayBefore(retry);
      log.warn("strata.retry unit={} retry={}/{} delayMs={} kind={}",
          unit, retry, policy.maxRetries(), delay.toMillis(), reason.kind());
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        reason.addSuppressed(e);
        throw reason;
      }
    }
  }
}
