package io.intellixity.strata.persistence.exec;

import io.intellixity.strata.persistence.error.SaveException;

import java.util.Objects;

/**
 * Outcome of one try of a retryable unit of work.\n
 *
 * {@link Retryable} asks the {@link Retrier} for another try; {@link Fatal} stops immediately.
 */
public sealed interface Attempt<T> permits Attempt.Ok, Attempt.Retryable, Attempt.Fatal {

  static <T> Attempt<T> ok(T value) { return new Ok<>(value); }
  static <T> Attempt<T> retryable(SaveException reason) { return new Retryable<>(reason); }
  static <T> Attempt<T> fatal(SaveException error) { return new Fatal<>(error); }

  /** Retryable when the error kind says so, fatal otherwise. */
  static <T> Attempt<T> failed(SaveException error) {
    return error.kind().retryable() ? retryable(error) : fatal(error);
  }

  record Ok<T>(T value) implements Attempt<T> {}

  record Retryable<T>(SaveException reason) implements Attempt<T> {
    public Retryable {
      Objects.requireNonNull(reason, "reason");
    }
  }

  record Fatal<T>(SaveException error) implements Attempt<T> {
    public Fatal {
      Objects.requireNonNull(error, "error");
    }
  }
}
