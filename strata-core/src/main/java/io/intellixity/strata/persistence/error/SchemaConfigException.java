package io.intellixity.strata.persistence.error;

/** Schema or wiring problem detected before any store I/O. */
public class SchemaConfigException extends RuntimeException {
  public SchemaConfigException(String message) {
    super(message);
  }

  public SchemaConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
