package io.intellixity.strata.persistence.spi.sql;

/** Marker for a backend-native statement (SQL text plus binds, ...). */
public interface NativeStatement {
}
