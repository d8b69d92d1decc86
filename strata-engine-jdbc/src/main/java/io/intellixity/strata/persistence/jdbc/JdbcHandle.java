package io.intellixity.strata.persistence.jdbc;

import io.intellixity.strata.persistence.exec.handle.EngineHandle;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * The database behind one partition: a pooled {@link DataSource} and the schema its tables live in.\n
 *
 * A blank schema means the connection's default search path; statements then use unqualified table names.
 */
public record JdbcHandle(String id, DataSource client, String schema) implements EngineHandle<DataSource> {
  public JdbcHandle {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(client, "client");
    schema = schema == null || schema.isBlank() ? null : schema.trim();
  }

  public JdbcHandle(String id, DataSource client) {
    this(id, client, null);
  }

  @Override
  public String namespace() {
    return schema;
  }

  @Override
  public String toString() {
    return schema == null ? "jdbc[" + id + "]" : "jdbc[" + id + " schema=" + schema + "]";
  }
}
