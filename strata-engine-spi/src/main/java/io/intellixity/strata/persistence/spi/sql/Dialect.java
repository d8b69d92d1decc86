package io.intellixity.strata.persistence.spi.sql;

import io.intellixity.strata.persistence.dmlast.DmlAst;

import java.util.List;
import java.util.Map;

/**
 * Backend-agnostic SPI: renders the write plan, sequence allocation and batched resolver queries.\n
 *
 * {@code namespace} is the handle's schema/database, or null for the store default. Resolver queries take the
 * whole id batch as a single array bind and have fixed text regardless of batch size.
 */
public interface Dialect<S extends NativeStatement> {
  String id();

  S renderDml(String namespace, DmlAst dml);

  /** Statement run first in every write transaction to defer constraint checks to commit, or null if unsupported. */
  S deferConstraints();

  /** {@code count} next values of {@code sequence}, one per row in the first column. */
  S nextValues(String namespace, String sequence, int count);

  /** Rows of {@code table} whose {@code matchColumn} is in the batch bound as one array of {@code elemTypeId}. */
  S selectByIds(String namespace, String table, List<String> columns, String matchColumn, String elemTypeId);

  /**
   * Per distinct {@code keyColumn} in the batch: {@code k} the key, {@code v} the array of {@code valueColumn},
   * ordered by {@code orderColumn} when given.
   */
  S aggregateByIds(String namespace, String table, String keyColumn, String valueColumn, String orderColumn,
                   String elemTypeId);

  /** Driver-extracted context of a store error (constraint, table, column). */
  default Map<String, String> errorDetails(Throwable error) {
    return Map.of();
  }

  /** Bind type id of an array of {@code elemTypeId} values. */
  static String arrayTypeId(String elemTypeId) {
    return "list<" + elemTypeId + ">";
  }
}
