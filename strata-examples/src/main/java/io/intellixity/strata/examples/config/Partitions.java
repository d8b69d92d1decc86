package io.intellixity.strata.examples.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.strata.persistence.jdbc.JdbcHandle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/** One Hikari pool and {@link JdbcHandle} per configured partition. Closing it closes the pools. */
public final class Partitions implements AutoCloseable {
  private final Map<String, HikariDataSource> pools;
  private final Map<String, JdbcHandle> handles;

  private Partitions(Map<String, HikariDataSource> pools, Map<String, JdbcHandle> handles) {
    this.pools = pools;
    this.handles = Collections.unmodifiableMap(handles);
  }

  public static Partitions open(PartitionsProperties props) {
    Map<String, HikariDataSource> pools = new LinkedHashMap<>();
    Map<String, JdbcHandle> handles = new LinkedHashMap<>();
    for (var e : new TreeMap<>(props.getPartitions()).entrySet()) {
      PartitionsProperties.PartitionDb db = e.getValue();
      if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
        throw new IllegalArgumentException("Missing jdbcUrl for partition=" + e.getKey());
      }
      HikariConfig hc = new HikariConfig();
      hc.setPoolName("strata-" + e.getKey());
      hc.setJdbcUrl(db.getJdbcUrl());
      hc.setUsername(db.getUsername());
      hc.setPassword(db.getPassword());
      hc.setMaximumPoolSize(db.getMaxPoolSize());
      HikariDataSource ds = new HikariDataSource(hc);
      pools.put(e.getKey(), ds);
      handles.put(e.getKey(), new JdbcHandle("jdbc:" + e.getKey(), ds, db.getSchema()));
    }
    return new Partitions(pools, handles);
  }

  public Map<String, JdbcHandle> handles() {
    return handles;
  }

  @Override
  public void close() {
    for (HikariDataSource ds : pools.values()) ds.close();
  }
}
