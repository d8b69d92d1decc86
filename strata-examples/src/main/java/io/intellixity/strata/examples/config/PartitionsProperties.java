package io.intellixity.strata.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "strata")
public class PartitionsProperties {
  private final Map<String, PartitionDb> partitions = new HashMap<>();

  /** Classpath resource holding the attribute schema JSON. */
  private String schemaResource = "schema/accounts.json";

  /** Threads used to run independent resolvers of one read level concurrently. */
  private int readThreads = 4;

  public Map<String, PartitionDb> getPartitions() { return partitions; }
  public String getSchemaResource() { return schemaResource; }
  public void setSchemaResource(String schemaResource) { this.schemaResource = schemaResource; }
  public int getReadThreads() { return readThreads; }
  public void setReadThreads(int readThreads) { this.readThreads = readThreads; }

  public static class PartitionDb {
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema = "public";
    private int maxPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
  }
}
