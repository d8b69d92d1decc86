package io.intellixity.strata.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Accounts service writing through the delta planner and reading through generated resolvers.\n
 *
 * Data sources are built per partition from {@code strata.partitions}, so Boot's single auto-configured
 * DataSource is switched off.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class AccountsExampleApplication {
  public static void main(String[] args) {
    SpringApplication.run(AccountsExampleApplication.class, args);
  }
}
