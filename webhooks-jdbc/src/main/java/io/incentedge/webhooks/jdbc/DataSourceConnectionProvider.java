package io.incentedge.webhooks.jdbc;

import io.incentedge.webhooks.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Hands the dispatcher, delivery engine and retry scheduler pooled connections from the
 * application's {@link DataSource}. Each caller closes the connection it borrows and sets its
 * own auto-commit mode, so nothing is configured here.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  @Override
  public String toString() {
    return "DataSourceConnectionProvider[" + dataSource.getClass().getSimpleName() + "]";
  }
}
