package io.incentedge.webhooks.benchmark;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.incentedge.webhooks.jdbc.store.AbstractJdbcDeliveryStore;
import io.incentedge.webhooks.jdbc.store.JdbcDeliveryStores;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates a {@link DatabaseSetup} for the requested database type.
 *
 * <p>Supported types: {@code "h2"} (in-memory), {@code "mysql"}, and {@code "postgresql"} (external servers).
 * The bundled {@code schema/*.sql} scripts are applied on startup. External database connection
 * details are read from system properties:
 * <ul>
 *   <li>{@code bench.mysql.url}: default {@code jdbc:mysql://localhost:3306/webhooks_bench}</li>
 *   <li>{@code bench.mysql.user}: default {@code root}</li>
 *   <li>{@code bench.mysql.password}: default {@code ""} (empty)</li>
 *   <li>{@code bench.pg.url}: default {@code jdbc:postgresql://localhost:5432/webhooks_bench}</li>
 *   <li>{@code bench.pg.user}: default {@code postgres}</li>
 *   <li>{@code bench.pg.password}: default {@code postgres}</li>
 * </ul>
 */
final class BenchmarkDataSourceFactory {

  record DatabaseSetup(DataSource dataSource, AbstractJdbcDeliveryStore store) {}

  static DatabaseSetup create(String database, String dbName) {
    DataSource ds = switch (database) {
      case "h2" -> createH2(dbName);
      case "mysql" -> createPooled("bench-mysql",
          System.getProperty("bench.mysql.url", "jdbc:mysql://localhost:3306/webhooks_bench"),
          System.getProperty("bench.mysql.user", "root"),
          System.getProperty("bench.mysql.password", ""));
      case "postgresql" -> createPooled("bench-pg",
          System.getProperty("bench.pg.url", "jdbc:postgresql://localhost:5432/webhooks_bench"),
          System.getProperty("bench.pg.user", "postgres"),
          System.getProperty("bench.pg.password", "postgres"));
      default -> throw new IllegalArgumentException("Unsupported database: " + database);
    };
    applySchema(ds, "/schema/" + database + ".sql");
    return new DatabaseSetup(ds, JdbcDeliveryStores.detect(ds));
  }

  private static DataSource createH2(String dbName) {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + dbName + ";DB_CLOSE_DELAY=-1");
    return ds;
  }

  private static DataSource createPooled(String poolName, String url, String user, String password) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(url);
    config.setUsername(user);
    config.setPassword(password);
    config.setPoolName(poolName);
    config.setMaximumPoolSize(10);
    config.setMinimumIdle(2);
    return new HikariDataSource(config);
  }

  private static void applySchema(DataSource ds, String resource) {
    String script;
    try (InputStream is = BenchmarkDataSourceFactory.class.getResourceAsStream(resource)) {
      if (is == null) throw new IOException("Schema script not found: " + resource);
      script = new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : script.split(";")) {
        if (!sql.isBlank()) {
          stmt.execute(sql.trim());
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to initialize benchmark schema", e);
    }
  }

  /** Removes delivery records, keeping subscriptions. */
  static void clearDeliveries(DataSource ds) {
    execute(ds, "DELETE FROM webhook_delivery");
  }

  static void clearAll(DataSource ds) {
    execute(ds, "DELETE FROM webhook_delivery", "DELETE FROM webhook_subscription_event",
        "DELETE FROM webhook_subscription");
  }

  private static void execute(DataSource ds, String... statements) {
    try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : statements) {
        stmt.execute(sql);
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to clear benchmark tables", e);
    }
  }

  private BenchmarkDataSourceFactory() {}
}
