package dev.rune.scheduler.migrations;

import dev.rune.scheduler.config.SchedulerConfig;
import dev.rune.scheduler.database.SystemDatabase;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and upgrades the scheduler's own tables. Applied versions are tracked in {@code
 * scheduler_migrations}; running the migrations again is a no-op.
 */
public class MigrationManager {

  private static final Logger logger = LoggerFactory.getLogger(MigrationManager.class);
  private static final List<String> IGNORABLE_SQL_STATES =
      List.of(
          "42P07", // duplicate_table
          "42710", // duplicate_object
          "42701", // duplicate_column
          "42P06", // duplicate_schema
          "23505" // unique_violation
          );

  public static void runMigrations(SchedulerConfig config) {
    Objects.requireNonNull(config, "SchedulerConfig must not be null");

    if (config.dataSource() != null) {
      runMigrations(config.dataSource(), config.databaseSchema());
    } else {
      createDatabaseIfNotExists(config);
      try (var ds = SystemDatabase.createDataSource(config)) {
        runMigrations(ds, config.databaseSchema());
      }
    }
  }

  public static void runMigrations(HikariDataSource ds, String schema) {
    Objects.requireNonNull(ds, "Data Source must not be null");
    schema = SystemDatabase.sanitizeSchema(schema);

    try (var conn = ds.getConnection()) {
      ensureSchema(conn, schema);
      ensureMigrationTable(conn, schema);
      applyMigrations(conn, schema, getMigrations(schema));
    } catch (SQLException e) {
      throw new RuntimeException("Failed to run scheduler migrations", e);
    }
  }

  public static void createDatabaseIfNotExists(SchedulerConfig config) {
    Objects.requireNonNull(config, "SchedulerConfig must not be null");
    if (config.dataSource() != null) {
      logger.debug("SchedulerConfig specifies data source, skipping createDatabaseIfNotExists");
    } else {
      createDatabaseIfNotExists(config.databaseUrl(), config.dbUser(), config.dbPassword());
    }
  }

  public static void createDatabaseIfNotExists(String url, String user, String password) {
    Objects.requireNonNull(url, "database url must not be null");
    Objects.requireNonNull(user, "database user must not be null");

    var pair = extractDbAndPostgresUrl(url);

    try (var adminDS = SystemDatabase.createDataSource(pair.url(), user, password);
        var conn = adminDS.getConnection()) {
      try (var stmt = conn.prepareStatement("SELECT 1 FROM pg_database WHERE datname = ?")) {
        stmt.setString(1, pair.database());
        try (ResultSet rs = stmt.executeQuery()) {
          if (rs.next()) {
            logger.debug("Database '{}' already exists", pair.database());
            return;
          }
        }
      }

      logger.info("Creating '{}' database", pair.database());
      try (Statement stmt = conn.createStatement()) {
        stmt.executeUpdate("CREATE DATABASE \"" + pair.database().replace("\"", "\"\"") + "\"");
      }
    } catch (SQLException e) {
      // the database may exist already and only the admin connection be refused
      logger.warn("Could not check or create database {}: {}", pair.database(), e.getMessage());
    }
  }

  public record UrlPair(String url, String database) {}

  public static UrlPair extractDbAndPostgresUrl(String url) {
    int qm = Objects.requireNonNull(url, "database url must not be null").indexOf('?');
    var base = qm >= 0 ? url.substring(0, qm) : url;
    var params = qm >= 0 ? url.substring(qm) : "";
    int slash = base.lastIndexOf('/');
    if (slash < "jdbc:postgresql://".length()) {
      throw new IllegalArgumentException(String.format("JDBC URL %s is not valid", url));
    }

    var newUrl = base.substring(0, slash + 1) + "postgres" + params;
    var databaseName = base.substring(slash + 1);
    return new UrlPair(newUrl, databaseName);
  }

  static void ensureSchema(Connection conn, String schema) throws SQLException {
    try (var stmt = conn.createStatement()) {
      stmt.execute("CREATE SCHEMA IF NOT EXISTS %s".formatted(schema));
    }
  }

  static void ensureMigrationTable(Connection conn, String schema) throws SQLException {
    try (var stmt = conn.createStatement()) {
      stmt.execute(
          "CREATE TABLE IF NOT EXISTS %s.scheduler_migrations (version BIGINT NOT NULL PRIMARY KEY)"
              .formatted(schema));
    }
  }

  public static int getCurrentVersion(Connection conn, String schema) throws SQLException {
    var sql =
        "SELECT version FROM %s.scheduler_migrations ORDER BY version DESC LIMIT 1"
            .formatted(schema);
    try (var stmt = conn.createStatement();
        var rs = stmt.executeQuery(sql)) {
      return rs.next() ? rs.getInt("version") : 0;
    }
  }

  static void applyMigrations(Connection conn, String schema, List<String> migrations)
      throws SQLException {
    var lastApplied = getCurrentVersion(conn, schema);

    for (var i = 0; i < migrations.size(); i++) {
      var migrationIndex = i + 1;
      if (migrationIndex <= lastApplied) {
        continue;
      }

      logger.info("Applying scheduler schema migration {}", migrationIndex);
      try (var stmt = conn.createStatement()) {
        stmt.execute(migrations.get(i));
      } catch (SQLException e) {
        if (IGNORABLE_SQL_STATES.contains(e.getSQLState())) {
          logger.warn(
              "Ignoring migration {} error {}; it was likely already applied",
              migrationIndex,
              e.getSQLState());
        } else {
          throw new RuntimeException("Failed to run migration %d".formatted(migrationIndex), e);
        }
      }

      int rowCount;
      var updateSql = "UPDATE %s.scheduler_migrations SET version = ?".formatted(schema);
      try (var stmt = conn.prepareStatement(updateSql)) {
        stmt.setLong(1, migrationIndex);
        rowCount = stmt.executeUpdate();
      }
      if (rowCount == 0) {
        var insertSql =
            "INSERT INTO %s.scheduler_migrations (version) VALUES (?)".formatted(schema);
        try (var stmt = conn.prepareStatement(insertSql)) {
          stmt.setLong(1, migrationIndex);
          stmt.executeUpdate();
        }
      }

      lastApplied = migrationIndex;
    }
  }

  public static List<String> getMigrations(String schema) {
    Objects.requireNonNull(schema);
    return List.of(migration1, migration2).stream().map(m -> m.formatted(schema)).toList();
  }

  static final String migration1 =
      """
      CREATE TABLE %1$s.scheduler_schedules (
          id BIGSERIAL PRIMARY KEY,
          workflow_id BIGINT NOT NULL,
          interval_seconds INTEGER NOT NULL
              CHECK (interval_seconds > 0 AND interval_seconds <= 31536000),
          start_at_epoch_ms BIGINT NOT NULL,
          next_run_at_epoch_ms BIGINT NOT NULL,
          last_run_at_epoch_ms BIGINT,
          is_active BOOLEAN NOT NULL DEFAULT TRUE,
          run_count BIGINT NOT NULL DEFAULT 0,
          failure_count INTEGER NOT NULL DEFAULT 0,
          last_error TEXT,
          created_at BIGINT NOT NULL DEFAULT (EXTRACT(epoch FROM now()) * 1000::numeric)::bigint,
          updated_at BIGINT NOT NULL DEFAULT (EXTRACT(epoch FROM now()) * 1000::numeric)::bigint,
          CONSTRAINT uq_scheduler_schedules_workflow_id UNIQUE (workflow_id)
      );
      """;

  static final String migration2 =
      """
      CREATE INDEX idx_scheduler_schedules_due
          ON %1$s.scheduler_schedules (is_active, next_run_at_epoch_ms);
      """;
}
