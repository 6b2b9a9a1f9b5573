package dev.rune.scheduler;

import dev.rune.scheduler.config.SchedulerConfig;
import dev.rune.scheduler.database.SystemDatabase;

import java.sql.SQLException;

import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Starts one Postgres container per test class and creates the platform-owned workflow and
 * credential tables the scheduler reads.
 */
@Testcontainers(disabledWithoutDocker = true)
public class DbSetupTestBase {

  protected static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:17");

  protected static SchedulerConfig schedulerConfig;
  protected static HikariDataSource dataSource;

  @BeforeAll
  static void onetimeSetup() throws SQLException {
    postgres.start();
    schedulerConfig =
        SchedulerConfig.defaults()
            .withDatabaseUrl(postgres.getJdbcUrl())
            .withDbUser(postgres.getUsername())
            .withDbPassword(postgres.getPassword())
            .withMaximumPoolSize(2);
    dataSource = SystemDatabase.createDataSource(schedulerConfig);
    createPlatformTables();
  }

  @AfterAll
  static void afterAll() {
    if (dataSource != null) {
      dataSource.close();
    }
    postgres.stop();
  }

  static void createPlatformTables() throws SQLException {
    try (var conn = dataSource.getConnection();
        var stmt = conn.createStatement()) {
      stmt.execute(
          """
          DO $$ BEGIN
            CREATE TYPE trigger_type AS ENUM ('manual', 'scheduled', 'webhook');
          EXCEPTION WHEN duplicate_object THEN NULL;
          END $$;
          """);
      stmt.execute(
          """
          DO $$ BEGIN
            CREATE TYPE credential_type AS ENUM ('bearer', 'basic', 'api_key');
          EXCEPTION WHEN duplicate_object THEN NULL;
          END $$;
          """);
      stmt.execute(
          """
          CREATE TABLE IF NOT EXISTS public.workflows (
              id BIGSERIAL PRIMARY KEY,
              name TEXT NOT NULL,
              workflow_data JSONB,
              trigger_type trigger_type
          )
          """);
      stmt.execute(
          """
          CREATE TABLE IF NOT EXISTS public.workflow_credentials (
              id BIGSERIAL PRIMARY KEY,
              name TEXT NOT NULL,
              credential_type credential_type NOT NULL,
              credential_data TEXT
          )
          """);
    }
  }

  protected static long insertWorkflow(String graphJson) throws SQLException {
    try (var conn = dataSource.getConnection();
        var ps =
            conn.prepareStatement(
                "INSERT INTO public.workflows (name, workflow_data) VALUES ('wf', ?::jsonb) RETURNING id")) {
      ps.setString(1, graphJson);
      try (var rs = ps.executeQuery()) {
        rs.next();
        return rs.getLong(1);
      }
    }
  }

  protected static long insertCredential(String name, String type, String payload)
      throws SQLException {
    try (var conn = dataSource.getConnection();
        var ps =
            conn.prepareStatement(
                """
                INSERT INTO public.workflow_credentials (name, credential_type, credential_data)
                VALUES (?, ?::credential_type, ?) RETURNING id
                """)) {
      ps.setString(1, name);
      ps.setString(2, type);
      ps.setString(3, payload);
      try (var rs = ps.executeQuery()) {
        rs.next();
        return rs.getLong(1);
      }
    }
  }

  protected static String triggerTypeOf(long workflowId) throws SQLException {
    try (var conn = dataSource.getConnection();
        var ps =
            conn.prepareStatement("SELECT trigger_type::text FROM public.workflows WHERE id = ?")) {
      ps.setLong(1, workflowId);
      try (var rs = ps.executeQuery()) {
        rs.next();
        return rs.getString(1);
      }
    }
  }

  protected static void truncate(String... tables) throws SQLException {
    try (var conn = dataSource.getConnection();
        var stmt = conn.createStatement()) {
      for (String table : tables) {
        stmt.execute("TRUNCATE TABLE %s RESTART IDENTITY".formatted(table));
      }
    }
  }
}
