package dev.rune.scheduler.database;

import dev.rune.scheduler.Constants;
import dev.rune.scheduler.config.SchedulerConfig;
import dev.rune.scheduler.credentials.CredentialRecord;
import dev.rune.scheduler.credentials.CredentialStore;
import dev.rune.scheduler.schedule.AttemptOutcome;
import dev.rune.scheduler.schedule.ScheduleRecord;
import dev.rune.scheduler.workflow.WorkflowGraph;
import dev.rune.scheduler.workflow.WorkflowStore;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDBC implementation of the schedule, workflow and credential stores over one HikariCP pool.
 * Every call runs inside {@link DbRetry}, so transient connection and serialization errors are
 * retried before surfacing.
 */
public class SystemDatabase implements ScheduleStore, WorkflowStore, CredentialStore, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(SystemDatabase.class);

  public static String sanitizeSchema(String schema) {
    return quoteIdentifier(Objects.requireNonNullElse(schema, Constants.DB_SCHEMA));
  }

  static String quoteIdentifier(String identifier) {
    return "\"%s\"".formatted(identifier.replace("\0", "").replace("\"", "\"\""));
  }

  private final HikariDataSource dataSource;
  private final String schema;
  private final DbRetry.Options retryOptions;
  private final int queryTimeoutSeconds;

  private final ScheduleDAO scheduleDAO;
  private final WorkflowDAO workflowDAO;
  private final CredentialDAO credentialDAO;

  public SystemDatabase(SchedulerConfig config) {
    this(SystemDatabase.createDataSource(config), Objects.requireNonNull(config), null);
  }

  public SystemDatabase(
      HikariDataSource dataSource, SchedulerConfig config, DbRetry.@Nullable Options retryOptions) {
    this.dataSource = Objects.requireNonNull(dataSource);
    this.schema = sanitizeSchema(config.databaseSchema());
    this.retryOptions = Objects.requireNonNullElse(retryOptions, DbRetry.Options.defaults());
    int queryTimeout = config.queryTimeoutSeconds();
    this.queryTimeoutSeconds = queryTimeout;
    scheduleDAO = new ScheduleDAO(dataSource, schema, queryTimeout);
    workflowDAO =
        new WorkflowDAO(
            dataSource, schema + "." + quoteIdentifier(config.workflowsTable()), queryTimeout);
    credentialDAO =
        new CredentialDAO(
            dataSource, schema + "." + quoteIdentifier(config.credentialsTable()), queryTimeout);
  }

  public HikariDataSource dataSource() {
    return dataSource;
  }

  public String schema() {
    return schema;
  }

  @Override
  public void close() {
    dataSource.close();
  }

  // schedules

  @Override
  public ScheduleRecord insertScheduleAndMark(
      long workflowId,
      int intervalSeconds,
      Instant startAt,
      Instant nextRunAt,
      boolean active,
      Instant now) {
    return DbRetry.call(
        () ->
            scheduleDAO.insertScheduleAndMark(
                workflowId, intervalSeconds, startAt, nextRunAt, active, now, workflowDAO),
        retryOptions);
  }

  @Override
  public Optional<ScheduleRecord> findById(long scheduleId) {
    return DbRetry.call(() -> scheduleDAO.findById(scheduleId), retryOptions);
  }

  @Override
  public Optional<ScheduleRecord> findByWorkflowId(long workflowId) {
    return DbRetry.call(() -> scheduleDAO.findByWorkflowId(workflowId), retryOptions);
  }

  @Override
  public Optional<ScheduleRecord> updateSchedule(
      long scheduleId,
      int intervalSeconds,
      Instant startAt,
      Instant nextRunAt,
      boolean active,
      Instant now) {
    return DbRetry.call(
        () ->
            scheduleDAO.updateSchedule(
                scheduleId, intervalSeconds, startAt, nextRunAt, active, now),
        retryOptions);
  }

  @Override
  public boolean deleteScheduleAndUnmark(long scheduleId, long workflowId) {
    return DbRetry.call(
        () -> scheduleDAO.deleteScheduleAndUnmark(scheduleId, workflowId, workflowDAO),
        retryOptions);
  }

  @Override
  public boolean deleteScheduleForWorkflow(long workflowId) {
    return DbRetry.call(() -> scheduleDAO.deleteScheduleForWorkflow(workflowId), retryOptions);
  }

  @Override
  public List<ScheduleRecord> listDueSchedules(Instant horizon) {
    return DbRetry.call(() -> scheduleDAO.listDueSchedules(horizon), retryOptions);
  }

  @Override
  public List<ScheduleRecord> listSchedulesForWorkflows(Collection<Long> workflowIds) {
    return DbRetry.call(() -> scheduleDAO.listSchedulesForWorkflows(workflowIds), retryOptions);
  }

  @Override
  public List<ScheduleRecord> listSchedules(boolean activeOnly) {
    return DbRetry.call(() -> scheduleDAO.listSchedules(activeOnly), retryOptions);
  }

  @Override
  public Optional<ScheduleRecord> recordOutcome(
      long scheduleId, AttemptOutcome outcome, int maxConsecutiveFailures) {
    return DbRetry.call(
        () -> scheduleDAO.recordOutcome(scheduleId, outcome, maxConsecutiveFailures),
        retryOptions);
  }

  /** Borrows a pooled connection and runs {@code SELECT 1} on it, without retrying. */
  @Override
  public boolean isHealthy() {
    if (dataSource.isClosed()) {
      return false;
    }
    try (var conn = dataSource.getConnection();
        var stmt = conn.createStatement()) {
      stmt.setQueryTimeout(queryTimeoutSeconds);
      stmt.execute("SELECT 1");
      return true;
    } catch (SQLException e) {
      logger.error("Database health check failed: {}", e.getMessage());
      return false;
    }
  }

  // workflows

  @Override
  public Optional<WorkflowGraph> getWorkflowGraph(long workflowId) {
    return DbRetry.call(() -> workflowDAO.getWorkflowGraph(workflowId), retryOptions);
  }

  // credentials

  @Override
  public Optional<CredentialRecord> getCredential(String credentialId) {
    return DbRetry.call(() -> credentialDAO.getCredential(credentialId), retryOptions);
  }

  public static HikariDataSource createDataSource(String url, String user, String password) {
    return createDataSource(url, user, password, 0, 0);
  }

  public static HikariDataSource createDataSource(
      String url, String user, String password, int poolSize, int timeout) {
    HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setJdbcUrl(url);
    hikariConfig.setUsername(user);
    hikariConfig.setPassword(password);
    hikariConfig.setMaximumPoolSize(poolSize > 0 ? poolSize : 2);
    hikariConfig.setPoolName("rune-scheduler");
    if (timeout > 0) {
      hikariConfig.setConnectionTimeout(timeout);
    }

    return new HikariDataSource(hikariConfig);
  }

  public static HikariDataSource createDataSource(SchedulerConfig config) {
    if (config.dataSource() != null) {
      return config.dataSource();
    }
    if (config.databaseUrl() == null || config.databaseUrl().isEmpty()) {
      throw new IllegalArgumentException(
          "No database URL configured; set %s or %s"
              .formatted(Constants.SCHEDULER_JDBC_URL_ENV_VAR, Constants.POSTGRES_HOST_ENV_VAR));
    }

    return createDataSource(
        config.databaseUrl(),
        config.dbUser(),
        config.dbPassword(),
        config.maximumPoolSize(),
        config.connectionTimeout());
  }
}
