package dev.rune.scheduler.database;

import dev.rune.scheduler.exceptions.ScheduleConflictException;
import dev.rune.scheduler.schedule.AttemptOutcome;
import dev.rune.scheduler.schedule.ScheduleRecord;
import dev.rune.scheduler.workflow.TriggerType;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class ScheduleDAO {
  private static final Logger logger = LoggerFactory.getLogger(ScheduleDAO.class);

  private static final String UNIQUE_VIOLATION = "23505";

  private static final String COLUMNS =
      """
      id, workflow_id, interval_seconds, start_at_epoch_ms, next_run_at_epoch_ms,
      last_run_at_epoch_ms, is_active, run_count, failure_count, last_error,
      created_at, updated_at
      """;

  private final HikariDataSource dataSource;
  private final String schema;
  private final int queryTimeoutSeconds;

  ScheduleDAO(HikariDataSource ds, String schema, int queryTimeoutSeconds) {
    this.dataSource = ds;
    this.schema = Objects.requireNonNull(schema);
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  private Connection connection() throws SQLException {
    if (dataSource.isClosed()) {
      throw new IllegalStateException("Database is closed!");
    }
    return dataSource.getConnection();
  }

  private PreparedStatement prepare(Connection conn, String sql) throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    ps.setQueryTimeout(queryTimeoutSeconds);
    return ps;
  }

  /**
   * Inserts the schedule and marks its workflow as scheduled in one transaction. Nothing is kept
   * if either write fails.
   */
  ScheduleRecord insertScheduleAndMark(
      long workflowId,
      int intervalSeconds,
      Instant startAt,
      Instant nextRunAt,
      boolean active,
      Instant now,
      WorkflowDAO workflowDAO)
      throws SQLException {
    try (Connection conn = connection()) {
      conn.setAutoCommit(false);

      try {
        var record =
            insertScheduleTxn(conn, workflowId, intervalSeconds, startAt, nextRunAt, active, now);
        workflowDAO.setTriggerTypeTxn(conn, workflowId, TriggerType.SCHEDULED);
        conn.commit();
        return record;
      } catch (Exception e) {
        try {
          conn.rollback();
        } catch (SQLException rollbackEx) {
          e.addSuppressed(rollbackEx);
        }
        throw e;
      }
    }
  }

  private ScheduleRecord insertScheduleTxn(
      Connection conn,
      long workflowId,
      int intervalSeconds,
      Instant startAt,
      Instant nextRunAt,
      boolean active,
      Instant now)
      throws SQLException {
    var sql =
        """
        INSERT INTO %s.scheduler_schedules (
          workflow_id, interval_seconds, start_at_epoch_ms, next_run_at_epoch_ms,
          is_active, run_count, failure_count, created_at, updated_at
        ) VALUES (?, ?, ?, ?, ?, 0, 0, ?, ?)
        RETURNING %s
        """
            .formatted(schema, COLUMNS);

    try (var ps = prepare(conn, sql)) {
      ps.setLong(1, workflowId);
      ps.setInt(2, intervalSeconds);
      ps.setLong(3, startAt.toEpochMilli());
      ps.setLong(4, nextRunAt.toEpochMilli());
      ps.setBoolean(5, active);
      ps.setLong(6, now.toEpochMilli());
      ps.setLong(7, now.toEpochMilli());
      try (var rs = ps.executeQuery()) {
        rs.next();
        return fromResultSet(rs);
      }
    } catch (SQLException e) {
      if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
        throw new ScheduleConflictException(workflowId);
      }
      throw e;
    }
  }

  Optional<ScheduleRecord> findById(long scheduleId) throws SQLException {
    var sql = "SELECT %s FROM %s.scheduler_schedules WHERE id = ?".formatted(COLUMNS, schema);
    return findOne(sql, scheduleId);
  }

  Optional<ScheduleRecord> findByWorkflowId(long workflowId) throws SQLException {
    var sql =
        "SELECT %s FROM %s.scheduler_schedules WHERE workflow_id = ?".formatted(COLUMNS, schema);
    return findOne(sql, workflowId);
  }

  private Optional<ScheduleRecord> findOne(String sql, long key) throws SQLException {
    try (var conn = connection();
        var ps = prepare(conn, sql)) {
      ps.setLong(1, key);
      try (var rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
      }
    }
  }

  Optional<ScheduleRecord> updateSchedule(
      long scheduleId,
      int intervalSeconds,
      Instant startAt,
      Instant nextRunAt,
      boolean active,
      Instant now)
      throws SQLException {
    var sql =
        """
        UPDATE %s.scheduler_schedules
        SET interval_seconds = ?,
            start_at_epoch_ms = ?,
            next_run_at_epoch_ms = ?,
            is_active = ?,
            updated_at = ?
        WHERE id = ?
        RETURNING %s
        """
            .formatted(schema, COLUMNS);

    try (var conn = connection();
        var ps = prepare(conn, sql)) {
      ps.setInt(1, intervalSeconds);
      ps.setLong(2, startAt.toEpochMilli());
      ps.setLong(3, nextRunAt.toEpochMilli());
      ps.setBoolean(4, active);
      ps.setLong(5, now.toEpochMilli());
      ps.setLong(6, scheduleId);
      try (var rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
      }
    }
  }

  /**
   * Deletes the schedule and returns its workflow to manual triggering in one transaction. The
   * marker is only written when a row was deleted.
   */
  boolean deleteScheduleAndUnmark(long scheduleId, long workflowId, WorkflowDAO workflowDAO)
      throws SQLException {
    var sql = "DELETE FROM %s.scheduler_schedules WHERE id = ?".formatted(schema);
    try (Connection conn = connection()) {
      conn.setAutoCommit(false);

      try {
        boolean deleted;
        try (var ps = prepare(conn, sql)) {
          ps.setLong(1, scheduleId);
          deleted = ps.executeUpdate() > 0;
        }
        if (deleted) {
          workflowDAO.setTriggerTypeTxn(conn, workflowId, TriggerType.MANUAL);
        }
        conn.commit();
        return deleted;
      } catch (Exception e) {
        try {
          conn.rollback();
        } catch (SQLException rollbackEx) {
          e.addSuppressed(rollbackEx);
        }
        throw e;
      }
    }
  }

  boolean deleteScheduleForWorkflow(long workflowId) throws SQLException {
    var sql = "DELETE FROM %s.scheduler_schedules WHERE workflow_id = ?".formatted(schema);
    return executeDelete(sql, workflowId);
  }

  private boolean executeDelete(String sql, long key) throws SQLException {
    try (var conn = connection();
        var ps = prepare(conn, sql)) {
      ps.setLong(1, key);
      return ps.executeUpdate() > 0;
    }
  }

  List<ScheduleRecord> listDueSchedules(Instant horizon) throws SQLException {
    var sql =
        """
        SELECT %s FROM %s.scheduler_schedules
        WHERE is_active = TRUE AND next_run_at_epoch_ms <= ?
        ORDER BY next_run_at_epoch_ms ASC, id ASC
        """
            .formatted(COLUMNS, schema);

    try (var conn = connection();
        var ps = prepare(conn, sql)) {
      ps.setLong(1, horizon.toEpochMilli());
      return readAll(ps);
    }
  }

  List<ScheduleRecord> listSchedulesForWorkflows(Collection<Long> workflowIds)
      throws SQLException {
    if (workflowIds.isEmpty()) {
      return List.of();
    }
    var sql =
        """
        SELECT %s FROM %s.scheduler_schedules
        WHERE workflow_id = ANY(?)
        ORDER BY next_run_at_epoch_ms ASC, id ASC
        """
            .formatted(COLUMNS, schema);

    try (var conn = connection();
        var ps = prepare(conn, sql)) {
      ps.setArray(1, conn.createArrayOf("bigint", workflowIds.toArray()));
      return readAll(ps);
    }
  }

  List<ScheduleRecord> listSchedules(boolean activeOnly) throws SQLException {
    var sql =
        "SELECT %s FROM %s.scheduler_schedules %s ORDER BY next_run_at_epoch_ms ASC, id ASC"
            .formatted(COLUMNS, schema, activeOnly ? "WHERE is_active = TRUE" : "");

    try (var conn = connection();
        var ps = prepare(conn, sql)) {
      return readAll(ps);
    }
  }

  Optional<ScheduleRecord> recordOutcome(
      long scheduleId, AttemptOutcome outcome, int maxConsecutiveFailures) throws SQLException {
    // SET expressions see the pre-update row, so failure_count + 1 is the new count
    var sql =
        """
        UPDATE %s.scheduler_schedules
        SET last_run_at_epoch_ms = ?,
            run_count = run_count + 1,
            failure_count = CASE WHEN ? THEN 0 ELSE failure_count + 1 END,
            last_error = CASE WHEN ? THEN NULL ELSE ? END,
            is_active = CASE
                WHEN NOT ? AND failure_count + 1 >= ? THEN FALSE
                ELSE is_active
            END,
            next_run_at_epoch_ms = ? + interval_seconds * 1000::bigint,
            updated_at = ?
        WHERE id = ?
        RETURNING %s
        """
            .formatted(schema, COLUMNS);

    long at = outcome.attemptedAt().toEpochMilli();
    try (var conn = connection();
        var ps = prepare(conn, sql)) {
      ps.setLong(1, at);
      ps.setBoolean(2, outcome.success());
      ps.setBoolean(3, outcome.success());
      if (outcome.error() == null) {
        ps.setNull(4, Types.VARCHAR);
      } else {
        ps.setString(4, outcome.error());
      }
      ps.setBoolean(5, outcome.success());
      ps.setInt(6, maxConsecutiveFailures);
      ps.setLong(7, at);
      ps.setLong(8, at);
      ps.setLong(9, scheduleId);
      try (var rs = ps.executeQuery()) {
        if (!rs.next()) {
          logger.debug("Schedule {} vanished before its outcome was recorded", scheduleId);
          return Optional.empty();
        }
        return Optional.of(fromResultSet(rs));
      }
    }
  }

  private static List<ScheduleRecord> readAll(PreparedStatement ps) throws SQLException {
    List<ScheduleRecord> records = new ArrayList<>();
    try (var rs = ps.executeQuery()) {
      while (rs.next()) {
        records.add(fromResultSet(rs));
      }
    }
    return records;
  }

  private static ScheduleRecord fromResultSet(ResultSet rs) throws SQLException {
    long lastRun = rs.getLong("last_run_at_epoch_ms");
    Instant lastRunAt = rs.wasNull() ? null : Instant.ofEpochMilli(lastRun);
    return new ScheduleRecord(
        rs.getLong("id"),
        rs.getLong("workflow_id"),
        rs.getInt("interval_seconds"),
        Instant.ofEpochMilli(rs.getLong("start_at_epoch_ms")),
        Instant.ofEpochMilli(rs.getLong("next_run_at_epoch_ms")),
        lastRunAt,
        rs.getBoolean("is_active"),
        rs.getLong("run_count"),
        rs.getInt("failure_count"),
        rs.getString("last_error"),
        Instant.ofEpochMilli(rs.getLong("created_at")),
        Instant.ofEpochMilli(rs.getLong("updated_at")));
  }
}
