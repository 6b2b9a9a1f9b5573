package dev.rune.scheduler.database;

import dev.rune.scheduler.workflow.TriggerType;
import dev.rune.scheduler.workflow.WorkflowGraph;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.zaxxer.hikari.HikariDataSource;

/** Reads workflow documents from the platform's workflow table and maintains its trigger marker. */
class WorkflowDAO {

  private final HikariDataSource dataSource;
  private final String table;
  private final int queryTimeoutSeconds;

  WorkflowDAO(HikariDataSource ds, String qualifiedTable, int queryTimeoutSeconds) {
    this.dataSource = ds;
    this.table = Objects.requireNonNull(qualifiedTable);
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  Optional<WorkflowGraph> getWorkflowGraph(long workflowId) throws SQLException {
    var sql = "SELECT workflow_data::text AS workflow_data FROM %s WHERE id = ?".formatted(table);
    try (var conn = dataSource.getConnection();
        var ps = conn.prepareStatement(sql)) {
      ps.setQueryTimeout(queryTimeoutSeconds);
      ps.setLong(1, workflowId);
      try (var rs = ps.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        String json = rs.getString("workflow_data");
        if (json == null) {
          return Optional.of(new WorkflowGraph(List.of(), List.of()));
        }
        return Optional.of(WorkflowGraph.fromJson(json));
      }
    }
  }

  void setTriggerTypeTxn(Connection conn, long workflowId, TriggerType triggerType)
      throws SQLException {
    var sql = "UPDATE %s SET trigger_type = ? WHERE id = ?".formatted(table);
    try (var ps = conn.prepareStatement(sql)) {
      ps.setQueryTimeout(queryTimeoutSeconds);
      // Types.OTHER binds to an enum or a text column alike
      ps.setObject(1, triggerType.wireValue(), Types.OTHER);
      ps.setLong(2, workflowId);
      ps.executeUpdate();
    }
  }
}
