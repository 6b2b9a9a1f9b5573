package dev.rune.scheduler.database;

import dev.rune.scheduler.credentials.CredentialRecord;

import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

import com.zaxxer.hikari.HikariDataSource;

class CredentialDAO {

  private final HikariDataSource dataSource;
  private final String table;
  private final int queryTimeoutSeconds;

  CredentialDAO(HikariDataSource ds, String qualifiedTable, int queryTimeoutSeconds) {
    this.dataSource = ds;
    this.table = Objects.requireNonNull(qualifiedTable);
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  /** Credential ids are numeric in the store; any other reference cannot match a row. */
  Optional<CredentialRecord> getCredential(String credentialId) throws SQLException {
    long id;
    try {
      id = Long.parseLong(credentialId.trim());
    } catch (NumberFormatException e) {
      return Optional.empty();
    }

    var sql =
        """
        SELECT id, name, credential_type::text AS credential_type, credential_data
        FROM %s WHERE id = ?
        """
            .formatted(table);
    try (var conn = dataSource.getConnection();
        var ps = conn.prepareStatement(sql)) {
      ps.setQueryTimeout(queryTimeoutSeconds);
      ps.setLong(1, id);
      try (var rs = ps.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(
            new CredentialRecord(
                String.valueOf(rs.getLong("id")),
                rs.getString("name"),
                rs.getString("credential_type"),
                Objects.requireNonNullElse(rs.getString("credential_data"), "")));
      }
    }
  }
}
