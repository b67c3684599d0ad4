/* Repute © 2025 Repute Devs — MIT */
package dev.repute.persist;

import dev.repute.api.ErrorCode;
import dev.repute.core.SqlErrorCodes;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps records as rows of {@code repute_snapshots} in MariaDB.
 *
 * <p>Each write is a single upsert statement, so a record is replaced atomically. Transient SQL
 * failures (deadlocks, lost connections) are retried three times with a short backoff.
 */
public final class JdbcBlobStore implements BlobStore {
  private static final Logger LOG = LoggerFactory.getLogger("repute");
  private static final int ATTEMPTS = 3;

  static final String CREATE_TABLE =
      "CREATE TABLE IF NOT EXISTS repute_snapshots ("
          + "name VARCHAR(64) NOT NULL PRIMARY KEY, "
          + "body LONGTEXT NOT NULL, "
          + "updated_at_s BIGINT NOT NULL"
          + ") ENGINE=InnoDB DEFAULT CHARSET=utf8mb4";
  static final String SELECT = "SELECT body FROM repute_snapshots WHERE name=?";
  static final String UPSERT =
      "INSERT INTO repute_snapshots(name, body, updated_at_s) VALUES(?,?,?) "
          + "ON DUPLICATE KEY UPDATE body=VALUES(body), updated_at_s=VALUES(updated_at_s)";

  private final DataSource dataSource;
  private final Clock clock;

  public JdbcBlobStore(DataSource dataSource) {
    this(dataSource, Clock.systemUTC());
  }

  JdbcBlobStore(DataSource dataSource, Clock clock) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Creates the snapshot table when missing. */
  public void ensureSchema() throws StorageException {
    withRetry(
        "persist.jdbc.schema",
        () -> {
          try (Connection c = dataSource.getConnection();
              Statement st = c.createStatement()) {
            st.executeUpdate(CREATE_TABLE);
          }
          return null;
        });
  }

  @Override
  public Optional<String> read(String name) throws StorageException {
    return withRetry(
        "persist.jdbc.read",
        () -> {
          try (Connection c = dataSource.getConnection();
              PreparedStatement ps = c.prepareStatement(SELECT)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
              return rs.next() ? Optional.of(rs.getString(1)) : Optional.<String>empty();
            }
          }
        });
  }

  @Override
  public void write(String name, String body) throws StorageException {
    withRetry(
        "persist.jdbc.write",
        () -> {
          try (Connection c = dataSource.getConnection();
              PreparedStatement ps = c.prepareStatement(UPSERT)) {
            ps.setString(1, name);
            ps.setString(2, body);
            ps.setLong(3, clock.instant().getEpochSecond());
            ps.executeUpdate();
          }
          return null;
        });
  }

  private <T> T withRetry(String op, SqlAction<T> action) throws StorageException {
    SQLException last = null;
    ErrorCode code = ErrorCode.CONNECTION_LOST;
    for (int i = 0; i < ATTEMPTS; i++) {
      try {
        return action.run();
      } catch (SQLException e) {
        last = e;
        code = SqlErrorCodes.classify(e);
        LOG.warn(
            "(repute) code={} op={} attempt={} message={} sqlState={} vendor={}",
            code,
            op,
            i + 1,
            e.getMessage(),
            e.getSQLState(),
            e.getErrorCode());
        if (!SqlErrorCodes.isTransient(code)) {
          break;
        }
        try {
          Thread.sleep(50L * (i + 1));
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          break;
        }
      }
    }
    throw new StorageException(code, op + " failed: " + last.getMessage(), last);
  }

  @FunctionalInterface
  private interface SqlAction<T> {
    T run() throws SQLException;
  }
}
