/* Repute © 2025 Repute Devs — MIT */
package dev.repute.core;

import dev.repute.api.ErrorCode;
import java.sql.SQLException;
import java.util.Locale;

/** Maps JDBC {@link SQLException} instances to Repute {@link ErrorCode}s. */
public final class SqlErrorCodes {

  private SqlErrorCodes() {}

  /**
   * Classifies a SQL exception into one of the canonical {@link ErrorCode} values.
   *
   * @param e SQL exception thrown by MariaDB/MySQL
   * @return mapped {@link ErrorCode}, defaulting to {@link ErrorCode#CONNECTION_LOST}
   */
  public static ErrorCode classify(SQLException e) {
    if (e == null) {
      return ErrorCode.CONNECTION_LOST;
    }
    String state = e.getSQLState();
    if (state != null && state.length() >= 2) {
      switch (state.substring(0, 2)) {
        case "40":
        case "41":
          return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
        case "23":
          return ErrorCode.DUPLICATE_KEY;
        case "08":
        case "28":
          return ErrorCode.CONNECTION_LOST;
        default:
          break;
      }
    }

    int vendor = e.getErrorCode();
    if (vendor == 1213 || vendor == 1205) {
      return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
    }
    if (vendor == 1022 || vendor == 1062 || vendor == 1586 || vendor == 1761) {
      return ErrorCode.DUPLICATE_KEY;
    }

    String message = e.getMessage();
    if (message != null) {
      String lower = message.toLowerCase(Locale.ROOT);
      if (lower.contains("deadlock") || lower.contains("lock wait timeout")) {
        return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
      }
      if (lower.contains("duplicate") || lower.contains("unique constraint")) {
        return ErrorCode.DUPLICATE_KEY;
      }
    }
    return ErrorCode.CONNECTION_LOST;
  }

  /** Whether retrying the same statement can succeed. */
  public static boolean isTransient(ErrorCode code) {
    return code == ErrorCode.DEADLOCK_RETRY_EXHAUSTED || code == ErrorCode.CONNECTION_LOST;
  }
}
