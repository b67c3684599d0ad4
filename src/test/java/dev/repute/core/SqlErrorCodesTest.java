/* Repute © 2025 Repute Devs — MIT */
package dev.repute.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.repute.api.ErrorCode;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link SqlErrorCodes}. */
final class SqlErrorCodesTest {

  @Test
  void duplicateSqlStateMapsToDuplicateKey() {
    SQLException sql = new SQLException("Duplicate entry 'x' for key 'PRIMARY'", "23000", 1062);
    assertEquals(ErrorCode.DUPLICATE_KEY, SqlErrorCodes.classify(sql));
  }

  @Test
  void deadlockVendorCodeMapsWithoutSqlState() {
    SQLException sql = new SQLException("Deadlock found", null, 1213);
    assertEquals(ErrorCode.DEADLOCK_RETRY_EXHAUSTED, SqlErrorCodes.classify(sql));
  }

  @Test
  void connectionStateMapsToConnectionLost() {
    SQLException sql = new SQLException("Communications link failure", "08S01", 0);
    assertEquals(ErrorCode.CONNECTION_LOST, SqlErrorCodes.classify(sql));
  }

  @Test
  void onlyLockAndConnectionFailuresAreTransient() {
    assertTrue(SqlErrorCodes.isTransient(ErrorCode.DEADLOCK_RETRY_EXHAUSTED));
    assertTrue(SqlErrorCodes.isTransient(ErrorCode.CONNECTION_LOST));
    assertFalse(SqlErrorCodes.isTransient(ErrorCode.DUPLICATE_KEY));
  }
}
