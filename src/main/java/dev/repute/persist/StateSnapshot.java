/* Repute © 2025 Repute Devs — MIT */
package dev.repute.persist;

import dev.repute.ledger.LedgerSnapshot;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything the service persists.
 *
 * @param ledger aggregates and the full vote log
 * @param disabledVoters participants excluded from voting
 * @param auditSinks guild ID to audit channel ID
 */
public record StateSnapshot(
    LedgerSnapshot ledger, List<Long> disabledVoters, Map<Long, Long> auditSinks) {

  public StateSnapshot {
    disabledVoters = List.copyOf(disabledVoters);
    auditSinks = new TreeMap<>(auditSinks);
  }

  public static StateSnapshot empty() {
    return new StateSnapshot(LedgerSnapshot.empty(), List.of(), Map.of());
  }
}
