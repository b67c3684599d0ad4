/* Repute © 2025 Repute Devs — MIT */
package dev.repute.ledger;

/** What {@link ReputationStore#applyVote} did to the aggregates. */
public enum ApplyOutcome {
  /** Voter had no stance on the token; one counter was incremented. */
  FRESH,
  /** Voter held the opposite stance; it was removed before the new one was added. */
  SWITCHED,
  /** Voter already held this stance; nothing changed. */
  UNCHANGED
}
