/* Repute © 2025 Repute Devs — MIT */
package dev.repute.reconcile;

/** What the reconciler did with one reaction event. */
public enum ReconcileOutcome {
  IGNORED_BOT,
  IGNORED_DISABLED,
  IGNORED_GLYPH,
  IGNORED_UNTRACKED,
  /** Author reacted to their own voting message; the reaction is being removed. */
  REJECTED_SELF_VOTE,
  ADDED,
  SWITCHED,
  /** Voter already held this stance; nothing was recorded. */
  DUPLICATE,
  /** Author removed a reaction from their own voting message. */
  IGNORED_SELF,
  /** No active vote matched the removed reaction. */
  NO_MATCH,
  REMOVED,
  /** Unexpected error; logged and counted. */
  FAILED
}
