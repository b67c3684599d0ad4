/* Repute © 2025 Repute Devs — MIT */
package dev.repute.api;

/**
 * Canonical error/result codes produced by Repute subsystems.
 *
 * <p>Codes are attached to {@link OperationResult}s, structured log lines and metrics so operators
 * can tell a rejected request from a no-op and from an infrastructure failure.
 */
public enum ErrorCode {
  /** Vote amount failed validation (zero, negative or not a number). */
  INVALID_AMOUNT,

  /** A command argument could not be parsed. */
  INVALID_ARGUMENT,

  /** Caller lacks administrator rights for the command. */
  PERMISSION_DENIED,

  /** Referenced vote ID does not exist in the ledger. */
  UNKNOWN_VOTE,

  /** Vote was already reversed; reversal is idempotent. */
  ALREADY_REVERSED,

  /** Reaction targeted a message that is not a tracked voting message. */
  UNTRACKED_MESSAGE,

  /** Participant tried to vote on their own reputation. */
  SELF_VOTE,

  /** Participant is excluded from voting. */
  VOTER_DISABLED,

  /** More than one active vote matched a removal; the most recent one was reversed. */
  AMBIGUOUS_VOTE_STATE,

  /** Snapshot could not be written or read. */
  PERSISTENCE_FAILURE,

  /** Audit sink or notice could not be delivered. */
  NOTIFICATION_FAILURE,

  /** Chat platform call failed. */
  GATEWAY_FAILURE,

  /** Storage rejected a duplicate key. */
  DUPLICATE_KEY,

  /** Database connection pool lost connectivity to the server. */
  CONNECTION_LOST,

  /** Exhausted retry budget on a deadlock/timeout protected block. */
  DEADLOCK_RETRY_EXHAUSTED;
}
