/* Repute © 2025 Repute Devs — MIT */
package dev.repute.api;

import java.util.Objects;

/**
 * Rich result describing the outcome of a ledger, persistence or notification operation.
 *
 * @param ok whether the operation succeeded
 * @param code canonical or semantic error code (may be {@code null} on success)
 * @param message optional human-readable message
 */
public record OperationResult(boolean ok, ErrorCode code, String message) {

  /**
   * Creates a success result without additional context.
   *
   * @return success outcome with {@link #ok()} {@code true}
   */
  public static OperationResult success() {
    return new OperationResult(true, null, null);
  }

  /**
   * Success with an additional semantic {@link ErrorCode}, e.g. {@link
   * ErrorCode#AMBIGUOUS_VOTE_STATE}.
   *
   * @param code semantic code describing the success
   * @param message optional human-readable message (may be {@code null})
   * @return success outcome with additional context
   */
  public static OperationResult success(ErrorCode code, String message) {
    return new OperationResult(true, Objects.requireNonNull(code, "code"), message);
  }

  /**
   * Failure with a canonical {@link ErrorCode}.
   *
   * @param code canonical error code
   * @param message optional human-readable message (may be {@code null})
   * @return failure outcome with {@link #ok()} {@code false}
   */
  public static OperationResult failure(ErrorCode code, String message) {
    return new OperationResult(false, Objects.requireNonNull(code, "code"), message);
  }

  /**
   * Canonical constructor enforcing invariant checks.
   *
   * @param ok whether the operation succeeded
   * @param code canonical error code (required on failure)
   * @param message optional human-readable message
   */
  public OperationResult {
    if (!ok && code == null) {
      throw new IllegalArgumentException("failure results require an error code");
    }
  }
}
