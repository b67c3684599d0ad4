/* Repute © 2025 Repute Devs — MIT */
package dev.repute.ledger;

/** Result of reversing a vote by ID. */
public enum ReversalStatus {
  OK,
  ALREADY_REVERSED,
  NOT_FOUND
}
