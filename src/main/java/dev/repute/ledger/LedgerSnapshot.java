/* Repute © 2025 Repute Devs — MIT */
package dev.repute.ledger;

import java.util.List;

/**
 * Point-in-time copy of the ledger.
 *
 * @param users every participant aggregate
 * @param votes the full log in creation order, reversed records included
 */
public record LedgerSnapshot(List<UserView> users, List<VoteRecord> votes) {

  public LedgerSnapshot {
    users = List.copyOf(users);
    votes = List.copyOf(votes);
  }

  public static LedgerSnapshot empty() {
    return new LedgerSnapshot(List.of(), List.of());
  }

  /** Records that still count. */
  public List<VoteRecord> activeVotes() {
    return votes.stream().filter(v -> !v.reversed()).toList();
  }
}
