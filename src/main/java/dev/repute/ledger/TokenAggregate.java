/* Repute © 2025 Repute Devs — MIT */
package dev.repute.ledger;

import dev.repute.api.VoteType;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/** Mutable per-token counters; guarded by the owning author's monitor. */
final class TokenAggregate {
  private String symbol;
  private int good;
  private int bad;
  private final Set<Long> goodVoters = new LinkedHashSet<>();
  private final Set<Long> badVoters = new LinkedHashSet<>();

  TokenAggregate(String symbol) {
    this.symbol = symbol == null ? "" : symbol;
  }

  String symbol() {
    return symbol;
  }

  void symbol(String symbol) {
    this.symbol = symbol == null ? "" : symbol;
  }

  int count(VoteType type) {
    return type == VoteType.GOOD ? good : bad;
  }

  Set<Long> voters(VoteType type) {
    return type == VoteType.GOOD ? goodVoters : badVoters;
  }

  void increment(VoteType type) {
    if (type == VoteType.GOOD) {
      good++;
    } else {
      bad++;
    }
  }

  void decrement(VoteType type) {
    if (type == VoteType.GOOD) {
      good = Math.max(0, good - 1);
    } else {
      bad = Math.max(0, bad - 1);
    }
  }

  /** Restores persisted counters verbatim; only used while loading a snapshot. */
  void load(int good, int bad, Iterable<Long> goodVoters, Iterable<Long> badVoters) {
    this.good = Math.max(0, good);
    this.bad = Math.max(0, bad);
    this.goodVoters.clear();
    this.badVoters.clear();
    goodVoters.forEach(this.goodVoters::add);
    for (Long voter : badVoters) {
      // A voter listed under both stances keeps the good one.
      if (!this.goodVoters.contains(voter)) {
        this.badVoters.add(voter);
      }
    }
  }

  TokenView view(String address) {
    return new TokenView(
        address, symbol, good, bad, new ArrayList<>(goodVoters), new ArrayList<>(badVoters));
  }
}
