/* Repute © 2025 Repute Devs — MIT */
package dev.repute.ledger;

import dev.repute.api.VoteType;
import java.util.LinkedHashMap;
import java.util.Map;

/** Mutable per-participant counters; guarded by the participant's author monitor. */
final class UserAggregate {
  private final long userId;
  private int good;
  private int bad;
  private final Map<String, TokenAggregate> tokens = new LinkedHashMap<>();

  UserAggregate(long userId) {
    this.userId = userId;
  }

  long userId() {
    return userId;
  }

  int count(VoteType type) {
    return type == VoteType.GOOD ? good : bad;
  }

  void increment(VoteType type, int amount) {
    if (type == VoteType.GOOD) {
      good += amount;
    } else {
      bad += amount;
    }
  }

  void decrement(VoteType type) {
    if (type == VoteType.GOOD) {
      good = Math.max(0, good - 1);
    } else {
      bad = Math.max(0, bad - 1);
    }
  }

  void load(int good, int bad) {
    this.good = Math.max(0, good);
    this.bad = Math.max(0, bad);
  }

  TokenAggregate token(String address) {
    return tokens.get(address);
  }

  TokenAggregate tokenOrCreate(String address, String symbol) {
    return tokens.computeIfAbsent(address, a -> new TokenAggregate(symbol));
  }

  UserView view() {
    Map<String, TokenView> copy = new LinkedHashMap<>();
    tokens.forEach((address, token) -> copy.put(address, token.view(address)));
    return new UserView(userId, good, bad, copy);
  }
}
