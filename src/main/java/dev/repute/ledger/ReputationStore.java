/* Repute © 2025 Repute Devs — MIT */
package dev.repute.ledger;

import dev.repute.api.VoteType;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-participant and per-token vote aggregates.
 *
 * <p>Not thread-safe per author: callers hold the author's monitor around every mutation and
 * every read of that author's aggregate. The user map itself is concurrent so different authors
 * never contend.
 */
final class ReputationStore {
  private final ConcurrentMap<Long, UserAggregate> users = new ConcurrentHashMap<>();

  UserAggregate getOrCreateUser(long userId) {
    return users.computeIfAbsent(userId, UserAggregate::new);
  }

  UserAggregate find(long userId) {
    return users.get(userId);
  }

  Set<Long> userIds() {
    return users.keySet();
  }

  /** Whether {@code voterId} currently holds the {@code type} stance on the author's token. */
  boolean holds(long authorId, long voterId, String tokenAddress, VoteType type) {
    UserAggregate user = users.get(authorId);
    if (user == null) {
      return false;
    }
    TokenAggregate token = user.token(tokenAddress);
    return token != null && token.voters(type).contains(voterId);
  }

  /**
   * Gives {@code voterId} the {@code type} stance on the author's token.
   *
   * <p>An opposite stance is removed first; an identical one leaves every counter untouched. The
   * token symbol follows the latest vote.
   */
  ApplyOutcome applyVote(
      long authorId, long voterId, String tokenAddress, String symbol, VoteType type) {
    UserAggregate user = getOrCreateUser(authorId);
    TokenAggregate token = user.tokenOrCreate(tokenAddress, symbol);
    if (token.voters(type).contains(voterId)) {
      return ApplyOutcome.UNCHANGED;
    }
    VoteType opposite = type.opposite();
    boolean switched = token.voters(opposite).remove(voterId);
    if (switched) {
      token.decrement(opposite);
      user.decrement(opposite);
    }
    token.voters(type).add(voterId);
    token.increment(type);
    user.increment(type, 1);
    token.symbol(symbol);
    return switched ? ApplyOutcome.SWITCHED : ApplyOutcome.FRESH;
  }

  /**
   * Takes back {@code voterId}'s {@code type} stance.
   *
   * <p>Counters are clamped at zero. Nothing happens when the author or token is unknown.
   *
   * @return whether the voter held the stance
   */
  boolean retractVote(long authorId, long voterId, String tokenAddress, VoteType type) {
    UserAggregate user = users.get(authorId);
    if (user == null) {
      return false;
    }
    TokenAggregate token = user.token(tokenAddress);
    if (token == null) {
      return false;
    }
    boolean held = token.voters(type).remove(voterId);
    token.decrement(type);
    user.decrement(type);
    return held;
  }

  /**
   * Takes back {@code voterId}'s {@code type} stance only if the voter holds it.
   *
   * <p>A record whose stance was already dropped (a switch logged without reversing the old
   * record) leaves every counter untouched.
   *
   * @return whether the voter held the stance
   */
  boolean retractHeldVote(long authorId, long voterId, String tokenAddress, VoteType type) {
    if (!holds(authorId, voterId, tokenAddress, type)) {
      return false;
    }
    return retractVote(authorId, voterId, tokenAddress, type);
  }

  void applyAdminVote(long authorId, VoteType type, int count) {
    if (count <= 0) {
      throw new IllegalArgumentException("count must be positive: " + count);
    }
    getOrCreateUser(authorId).increment(type, count);
  }

  void retractAdminVote(long authorId, VoteType type) {
    UserAggregate user = users.get(authorId);
    if (user != null) {
      user.decrement(type);
    }
  }

  Optional<UserView> user(long userId) {
    UserAggregate user = users.get(userId);
    return user == null ? Optional.empty() : Optional.of(user.view());
  }

  List<UserView> users() {
    List<UserView> out = new ArrayList<>();
    for (UserAggregate user : users.values()) {
      out.add(user.view());
    }
    return out;
  }

  void clear() {
    users.clear();
  }
}
