/* Repute © 2025 Repute Devs — MIT */
package dev.repute.ledger;

import dev.repute.api.VoteType;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Append-only vote log plus the index of votes that still count.
 *
 * <p>Records are never removed from the log. Reversal replaces the stored record with its reversed
 * copy and drops it from the active index. Mutations for one author are serialized by the caller.
 */
final class VoteLedger {
  /** Newest first: timestamp, then creation sequence. */
  static final Comparator<VoteRecord> NEWEST_FIRST =
      Comparator.comparing(VoteRecord::timestamp)
          .thenComparingLong(VoteRecord::sequence)
          .reversed();

  private final Map<String, VoteRecord> log = new ConcurrentHashMap<>();
  private final Map<String, VoteRecord> active = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();
  private final Clock clock;
  private final Supplier<String> ids;

  VoteLedger(Clock clock, Supplier<String> ids) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.ids = Objects.requireNonNull(ids, "ids");
  }

  VoteRecord record(
      long voterId, long authorId, String tokenAddress, VoteType type, long sourceMessageId) {
    String voteId = ids.get();
    if (log.containsKey(voteId)) {
      throw new IllegalStateException("vote id collision: " + voteId);
    }
    VoteRecord vote =
        new VoteRecord(
            voteId,
            voterId,
            authorId,
            tokenAddress,
            type,
            sourceMessageId,
            clock.instant(),
            sequence.incrementAndGet(),
            false);
    log.put(voteId, vote);
    active.put(voteId, vote);
    return vote;
  }

  ReversalStatus reverse(String voteId) {
    VoteRecord vote = voteId == null ? null : log.get(voteId);
    if (vote == null) {
      return ReversalStatus.NOT_FOUND;
    }
    if (vote.reversed()) {
      return ReversalStatus.ALREADY_REVERSED;
    }
    log.put(voteId, vote.asReversed());
    active.remove(voteId);
    return ReversalStatus.OK;
  }

  /** Active vote from a specific source message, preferring the most recently created. */
  Match findActiveMatch(
      long voterId, long authorId, String tokenAddress, VoteType type, long sourceMessageId) {
    return scan(voterId, authorId, tokenAddress, type, sourceMessageId, true);
  }

  /** Active vote holding a stance on a token, whatever message it came from. */
  Match findActiveStance(long voterId, long authorId, String tokenAddress, VoteType type) {
    return scan(voterId, authorId, tokenAddress, type, 0L, false);
  }

  private Match scan(
      long voterId,
      long authorId,
      String tokenAddress,
      VoteType type,
      long sourceMessageId,
      boolean bySource) {
    VoteRecord best = null;
    int candidates = 0;
    for (VoteRecord vote : active.values()) {
      if (!vote.matches(voterId, authorId, tokenAddress, type)) {
        continue;
      }
      if (bySource && vote.sourceMessageId() != sourceMessageId) {
        continue;
      }
      candidates++;
      if (best == null || vote.sequence() > best.sequence()) {
        best = vote;
      }
    }
    return new Match(best, candidates);
  }

  Optional<VoteRecord> get(String voteId) {
    return voteId == null ? Optional.empty() : Optional.ofNullable(log.get(voteId));
  }

  List<VoteRecord> recentActive(int limit) {
    List<VoteRecord> sorted = new ArrayList<>(active.values());
    sorted.sort(NEWEST_FIRST);
    return sorted.size() > limit ? new ArrayList<>(sorted.subList(0, limit)) : sorted;
  }

  int size() {
    return log.size();
  }

  int activeSize() {
    return active.size();
  }

  Collection<VoteRecord> all() {
    return log.values();
  }

  Collection<VoteRecord> activeVotes() {
    return active.values();
  }

  /** Replaces the whole log; the active index is derived from the non-reversed records. */
  void load(Collection<VoteRecord> votes) {
    log.clear();
    active.clear();
    long max = 0;
    for (VoteRecord vote : votes) {
      log.put(vote.voteId(), vote);
      if (!vote.reversed()) {
        active.put(vote.voteId(), vote);
      }
      max = Math.max(max, vote.sequence());
    }
    sequence.set(max);
  }

  /**
   * Result of an active-vote scan.
   *
   * @param vote most recently created matching record, or {@code null}
   * @param candidates number of active records that matched
   */
  record Match(VoteRecord vote, int candidates) {
    boolean found() {
      return vote != null;
    }

    boolean ambiguous() {
      return candidates > 1;
    }
  }
}
