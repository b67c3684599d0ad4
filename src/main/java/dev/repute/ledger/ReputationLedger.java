/* Repute © 2025 Repute Devs — MIT */
package dev.repute.ledger;

import dev.repute.api.VoteType;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Single entry point for reputation state: aggregates, the vote log and the active vote index.
 *
 * <p>Every mutation runs inside the affected author's monitor while holding the read side of a
 * {@link ReentrantReadWriteLock}; the aggregate change and its companion log write therefore form
 * one unit, and {@link #snapshot()} (write side) never observes half of one. Read-only queries copy
 * state under the author monitor only. No method performs I/O.
 */
public final class ReputationLedger {
  private final ReputationStore store = new ReputationStore();
  private final VoteLedger ledger;
  private final ReentrantReadWriteLock snapshotLock = new ReentrantReadWriteLock();
  private final ConcurrentMap<Long, Object> authorLocks = new ConcurrentHashMap<>();

  public ReputationLedger() {
    this(Clock.systemUTC(), () -> UUID.randomUUID().toString());
  }

  /**
   * Creates a ledger with explicit time and ID sources.
   *
   * @param clock timestamps new vote records
   * @param ids produces unique vote IDs
   */
  public ReputationLedger(Clock clock, Supplier<String> ids) {
    this.ledger = new VoteLedger(clock, ids);
  }

  /**
   * Applies a reaction vote and records it.
   *
   * <p>An identical stance already held changes nothing and records nothing. On a switch the
   * superseded record is reversed in the same unit. The record is written before the aggregates
   * move, so a failed write leaves both untouched.
   */
  public VoteChange castVote(
      long authorId,
      long voterId,
      String tokenAddress,
      String symbol,
      VoteType type,
      long sourceMessageId) {
    Objects.requireNonNull(tokenAddress, "tokenAddress");
    Objects.requireNonNull(type, "type");
    Lock lock = snapshotLock.readLock();
    lock.lock();
    try {
      synchronized (authorLock(authorId)) {
        if (store.holds(authorId, voterId, tokenAddress, type)) {
          return new VoteChange(ApplyOutcome.UNCHANGED, null, null, false);
        }
        VoteRecord recorded =
            ledger.record(voterId, authorId, tokenAddress, type, sourceMessageId);
        ApplyOutcome outcome = store.applyVote(authorId, voterId, tokenAddress, symbol, type);
        VoteRecord superseded = null;
        boolean ambiguous = false;
        if (outcome == ApplyOutcome.SWITCHED) {
          VoteLedger.Match match =
              ledger.findActiveStance(voterId, authorId, tokenAddress, type.opposite());
          ambiguous = match.ambiguous();
          while (match.found()) {
            ledger.reverse(match.vote().voteId());
            if (superseded == null) {
              superseded = match.vote().asReversed();
            }
            match = ledger.findActiveStance(voterId, authorId, tokenAddress, type.opposite());
          }
        }
        return new VoteChange(outcome, recorded, superseded, ambiguous);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Takes back the reaction vote {@code voterId} cast from {@code sourceMessageId}.
   *
   * <p>When several active records match, the most recently created one is reversed. The record
   * is reversed even when the voter no longer holds that stance; the counters then stay as they
   * are.
   */
  public Retraction retractReactionVote(
      long authorId, long voterId, String tokenAddress, VoteType type, long sourceMessageId) {
    Lock lock = snapshotLock.readLock();
    lock.lock();
    try {
      synchronized (authorLock(authorId)) {
        VoteLedger.Match match =
            ledger.findActiveMatch(voterId, authorId, tokenAddress, type, sourceMessageId);
        if (!match.found()) {
          return new Retraction(null, false);
        }
        store.retractHeldVote(authorId, voterId, tokenAddress, type);
        ledger.reverse(match.vote().voteId());
        return new Retraction(match.vote().asReversed(), match.ambiguous());
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Adds {@code count} administrator votes to {@code authorId}'s user totals.
   *
   * @return the created records, in creation order
   * @throws IllegalArgumentException if {@code count} is not positive
   */
  public List<VoteRecord> addAdminVotes(long adminId, long authorId, VoteType type, int count) {
    if (count <= 0) {
      throw new IllegalArgumentException("count must be positive: " + count);
    }
    Objects.requireNonNull(type, "type");
    Lock lock = snapshotLock.readLock();
    lock.lock();
    try {
      synchronized (authorLock(authorId)) {
        List<VoteRecord> created = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
          created.add(ledger.record(adminId, authorId, VoteRecord.ADMIN_TOKEN, type, 0L));
          store.applyAdminVote(authorId, type, 1);
        }
        return created;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reverses a vote by ID, whatever created it.
   *
   * <p>User counters always drop by one; token-bound votes also drop the token counter and the
   * voter's stance. Counters are clamped at zero. Reversal is idempotent.
   */
  public ReversalResult reverseVote(String voteId) {
    Optional<VoteRecord> found = ledger.get(voteId);
    if (found.isEmpty()) {
      return new ReversalResult(ReversalStatus.NOT_FOUND, null);
    }
    long authorId = found.get().authorId();
    Lock lock = snapshotLock.readLock();
    lock.lock();
    try {
      synchronized (authorLock(authorId)) {
        VoteRecord vote = ledger.get(voteId).orElseThrow();
        if (vote.reversed()) {
          return new ReversalResult(ReversalStatus.ALREADY_REVERSED, vote);
        }
        if (vote.adminAdded()) {
          store.retractAdminVote(authorId, vote.voteType());
        } else {
          store.retractVote(authorId, vote.voterId(), vote.tokenAddress(), vote.voteType());
        }
        ReversalStatus status = ledger.reverse(voteId);
        return new ReversalResult(status, vote.asReversed());
      }
    } finally {
      lock.unlock();
    }
  }

  public Optional<UserView> user(long userId) {
    synchronized (authorLock(userId)) {
      return store.user(userId);
    }
  }

  /** Copies of every participant with an aggregate, in no particular order. */
  public List<UserView> users() {
    List<UserView> out = new ArrayList<>();
    for (Long userId : new ArrayList<>(store.userIds())) {
      user(userId).ifPresent(out::add);
    }
    return out;
  }

  public Optional<VoteRecord> vote(String voteId) {
    return ledger.get(voteId);
  }

  /** Active votes, newest first. */
  public List<VoteRecord> recentActiveVotes(int limit) {
    return ledger.recentActive(Math.max(0, limit));
  }

  /** Number of records in the log, reversed ones included. */
  public int voteCount() {
    return ledger.size();
  }

  public int activeVoteCount() {
    return ledger.activeSize();
  }

  /** Consistent copy of all aggregates and the full log, taken while no mutation is in flight. */
  public LedgerSnapshot snapshot() {
    Lock lock = snapshotLock.writeLock();
    lock.lock();
    try {
      List<UserView> users = store.users();
      users.sort(Comparator.comparingLong(UserView::userId));
      List<VoteRecord> votes = new ArrayList<>(ledger.all());
      votes.sort(Comparator.comparingLong(VoteRecord::sequence));
      return new LedgerSnapshot(users, votes);
    } finally {
      lock.unlock();
    }
  }

  /** Replaces all state with a snapshot. The active index is rebuilt from the log. */
  public void restore(LedgerSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    Lock lock = snapshotLock.writeLock();
    lock.lock();
    try {
      store.clear();
      for (UserView view : snapshot.users()) {
        UserAggregate user = store.getOrCreateUser(view.userId());
        user.load(view.good(), view.bad());
        view.tokens()
            .forEach(
                (address, token) ->
                    user.tokenOrCreate(address, token.symbol())
                        .load(token.good(), token.bad(), token.goodVoters(), token.badVoters()));
      }
      ledger.load(snapshot.votes());
    } finally {
      lock.unlock();
    }
  }

  private Object authorLock(long authorId) {
    return authorLocks.computeIfAbsent(authorId, id -> new Object());
  }

  /**
   * Effect of {@link #castVote}.
   *
   * @param outcome aggregate-level effect
   * @param recorded new record, {@code null} when {@link ApplyOutcome#UNCHANGED}
   * @param superseded reversed record of the previous stance on a switch, otherwise {@code null}
   * @param ambiguous whether more than one active record held the previous stance
   */
  public record VoteChange(
      ApplyOutcome outcome, VoteRecord recorded, VoteRecord superseded, boolean ambiguous) {}

  /**
   * Effect of {@link #retractReactionVote}.
   *
   * @param reversed the reversed record, or {@code null} when nothing matched
   * @param ambiguous whether more than one active record matched
   */
  public record Retraction(VoteRecord reversed, boolean ambiguous) {
    public boolean found() {
      return reversed != null;
    }
  }

  /**
   * Effect of {@link #reverseVote}.
   *
   * @param status reversal status
   * @param vote the record as it now stands, {@code null} when not found
   */
  public record ReversalResult(ReversalStatus status, VoteRecord vote) {}
}
