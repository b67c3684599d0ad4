/* Repute © 2025 Repute Devs — MIT */
package dev.repute.persist;

import dev.repute.api.ErrorCode;
import dev.repute.api.OperationResult;
import dev.repute.core.Metrics;
import dev.repute.ledger.AuditSinks;
import dev.repute.ledger.DisabledVoters;
import dev.repute.ledger.LedgerSnapshot;
import dev.repute.ledger.ReputationLedger;
import dev.repute.ledger.VoteRecord;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Snapshots ledger state into the five persisted records and restores it at startup.
 *
 * <p>{@link #requestFlush()} is cheap and may be called after every mutation: requests arriving
 * within the debounce window collapse into one write on the scheduler. Writes are serialized. A
 * failed flush leaves the state dirty; the next request retries. In-memory state stays
 * authoritative throughout.
 */
public final class PersistenceService {
  private static final Logger LOG = LoggerFactory.getLogger("repute");

  private final ReputationLedger ledger;
  private final DisabledVoters disabledVoters;
  private final AuditSinks auditSinks;
  private final BlobStore store;
  private final ScheduledExecutorService scheduler;
  private final long debounceMs;
  private final Metrics metrics;

  private final AtomicBoolean dirty = new AtomicBoolean();
  private final AtomicBoolean scheduled = new AtomicBoolean();
  private final Object writeLock = new Object();

  public PersistenceService(
      ReputationLedger ledger,
      DisabledVoters disabledVoters,
      AuditSinks auditSinks,
      BlobStore store,
      ScheduledExecutorService scheduler,
      long debounceMs,
      Metrics metrics) {
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.disabledVoters = Objects.requireNonNull(disabledVoters, "disabledVoters");
    this.auditSinks = Objects.requireNonNull(auditSinks, "auditSinks");
    this.store = Objects.requireNonNull(store, "store");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.debounceMs = Math.max(0L, debounceMs);
    this.metrics = metrics;
  }

  /** Marks state dirty and schedules a flush unless one is already pending. */
  public void requestFlush() {
    dirty.set(true);
    if (!scheduled.compareAndSet(false, true)) {
      return;
    }
    try {
      scheduler.schedule(this::runScheduled, debounceMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      scheduled.set(false);
      LOG.warn(
          "(repute) code={} op={} message={}",
          ErrorCode.PERSISTENCE_FAILURE,
          "persist.schedule",
          "scheduler rejected flush; state stays dirty until the next flush");
    }
  }

  private void runScheduled() {
    scheduled.set(false);
    if (dirty.get()) {
      flushNow();
    }
  }

  /** Whether changes exist that no successful flush has written yet. */
  public boolean dirty() {
    return dirty.get();
  }

  /**
   * Writes all five records now, on the calling thread.
   *
   * @return success, or {@link ErrorCode#PERSISTENCE_FAILURE} (or the SQL classification) when a
   *     record could not be written
   */
  public OperationResult flushNow() {
    synchronized (writeLock) {
      // Cleared before the snapshot so a mutation racing this flush marks the state dirty again.
      dirty.set(false);
      Map<String, String> bodies;
      try {
        bodies = encode(capture());
      } catch (RuntimeException e) {
        return flushFailed(ErrorCode.PERSISTENCE_FAILURE, e.getMessage(), e);
      }
      for (Map.Entry<String, String> record : bodies.entrySet()) {
        try {
          store.write(record.getKey(), record.getValue());
        } catch (StorageException e) {
          return flushFailed(e.code(), record.getKey() + ": " + e.getMessage(), e);
        }
      }
      if (metrics != null) {
        metrics.recordFlush(true, null);
      }
      LOG.debug("(repute) op={} records={}", "persist.flush", bodies.size());
      return OperationResult.success();
    }
  }

  private OperationResult flushFailed(ErrorCode code, String message, Throwable cause) {
    dirty.set(true);
    if (metrics != null) {
      metrics.recordFlush(false, code);
    }
    LOG.warn("(repute) code={} op={} message={}", code, "persist.flush", message, cause);
    return OperationResult.failure(code, message);
  }

  StateSnapshot capture() {
    return new StateSnapshot(ledger.snapshot(), disabledVoters.ids(), auditSinks.asMap());
  }

  static Map<String, String> encode(StateSnapshot state) {
    Map<String, String> bodies = new LinkedHashMap<>();
    bodies.put(SnapshotCodec.REPUTATION, SnapshotCodec.encodeReputation(state.ledger().users()));
    bodies.put(SnapshotCodec.VOTE_LOG, SnapshotCodec.encodeVotes(state.ledger().votes()));
    bodies.put(SnapshotCodec.DISABLED_VOTERS, SnapshotCodec.encodeDisabled(state.disabledVoters()));
    bodies.put(SnapshotCodec.AUDIT_SINKS, SnapshotCodec.encodeSinks(state.auditSinks()));
    bodies.put(
        SnapshotCodec.ACTIVE_VOTES, SnapshotCodec.encodeVotes(state.ledger().activeVotes()));
    return bodies;
  }

  /**
   * Loads persisted records into the ledger, disabled voters and audit sinks.
   *
   * <p>Missing records count as empty. The active index is rebuilt from the log; a stored index
   * that disagrees is logged and ignored. On failure nothing is replaced.
   *
   * @return success, or a failure carrying the storage error code
   */
  public OperationResult restore() {
    Map<String, Optional<String>> raw = new HashMap<>();
    try {
      for (String name : SnapshotCodec.RECORDS) {
        raw.put(name, store.read(name));
      }
    } catch (StorageException e) {
      LOG.error(
          "(repute) code={} op={} message={}", e.code(), "persist.restore", e.getMessage(), e);
      return OperationResult.failure(e.code(), e.getMessage());
    }
    StateSnapshot state;
    try {
      state = decode(raw);
    } catch (RuntimeException e) {
      LOG.error(
          "(repute) code={} op={} message={}",
          ErrorCode.PERSISTENCE_FAILURE,
          "persist.restore",
          e.getMessage(),
          e);
      return OperationResult.failure(ErrorCode.PERSISTENCE_FAILURE, e.getMessage());
    }
    ledger.restore(state.ledger());
    disabledVoters.load(state.disabledVoters());
    auditSinks.load(state.auditSinks());
    LOG.info(
        "(repute) restored users={} votes={} active={} disabled={} sinks={}",
        state.ledger().users().size(),
        state.ledger().votes().size(),
        ledger.activeVoteCount(),
        state.disabledVoters().size(),
        state.auditSinks().size());
    return OperationResult.success();
  }

  static StateSnapshot decode(Map<String, Optional<String>> raw) {
    LedgerSnapshot ledger =
        new LedgerSnapshot(
            raw.get(SnapshotCodec.REPUTATION)
                .map(SnapshotCodec::decodeReputation)
                .orElse(List.of()),
            raw.get(SnapshotCodec.VOTE_LOG)
                .map(body -> SnapshotCodec.decodeVotes(body, SnapshotCodec.VOTE_LOG))
                .orElse(List.of()));
    List<Long> disabled =
        raw.get(SnapshotCodec.DISABLED_VOTERS).map(SnapshotCodec::decodeDisabled).orElse(List.of());
    Map<Long, Long> sinks =
        raw.get(SnapshotCodec.AUDIT_SINKS).map(SnapshotCodec::decodeSinks).orElse(Map.of());

    raw.get(SnapshotCodec.ACTIVE_VOTES)
        .map(SnapshotCodec::decodeActiveIds)
        .ifPresent(stored -> compareActiveIndex(ledger, stored));
    return new StateSnapshot(ledger, disabled, sinks);
  }

  private static void compareActiveIndex(LedgerSnapshot ledger, Set<String> stored) {
    Set<String> rebuilt =
        ledger.activeVotes().stream().map(VoteRecord::voteId).collect(Collectors.toSet());
    if (rebuilt.equals(stored)) {
      return;
    }
    Set<String> missing = new TreeSet<>(rebuilt);
    missing.removeAll(stored);
    Set<String> stale = new TreeSet<>(stored);
    stale.removeAll(rebuilt);
    LOG.warn(
        "(repute) code={} op={} message={} notStored={} staleStored={}",
        ErrorCode.PERSISTENCE_FAILURE,
        "persist.restore.activeIndex",
        "stored active index disagrees with the vote log; using the log",
        missing.size(),
        stale.size());
  }
}
