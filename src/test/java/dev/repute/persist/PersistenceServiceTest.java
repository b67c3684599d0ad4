/* Repute © 2025 Repute Devs — MIT */
package dev.repute.persist;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.repute.api.ErrorCode;
import dev.repute.api.OperationResult;
import dev.repute.api.VoteType;
import dev.repute.ledger.AuditSinks;
import dev.repute.ledger.DisabledVoters;
import dev.repute.ledger.ReputationLedger;
import dev.repute.ledger.UserView;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PersistenceServiceTest {
  private static final String TOKEN = "7GCihgDB8fe6KNjn2MYtkzZcRjQy3t9GHdC8uHYmW2hr";

  private final List<Runnable> pending = new ArrayList<>();
  private ScheduledExecutorService scheduler;
  private InMemoryBlobStore store;
  private ReputationLedger ledger;
  private DisabledVoters disabled;
  private AuditSinks sinks;
  private PersistenceService persistence;

  @BeforeEach
  void setUp() {
    scheduler = mock(ScheduledExecutorService.class);
    when(scheduler.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class)))
        .thenAnswer(
            invocation -> {
              pending.add(invocation.getArgument(0));
              return null;
            });
    store = new InMemoryBlobStore();
    ledger = new ReputationLedger();
    disabled = new DisabledVoters();
    sinks = new AuditSinks();
    persistence = service(ledger, disabled, sinks);
  }

  @Test
  void requestsWithinWindowCoalesceIntoOneWrite() {
    ledger.castVote(10L, 21L, TOKEN, "WIF", VoteType.GOOD, 500L);
    persistence.requestFlush();
    ledger.castVote(10L, 22L, TOKEN, "WIF", VoteType.GOOD, 500L);
    persistence.requestFlush();
    persistence.requestFlush();

    assertEquals(1, pending.size());
    verify(scheduler).schedule(any(Runnable.class), eq(250L), eq(TimeUnit.MILLISECONDS));
    runPending();

    assertEquals(SnapshotCodec.RECORDS.size(), store.writes.size());
    assertFalse(persistence.dirty());
    assertTrue(store.records.get(SnapshotCodec.REPUTATION).contains("\"goodvoters\""));

    persistence.requestFlush();
    assertEquals(1, pending.size());
    verify(scheduler, times(2)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
  }

  @Test
  void failedFlushStaysDirtyAndNextRequestRetries() {
    ledger.castVote(10L, 21L, TOKEN, "WIF", VoteType.GOOD, 500L);
    store.failWritesOf = SnapshotCodec.DISABLED_VOTERS;

    OperationResult failed = persistence.flushNow();

    assertFalse(failed.ok());
    assertEquals(ErrorCode.PERSISTENCE_FAILURE, failed.code());
    assertTrue(persistence.dirty());
    assertEquals(1, ledger.user(10L).orElseThrow().good());

    store.failWritesOf = null;
    persistence.requestFlush();
    runPending();

    assertFalse(persistence.dirty());
    assertTrue(store.records.containsKey(SnapshotCodec.ACTIVE_VOTES));
  }

  @Test
  void restoreRebuildsEquivalentState() {
    ledger.castVote(10L, 21L, TOKEN, "WIF", VoteType.GOOD, 500L);
    ledger.castVote(10L, 22L, TOKEN, "WIF", VoteType.BAD, 500L);
    String removed = ledger.addAdminVotes(5L, 10L, VoteType.GOOD, 2).get(0).voteId();
    ledger.reverseVote(removed);
    disabled.toggle(30L);
    sinks.set(1L, 77L);
    assertTrue(persistence.flushNow().ok());

    ReputationLedger restoredLedger = new ReputationLedger();
    DisabledVoters restoredDisabled = new DisabledVoters();
    AuditSinks restoredSinks = new AuditSinks();
    OperationResult result = service(restoredLedger, restoredDisabled, restoredSinks).restore();

    assertTrue(result.ok());
    assertEquals(ledger.snapshot().users(), restoredLedger.snapshot().users());
    assertEquals(ledger.voteCount(), restoredLedger.voteCount());
    assertEquals(ledger.activeVoteCount(), restoredLedger.activeVoteCount());
    assertTrue(restoredLedger.vote(removed).orElseThrow().reversed());
    assertTrue(restoredDisabled.contains(30L));
    assertEquals(77L, restoredSinks.find(1L).orElseThrow());

    UserView author = restoredLedger.user(10L).orElseThrow();
    assertEquals(2, author.good());
    assertEquals(1, author.bad());
  }

  @Test
  void restoredLedgerKeepsRecordingAfterTheLog() {
    ledger.castVote(10L, 21L, TOKEN, "WIF", VoteType.GOOD, 500L);
    persistence.flushNow();
    ReputationLedger restoredLedger = new ReputationLedger();
    service(restoredLedger, new DisabledVoters(), new AuditSinks()).restore();

    restoredLedger.castVote(10L, 21L, TOKEN, "WIF", VoteType.BAD, 500L);

    assertEquals(2, restoredLedger.voteCount());
    assertEquals(1, restoredLedger.activeVoteCount());
    assertEquals(1, restoredLedger.user(10L).orElseThrow().bad());
  }

  @Test
  void missingRecordsRestoreAsEmpty() {
    OperationResult result = persistence.restore();

    assertTrue(result.ok());
    assertEquals(0, ledger.voteCount());
    assertTrue(ledger.users().isEmpty());
  }

  @Test
  void unreadableRecordsLeaveStateUntouched() {
    ledger.castVote(10L, 21L, TOKEN, "WIF", VoteType.GOOD, 500L);
    store.records.put(SnapshotCodec.REPUTATION, "{}");
    store.records.put(SnapshotCodec.VOTE_LOG, "not json");

    OperationResult corrupt = persistence.restore();

    assertFalse(corrupt.ok());
    assertEquals(ErrorCode.PERSISTENCE_FAILURE, corrupt.code());
    assertEquals(1, ledger.user(10L).orElseThrow().good());

    store.failReads = true;
    OperationResult unreachable = persistence.restore();
    assertEquals(ErrorCode.CONNECTION_LOST, unreachable.code());
    assertEquals(1, ledger.voteCount());
  }

  @Test
  void staleActiveIndexIsIgnored() {
    ledger.castVote(10L, 21L, TOKEN, "WIF", VoteType.GOOD, 500L);
    persistence.flushNow();
    store.records.put(SnapshotCodec.ACTIVE_VOTES, "{\"ghost\": {}}");

    ReputationLedger restoredLedger = new ReputationLedger();
    assertTrue(service(restoredLedger, new DisabledVoters(), new AuditSinks()).restore().ok());

    assertEquals(1, restoredLedger.activeVoteCount());
  }

  private PersistenceService service(
      ReputationLedger ledger, DisabledVoters disabled, AuditSinks sinks) {
    return new PersistenceService(ledger, disabled, sinks, store, scheduler, 250L, null);
  }

  private void runPending() {
    List<Runnable> tasks = new ArrayList<>(pending);
    pending.clear();
    tasks.forEach(Runnable::run);
  }
}
