/* Repute © 2025 Repute Devs — MIT */
package dev.repute.admin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import dev.repute.api.Card;
import dev.repute.api.ChatGateway;
import dev.repute.api.ErrorCode;
import dev.repute.api.VoteType;
import dev.repute.audit.AuditNotifier;
import dev.repute.core.Config;
import dev.repute.core.LocaleManager;
import dev.repute.core.Metrics;
import dev.repute.ledger.AuditSinks;
import dev.repute.ledger.ReputationLedger;
import dev.repute.ledger.UserView;
import dev.repute.ledger.VoteRecord;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AdminAdjustmentServiceTest {
  private static final long GUILD = 1L;
  private static final long ADMIN = 5L;
  private static final long AUTHOR = 10L;
  private static final int MAX_ADD = 50;

  private final AtomicInteger flushes = new AtomicInteger();
  private ChatGateway gateway;
  private ReputationLedger ledger;
  private Metrics metrics;
  private AdminAdjustmentService service;

  @BeforeEach
  void setUp() {
    LocaleManager.initialize(Config.defaults().i18n());
    gateway = mock(ChatGateway.class);
    ledger = new ReputationLedger();
    metrics = new Metrics();
    AuditSinks sinks = new AuditSinks();
    sinks.set(GUILD, 3L);
    service =
        new AdminAdjustmentService(
            ledger,
            flushes::incrementAndGet,
            new AuditNotifier(gateway, sinks, Runnable::run, metrics),
            metrics,
            MAX_ADD);
  }

  @AfterEach
  void tearDown() {
    metrics.close();
  }

  @Test
  void addVotesCreatesAdminRecords() throws Exception {
    AdminAdjustmentService.AddResult result =
        service.addVotes(GUILD, ADMIN, AUTHOR, VoteType.BAD, 3);

    assertTrue(result.result().ok());
    assertEquals(3, result.voteIds().size());
    UserView author = ledger.user(AUTHOR).orElseThrow();
    assertEquals(3, author.bad());
    assertTrue(author.tokens().isEmpty());
    VoteRecord first = ledger.vote(result.voteIds().get(0)).orElseThrow();
    assertTrue(first.adminAdded());
    assertEquals(ADMIN, first.voterId());
    assertEquals(1, flushes.get());
    assertEquals(3, metrics.adminVotesAdded());
    verify(gateway).sendCard(eq(3L), any(Card.class));
  }

  @Test
  void nonPositiveAmountChangesNothing() throws Exception {
    AdminAdjustmentService.AddResult zero =
        service.addVotes(GUILD, ADMIN, AUTHOR, VoteType.GOOD, 0);
    AdminAdjustmentService.AddResult negative =
        service.addVotes(GUILD, ADMIN, AUTHOR, VoteType.GOOD, -4);

    assertEquals(ErrorCode.INVALID_AMOUNT, zero.result().code());
    assertEquals(ErrorCode.INVALID_AMOUNT, negative.result().code());
    assertTrue(zero.voteIds().isEmpty());
    assertTrue(ledger.user(AUTHOR).isEmpty());
    assertEquals(0, ledger.voteCount());
    assertEquals(0, flushes.get());
    verify(gateway, never()).sendCard(anyLong(), any(Card.class));
  }

  @Test
  void amountAboveCapChangesNothing() throws Exception {
    AdminAdjustmentService.AddResult atCap =
        service.addVotes(GUILD, ADMIN, AUTHOR, VoteType.GOOD, MAX_ADD);
    AdminAdjustmentService.AddResult huge =
        service.addVotes(GUILD, ADMIN, AUTHOR, VoteType.GOOD, Integer.MAX_VALUE);

    assertTrue(atCap.result().ok());
    assertEquals(ErrorCode.INVALID_AMOUNT, huge.result().code());
    assertTrue(huge.voteIds().isEmpty());
    assertEquals(MAX_ADD, ledger.user(AUTHOR).orElseThrow().good());
    assertEquals(MAX_ADD, ledger.voteCount());
    assertEquals(1, flushes.get());
  }

  @Test
  void missingTypeIsInvalidArgument() {
    AdminAdjustmentService.AddResult result = service.addVotes(GUILD, ADMIN, AUTHOR, null, 2);

    assertFalse(result.result().ok());
    assertEquals(ErrorCode.INVALID_ARGUMENT, result.result().code());
  }

  @Test
  void removeSortsIdsByOutcome() {
    List<String> ids = service.addVotes(GUILD, ADMIN, AUTHOR, VoteType.GOOD, 2).voteIds();
    ledger.reverseVote(ids.get(1));

    RemovalReport report =
        service.removeVotesById(
            GUILD, ADMIN, Arrays.asList(" " + ids.get(0) + " ", ids.get(1), "nope", "  ", null));

    assertEquals(List.of(ids.get(0)), report.removed());
    assertEquals(List.of(ids.get(1)), report.alreadyReversed());
    assertEquals(List.of("nope", "", ""), report.notFound());
    assertEquals(0, ledger.user(AUTHOR).orElseThrow().good());
    assertEquals(1, metrics.adminVotesRemoved());
    assertEquals(2, flushes.get());
  }

  @Test
  void removeReversesReactionVotesToo() {
    String voteId =
        ledger.castVote(AUTHOR, 20L, "addr", "SYM", VoteType.GOOD, 99L).recorded().voteId();

    RemovalReport report = service.removeVotesById(GUILD, ADMIN, List.of(voteId));

    assertEquals(List.of(voteId), report.removed());
    UserView author = ledger.user(AUTHOR).orElseThrow();
    assertEquals(0, author.good());
    assertEquals(0, author.tokens().get("addr").good());
  }

  @Test
  void removalWithNothingRemovedSkipsFlushAndAudit() throws Exception {
    RemovalReport report = service.removeVotesById(GUILD, ADMIN, List.of("missing"));

    assertEquals(List.of("missing"), report.notFound());
    assertEquals(0, flushes.get());
    verify(gateway, never()).sendCard(anyLong(), any(Card.class));
  }
}
