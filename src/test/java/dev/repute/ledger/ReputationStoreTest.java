/* Repute © 2025 Repute Devs — MIT */
package dev.repute.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.repute.api.VoteType;
import org.junit.jupiter.api.Test;

class ReputationStoreTest {
  private static final long AUTHOR = 10L;
  private static final String TOKEN = "So11111111111111111111111111111111111111112";

  @Test
  void freshVoteCountsOnTokenAndUser() {
    ReputationStore store = new ReputationStore();

    assertEquals(ApplyOutcome.FRESH, store.applyVote(AUTHOR, 1L, TOKEN, "SOL", VoteType.GOOD));

    UserView user = store.user(AUTHOR).orElseThrow();
    assertEquals(1, user.good());
    TokenView token = user.tokens().get(TOKEN);
    assertEquals(1, token.good());
    assertEquals("SOL", token.symbol());
    assertTrue(token.goodVoters().contains(1L));
  }

  @Test
  void repeatedStanceIsUnchanged() {
    ReputationStore store = new ReputationStore();
    store.applyVote(AUTHOR, 1L, TOKEN, "SOL", VoteType.GOOD);

    assertEquals(ApplyOutcome.UNCHANGED, store.applyVote(AUTHOR, 1L, TOKEN, "SOL", VoteType.GOOD));

    assertEquals(1, store.user(AUTHOR).orElseThrow().good());
  }

  @Test
  void switchMovesVoterAndConservesTotal() {
    ReputationStore store = new ReputationStore();
    store.applyVote(AUTHOR, 1L, TOKEN, "SOL", VoteType.GOOD);

    assertEquals(ApplyOutcome.SWITCHED, store.applyVote(AUTHOR, 1L, TOKEN, "SOL", VoteType.BAD));

    UserView user = store.user(AUTHOR).orElseThrow();
    TokenView token = user.tokens().get(TOKEN);
    assertEquals(0, user.good());
    assertEquals(1, user.bad());
    assertEquals(1, token.totalVotes());
    assertFalse(token.goodVoters().contains(1L));
    assertTrue(token.badVoters().contains(1L));
  }

  @Test
  void voterNeverHoldsBothStances() {
    ReputationStore store = new ReputationStore();
    store.applyVote(AUTHOR, 1L, TOKEN, "SOL", VoteType.GOOD);
    store.applyVote(AUTHOR, 1L, TOKEN, "SOL", VoteType.BAD);
    store.applyVote(AUTHOR, 1L, TOKEN, "SOL", VoteType.GOOD);

    TokenView token = store.user(AUTHOR).orElseThrow().tokens().get(TOKEN);
    assertTrue(token.goodVoters().contains(1L));
    assertFalse(token.badVoters().contains(1L));
  }

  @Test
  void retractOfUnheldStanceStillClampsAtZero() {
    ReputationStore store = new ReputationStore();
    store.applyVote(AUTHOR, 1L, TOKEN, "SOL", VoteType.GOOD);

    assertFalse(store.retractVote(AUTHOR, 2L, TOKEN, VoteType.BAD));

    UserView user = store.user(AUTHOR).orElseThrow();
    assertEquals(0, user.bad());
    assertEquals(1, user.good());
  }

  @Test
  void adminVotesOnlyTouchUserTotals() {
    ReputationStore store = new ReputationStore();

    store.applyAdminVote(AUTHOR, VoteType.BAD, 3);
    store.retractAdminVote(AUTHOR, VoteType.BAD);

    UserView user = store.user(AUTHOR).orElseThrow();
    assertEquals(2, user.bad());
    assertTrue(user.tokens().isEmpty());
  }

  @Test
  void retractOnUnknownAuthorIsNoOp() {
    ReputationStore store = new ReputationStore();

    assertFalse(store.retractVote(99L, 1L, TOKEN, VoteType.GOOD));
    assertTrue(store.user(99L).isEmpty());
  }

  @Test
  void retractHeldVoteSkipsCountersForUnheldStance() {
    ReputationStore store = new ReputationStore();
    store.applyVote(AUTHOR, 1L, TOKEN, "AAA", VoteType.BAD);
    store.applyVote(AUTHOR, 2L, TOKEN, "AAA", VoteType.GOOD);

    assertFalse(store.retractHeldVote(AUTHOR, 1L, TOKEN, VoteType.GOOD));
    assertTrue(store.retractHeldVote(AUTHOR, 2L, TOKEN, VoteType.GOOD));

    UserView user = store.user(AUTHOR).orElseThrow();
    assertEquals(0, user.good());
    assertEquals(1, user.bad());
    assertEquals(1, user.tokens().get(TOKEN).bad());
  }
}
