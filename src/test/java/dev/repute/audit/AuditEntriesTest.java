/* Repute © 2025 Repute Devs — MIT */
package dev.repute.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.repute.api.Card;
import dev.repute.api.VoteType;
import dev.repute.core.Config;
import dev.repute.core.LocaleManager;
import dev.repute.ledger.VoteRecord;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AuditEntriesTest {
  private static final String ADDRESS = "7GCihgDB8fe6KNjn2MYtkzZcRjQy3t9GHdC8uHYmW2hr";

  @BeforeEach
  void setUp() {
    LocaleManager.initialize(Config.defaults().i18n());
  }

  @Test
  void voteCardCarriesVoterAuthorTokenAndId() {
    VoteRecord vote =
        new VoteRecord("v-1", 20L, 10L, ADDRESS, VoteType.BAD, 500L, Instant.EPOCH, 1L, false);

    Card added = AuditEntries.voteCast(vote, "WIF", false);
    Card switched = AuditEntries.voteCast(vote, "WIF", true);

    assertEquals("Vote Added", added.title());
    assertEquals("Vote Switched", switched.title());
    assertEquals(Card.Tone.NEGATIVE, added.tone());
    assertTrue(added.body().contains("<@20> (`20`)"));
    assertTrue(added.body().contains("<@10>"));
    assertTrue(added.body().contains("`WIF` (`7GCihg...`)"));
    assertTrue(added.body().contains("`v-1`"));
  }

  @Test
  void removedCardFallsBackToShortAddressSymbol() {
    VoteRecord vote =
        new VoteRecord("v-2", 20L, 10L, ADDRESS, VoteType.GOOD, 500L, Instant.EPOCH, 2L, true);

    Card removed = AuditEntries.voteRemoved(vote, "");

    assertEquals("Vote Removed", removed.title());
    assertEquals(Card.Tone.WARNING, removed.tone());
    assertTrue(removed.body().contains("`7GCihg...` (`7GCihg...`)"));
  }

  @Test
  void adminCardsAbbreviateLongIdLists() {
    List<String> ids = List.of("a", "b", "c", "d", "e", "f", "g");

    Card added = AuditEntries.adminAdded(5L, 10L, VoteType.GOOD, ids);
    Card removed = AuditEntries.adminRemoved(5L, ids.subList(0, 2));

    assertEquals(Card.Tone.POSITIVE, added.tone());
    assertTrue(added.body().contains("**Type:** Good"));
    assertTrue(added.body().contains("`7`"));
    assertTrue(added.body().contains("`a, b, c, d, e, ...`"));
    assertTrue(removed.body().contains("`a, b`"));
    assertEquals("Votes Removed by Admin", removed.title());
  }

  @Test
  void listedKeepsShortListsWhole() {
    assertEquals("x, y", AuditEntries.listed(List.of("x", "y")));
    assertEquals("", AuditEntries.listed(List.of()));
  }
}
