/* Repute © 2025 Repute Devs — MIT */
package dev.repute.audit;

import dev.repute.api.Card;
import dev.repute.api.VoteType;
import dev.repute.core.LocaleManager;
import dev.repute.extract.TokenContextExtractor;
import dev.repute.ledger.VoteRecord;
import java.util.List;

/** Builds the audit cards posted for each kind of ledger change. */
public final class AuditEntries {
  /** Vote IDs listed in an admin entry before it is abbreviated. */
  static final int LISTED_IDS = 5;

  private AuditEntries() {}

  /** "Vote Added" or "Vote Switched" for a reaction vote. */
  public static Card voteCast(VoteRecord vote, String symbol, boolean switched) {
    String title = LocaleManager.translate(switched ? "audit.vote_switched" : "audit.vote_added");
    return new Card(title, voteBody(vote, symbol), tone(vote.voteType()));
  }

  /** "Vote Removed" for a reaction removal. */
  public static Card voteRemoved(VoteRecord vote, String symbol) {
    return new Card(
        LocaleManager.translate("audit.vote_removed"), voteBody(vote, symbol), Card.Tone.WARNING);
  }

  /** "Votes Added by Admin". */
  public static Card adminAdded(long adminId, long authorId, VoteType type, List<String> voteIds) {
    String body =
        LocaleManager.format(
            "audit.admin_added.body",
            "admin", mention(adminId),
            "target", mention(authorId),
            "type", capitalize(type.key()),
            "amount", voteIds.size(),
            "ids", listed(voteIds));
    return new Card(LocaleManager.translate("audit.admin_added"), body, tone(type));
  }

  /** "Votes Removed by Admin". */
  public static Card adminRemoved(long adminId, List<String> voteIds) {
    String body =
        LocaleManager.format(
            "audit.admin_removed.body",
            "admin", mention(adminId),
            "amount", voteIds.size(),
            "ids", listed(voteIds));
    return new Card(LocaleManager.translate("audit.admin_removed"), body, Card.Tone.WARNING);
  }

  private static String voteBody(VoteRecord vote, String symbol) {
    return LocaleManager.format(
        "audit.vote.body",
        "voter", mention(vote.voterId()),
        "voterId", vote.voterId(),
        "author", mention(vote.authorId()),
        "type", vote.voteType().key(),
        "symbol", TokenContextExtractor.displaySymbol(vote.tokenAddress(), symbol),
        "short", TokenContextExtractor.shortAddress(vote.tokenAddress()),
        "voteId", vote.voteId());
  }

  static String listed(List<String> voteIds) {
    if (voteIds.size() <= LISTED_IDS) {
      return String.join(", ", voteIds);
    }
    return String.join(", ", voteIds.subList(0, LISTED_IDS)) + ", ...";
  }

  private static String mention(long userId) {
    return "<@" + userId + ">";
  }

  private static String capitalize(String key) {
    return key.isEmpty() ? key : Character.toUpperCase(key.charAt(0)) + key.substring(1);
  }

  private static Card.Tone tone(VoteType type) {
    return type == VoteType.GOOD ? Card.Tone.POSITIVE : Card.Tone.NEGATIVE;
  }
}
