/* Repute © 2025 Repute Devs — MIT */
package dev.repute.reconcile;

import dev.repute.api.Card;
import dev.repute.api.ChatGateway;
import dev.repute.api.ErrorCode;
import dev.repute.api.GatewayException;
import dev.repute.api.events.SourceMessageEvent;
import dev.repute.core.LocaleManager;
import dev.repute.extract.StructuredContent;
import dev.repute.extract.TokenContextExtractor;
import dev.repute.ledger.ReputationLedger;
import dev.repute.ledger.UserView;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns source-bot posts into tracked voting messages.
 *
 * <p>The first embed whose footer starts with a guild member's account name wins: its token address
 * and the post's symbol become the voting context, a reputation summary of that member is posted
 * with both vote glyphs, and the new message is tracked with the member as author.
 */
public final class VotingMessagePublisher {
  private static final Logger LOG = LoggerFactory.getLogger("repute");

  private final ChatGateway gateway;
  private final ReputationLedger ledger;
  private final TrackedMessages tracked;
  private final VoteGlyphs glyphs;
  private final long sourceBotId;

  public VotingMessagePublisher(
      ChatGateway gateway,
      ReputationLedger ledger,
      TrackedMessages tracked,
      VoteGlyphs glyphs,
      long sourceBotId) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.tracked = Objects.requireNonNull(tracked, "tracked");
    this.glyphs = Objects.requireNonNull(glyphs, "glyphs");
    this.sourceBotId = sourceBotId;
  }

  /**
   * Handles a posted message.
   *
   * @return the tracked voting message, or empty when the post is not a source-bot embed post or no
   *     embed names a member
   */
  public Optional<TrackedMessage> onMessage(SourceMessageEvent event) {
    if (sourceBotId == 0 || event.authorId() != sourceBotId || event.embeds().isEmpty()) {
      return Optional.empty();
    }
    for (StructuredContent embed : event.embeds()) {
      String footer = embed.footer();
      if (footer == null || footer.isBlank()) {
        continue;
      }
      String username = footer.strip().split("\\s+")[0];
      try {
        Optional<Long> member = gateway.findMemberByName(event.guildId(), username);
        if (member.isEmpty()) {
          continue;
        }
        return Optional.of(publish(event, embed, member.get()));
      } catch (GatewayException e) {
        LOG.warn(
            "(repute) code={} op={} message={} user={} error={}",
            ErrorCode.GATEWAY_FAILURE,
            "publisher.post",
            event.messageId(),
            username,
            e.getMessage());
      }
    }
    return Optional.empty();
  }

  private TrackedMessage publish(SourceMessageEvent event, StructuredContent embed, long memberId)
      throws GatewayException {
    String address = TokenContextExtractor.extractAddress(embed);
    String symbol = TokenContextExtractor.extractSymbol(event.content());
    if (TokenContextExtractor.UNKNOWN_ADDRESS.equals(address) || symbol.isEmpty()) {
      symbol = TokenContextExtractor.displaySymbol(address, "");
    }
    long posted = gateway.postVotingMessage(event.channelId(), summary(memberId), glyphs.both());
    TrackedMessage message =
        new TrackedMessage(posted, event.guildId(), event.channelId(), memberId, address, symbol);
    tracked.track(message);
    LOG.info(
        "(repute) op={} message={} author={} token={} symbol={}",
        "publisher.track",
        posted,
        memberId,
        address,
        symbol);
    return message;
  }

  Card summary(long memberId) {
    UserView user = ledger.user(memberId).orElse(UserView.empty(memberId));
    String body =
        LocaleManager.format(
            "summary.body",
            "member", gateway.mention(memberId),
            "good", user.good(),
            "goodGlyph", glyphs.good(),
            "bad", user.bad(),
            "badGlyph", glyphs.bad(),
            "score", user.score(),
            "percent", String.format(Locale.ROOT, "%.1f", user.reputationPercent()));
    return new Card("", body, Card.Tone.NEUTRAL);
  }
}
