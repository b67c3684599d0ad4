/* Repute © 2025 Repute Devs — MIT */
package dev.repute.console;

import dev.repute.api.Card;
import dev.repute.api.ChatGateway;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gateway that only logs what it would send. Member names are numeric IDs; everyone is a member.
 */
public final class LoggingChatGateway implements ChatGateway {
  private static final Logger LOG = LoggerFactory.getLogger("repute");

  private final AtomicLong nextMessageId;

  public LoggingChatGateway(long firstMessageId) {
    this.nextMessageId = new AtomicLong(firstMessageId);
  }

  @Override
  public void removeReaction(long channelId, long messageId, long userId, String glyph) {
    LOG.info(
        "(repute) gateway removeReaction channel={} message={} user={} glyph={}",
        channelId,
        messageId,
        userId,
        glyph);
  }

  @Override
  public void sendDirectMessage(long userId, String text) {
    LOG.info("(repute) gateway dm user={} text={}", userId, text);
  }

  @Override
  public void sendTransient(long channelId, String text, Duration ttl) {
    LOG.info(
        "(repute) gateway transient channel={} ttl={}s text={}", channelId, ttl.toSeconds(), text);
  }

  @Override
  public void sendCard(long channelId, Card card) {
    LOG.info("(repute) gateway card channel={} title={}\n{}", channelId, card.title(), card.body());
  }

  @Override
  public long postVotingMessage(long channelId, Card card, List<String> reactions) {
    long id = nextMessageId.getAndIncrement();
    LOG.info(
        "(repute) gateway voting message={} channel={} reactions={}\n{}",
        id,
        channelId,
        reactions,
        card.body());
    return id;
  }

  @Override
  public Optional<Long> findMemberByName(long guildId, String name) {
    try {
      return Optional.of(Long.parseLong(name.trim()));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  @Override
  public boolean isMember(long guildId, long userId) {
    return true;
  }
}
