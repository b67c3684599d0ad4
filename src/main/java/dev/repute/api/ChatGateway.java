/* Repute © 2025 Repute Devs — MIT */
package dev.repute.api;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Outbound surface of the chat platform the ledger is attached to.
 *
 * <p>The platform adapter owns connection handling, identity resolution and rate limits. Every call
 * may block on network I/O and may fail with {@link GatewayException}; Repute never calls the
 * gateway while holding ledger locks.
 */
public interface ChatGateway {

  /** Removes {@code userId}'s {@code glyph} reaction from a message. */
  void removeReaction(long channelId, long messageId, long userId, String glyph)
      throws GatewayException;

  /** Sends a private message to a participant. */
  void sendDirectMessage(long userId, String text) throws GatewayException;

  /** Posts a message in a channel that the platform deletes after {@code ttl}. */
  void sendTransient(long channelId, String text, Duration ttl) throws GatewayException;

  /** Posts a rich message in a channel. */
  void sendCard(long channelId, Card card) throws GatewayException;

  /**
   * Posts a voting message and adds the given reactions to it.
   *
   * @return platform ID of the posted message
   */
  long postVotingMessage(long channelId, Card card, List<String> reactions)
      throws GatewayException;

  /** Looks up a guild member by account name. */
  Optional<Long> findMemberByName(long guildId, String name) throws GatewayException;

  /** Whether {@code userId} is currently a member of the guild. */
  boolean isMember(long guildId, long userId) throws GatewayException;

  /** Mention markup for a participant, e.g. {@code <@123>}. */
  default String mention(long userId) {
    return "<@" + userId + ">";
  }

  /** Mention markup for a channel, e.g. {@code <#123>}. */
  default String channelMention(long channelId) {
    return "<#" + channelId + ">";
  }
}
