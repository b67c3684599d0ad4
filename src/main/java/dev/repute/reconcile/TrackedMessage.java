/* Repute © 2025 Repute Devs — MIT */
package dev.repute.reconcile;

import java.util.Objects;

/**
 * Context of a bot-posted voting message: whose reputation its reactions count towards and for
 * which token.
 *
 * @param messageId voting message ID
 * @param guildId guild the message was posted in
 * @param channelId channel the message was posted in
 * @param authorId participant being voted on
 * @param tokenAddress token address or {@code "unknown"}
 * @param tokenSymbol display symbol captured when the message was posted
 */
public record TrackedMessage(
    long messageId,
    long guildId,
    long channelId,
    long authorId,
    String tokenAddress,
    String tokenSymbol) {

  public TrackedMessage {
    Objects.requireNonNull(tokenAddress, "tokenAddress");
    tokenSymbol = tokenSymbol == null ? "" : tokenSymbol;
  }
}
