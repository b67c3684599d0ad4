/* Repute © 2025 Repute Devs — MIT */
package dev.repute.api.events;

/**
 * A reaction added to or removed from a message, as delivered by the chat platform.
 *
 * <p>Delivery is at-least-once and unordered; the reconciler tolerates duplicates and replays.
 *
 * @param guildId guild the message lives in
 * @param channelId channel the message lives in
 * @param messageId reacted message
 * @param actorId participant who added or removed the reaction
 * @param actorIsBot whether the actor is a bot account
 * @param glyph reaction glyph as text
 */
public record ReactionEvent(
    long guildId, long channelId, long messageId, long actorId, boolean actorIsBot, String glyph) {}
