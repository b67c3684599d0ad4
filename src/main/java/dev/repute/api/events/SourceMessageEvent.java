/* Repute © 2025 Repute Devs — MIT */
package dev.repute.api.events;

import dev.repute.extract.StructuredContent;
import java.util.List;

/**
 * A message posted in a guild channel, carrying its text and structured embeds.
 *
 * @param guildId guild the message was posted in
 * @param channelId channel the message was posted in
 * @param messageId platform message ID
 * @param authorId posting account
 * @param content free text of the message
 * @param embeds structured attachments, in display order
 */
public record SourceMessageEvent(
    long guildId,
    long channelId,
    long messageId,
    long authorId,
    String content,
    List<StructuredContent> embeds) {

  public SourceMessageEvent {
    content = content == null ? "" : content;
    embeds = embeds == null ? List.of() : List.copyOf(embeds);
  }
}
