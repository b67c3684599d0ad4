/* Repute © 2025 Repute Devs — MIT */
package dev.repute.reconcile;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Voting messages whose reactions count as votes.
 *
 * <p>Holds at most {@code maxMessages} entries ({@code 0} means unbounded); the least recently used
 * message is forgotten first and its reactions are ignored from then on.
 */
public final class TrackedMessages {
  private final int maxMessages;
  private final LinkedHashMap<Long, TrackedMessage> messages;

  public TrackedMessages(int maxMessages) {
    if (maxMessages < 0) {
      throw new IllegalArgumentException("maxMessages must be >= 0");
    }
    this.maxMessages = maxMessages;
    this.messages =
        new LinkedHashMap<>(16, 0.75f, true) {
          private static final long serialVersionUID = 1L;

          @Override
          protected boolean removeEldestEntry(Map.Entry<Long, TrackedMessage> eldest) {
            return TrackedMessages.this.maxMessages > 0
                && size() > TrackedMessages.this.maxMessages;
          }
        };
  }

  public synchronized void track(TrackedMessage message) {
    messages.put(message.messageId(), message);
  }

  public synchronized Optional<TrackedMessage> find(long messageId) {
    return Optional.ofNullable(messages.get(messageId));
  }

  public synchronized int size() {
    return messages.size();
  }
}
