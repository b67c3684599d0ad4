/* Repute © 2025 Repute Devs — MIT */
package dev.repute.api;

import java.util.Objects;

/**
 * Rich message posted through the {@link ChatGateway} (audit entries, profiles, boards).
 *
 * @param title heading line, may be empty
 * @param body multi-line markdown body
 * @param tone colour hint for platforms that render one
 */
public record Card(String title, String body, Tone tone) {

  public Card {
    title = title == null ? "" : title;
    body = body == null ? "" : body;
    tone = Objects.requireNonNullElse(tone, Tone.NEUTRAL);
  }

  /** Colour hint. */
  public enum Tone {
    NEUTRAL,
    POSITIVE,
    NEGATIVE,
    WARNING
  }
}
