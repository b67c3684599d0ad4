/* Repute © 2025 Repute Devs — MIT */
package dev.repute.api;

import java.util.Locale;

/** The two stances a voter can hold on a token. */
public enum VoteType {
  GOOD("good"),
  BAD("bad");

  private final String key;

  VoteType(String key) {
    this.key = key;
  }

  /**
   * Lower-case key used in persisted records and command arguments.
   *
   * @return {@code "good"} or {@code "bad"}
   */
  public String key() {
    return key;
  }

  /**
   * The mutually exclusive stance.
   *
   * @return {@link #BAD} for {@link #GOOD} and vice versa
   */
  public VoteType opposite() {
    return this == GOOD ? BAD : GOOD;
  }

  /**
   * Parses a persisted or user supplied key.
   *
   * @param raw {@code good}/{@code bad}, case-insensitive
   * @return matching vote type
   * @throws IllegalArgumentException if the key is unknown
   */
  public static VoteType fromKey(String raw) {
    if (raw != null) {
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      for (VoteType type : values()) {
        if (type.key.equals(normalized)) {
          return type;
        }
      }
    }
    throw new IllegalArgumentException("unknown vote type: " + raw);
  }
}
