/* Repute © 2025 Repute Devs — MIT */
package dev.repute.ledger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only copy of a participant's reputation.
 *
 * @param userId participant ID
 * @param good total good votes, including admin-added ones
 * @param bad total bad votes, including admin-added ones
 * @param tokens per-token standings keyed by address, in first-vote order
 */
public record UserView(long userId, int good, int bad, Map<String, TokenView> tokens) {

  public UserView {
    tokens = Collections.unmodifiableMap(new LinkedHashMap<>(tokens));
  }

  /** Zeroed view for participants nobody has voted on. */
  public static UserView empty(long userId) {
    return new UserView(userId, 0, 0, Map.of());
  }

  public int score() {
    return good - bad;
  }

  public int totalVotes() {
    return good + bad;
  }

  /** Share of good votes in percent, {@code 0} when there are no votes. */
  public double reputationPercent() {
    int total = totalVotes();
    return total == 0 ? 0.0 : good * 100.0 / total;
  }
}
