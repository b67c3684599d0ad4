/* Repute © 2025 Repute Devs — MIT */
package dev.repute.ledger;

import java.util.List;

/**
 * Read-only copy of a participant's standing on one token.
 *
 * @param address token address or {@code "unknown"}
 * @param symbol last extracted display symbol
 * @param good active good votes
 * @param bad active bad votes
 * @param goodVoters voters currently holding a good stance, in arrival order
 * @param badVoters voters currently holding a bad stance, in arrival order
 */
public record TokenView(
    String address,
    String symbol,
    int good,
    int bad,
    List<Long> goodVoters,
    List<Long> badVoters) {

  public TokenView {
    goodVoters = List.copyOf(goodVoters);
    badVoters = List.copyOf(badVoters);
  }

  public int score() {
    return good - bad;
  }

  public int totalVotes() {
    return good + bad;
  }
}
