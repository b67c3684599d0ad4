/* Repute © 2025 Repute Devs — MIT */
package dev.repute.ledger;

import dev.repute.api.VoteType;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable audit log entry for one vote.
 *
 * <p>Reversal never mutates a record in place; the ledger swaps in the {@link #asReversed()} copy
 * so readers holding an old reference see a consistent value.
 *
 * @param voteId globally unique ID
 * @param voterId participant who cast the vote (the admin for admin-added votes)
 * @param authorId participant whose reputation the vote counts towards
 * @param tokenAddress token address, {@code "unknown"}, or {@link #ADMIN_TOKEN}
 * @param voteType stance
 * @param sourceMessageId tracked message the vote came from, {@code 0} for admin votes
 * @param timestamp creation time (UTC)
 * @param sequence creation order within this ledger
 * @param reversed whether the vote no longer counts
 */
public record VoteRecord(
    String voteId,
    long voterId,
    long authorId,
    String tokenAddress,
    VoteType voteType,
    long sourceMessageId,
    Instant timestamp,
    long sequence,
    boolean reversed) {

  /** Pseudo-token address of votes created by administrators. */
  public static final String ADMIN_TOKEN = "admin_added";

  public VoteRecord {
    Objects.requireNonNull(voteId, "voteId");
    Objects.requireNonNull(tokenAddress, "tokenAddress");
    Objects.requireNonNull(voteType, "voteType");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  /** Whether the vote was created by an administrator rather than a reaction. */
  public boolean adminAdded() {
    return ADMIN_TOKEN.equals(tokenAddress);
  }

  VoteRecord asReversed() {
    return reversed
        ? this
        : new VoteRecord(
            voteId,
            voterId,
            authorId,
            tokenAddress,
            voteType,
            sourceMessageId,
            timestamp,
            sequence,
            true);
  }

  boolean matches(long voter, long author, String token, VoteType type) {
    return voterId == voter
        && authorId == author
        && voteType == type
        && tokenAddress.equals(token);
  }
}
