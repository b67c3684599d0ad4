/* Repute © 2025 Repute Devs — MIT */
package dev.repute.admin;

import dev.repute.api.ErrorCode;
import dev.repute.api.OperationResult;
import dev.repute.api.VoteType;
import dev.repute.audit.AuditEntries;
import dev.repute.audit.AuditNotifier;
import dev.repute.core.Metrics;
import dev.repute.ledger.ReputationLedger;
import dev.repute.ledger.ReputationLedger.ReversalResult;
import dev.repute.ledger.VoteRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Administrative corrections: bulk creation of admin votes and reversal of any vote by ID.
 *
 * <p>Skips every reaction rule (self votes, disabled voters, tracked messages) but uses the same
 * atomic ledger operations, so aggregates and log stay in step.
 */
public final class AdminAdjustmentService {
  private static final Logger LOG = LoggerFactory.getLogger("repute");

  private final ReputationLedger ledger;
  private final Runnable flush;
  private final AuditNotifier audit;
  private final Metrics metrics;
  private final int maxVotesPerAdd;

  /**
   * @param maxVotesPerAdd largest count a single {@link #addVotes} call accepts
   * @throws IllegalArgumentException if {@code maxVotesPerAdd} is not positive
   */
  public AdminAdjustmentService(
      ReputationLedger ledger,
      Runnable flush,
      AuditNotifier audit,
      Metrics metrics,
      int maxVotesPerAdd) {
    if (maxVotesPerAdd < 1) {
      throw new IllegalArgumentException("maxVotesPerAdd must be positive: " + maxVotesPerAdd);
    }
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.flush = Objects.requireNonNull(flush, "flush");
    this.audit = Objects.requireNonNull(audit, "audit");
    this.metrics = metrics;
    this.maxVotesPerAdd = maxVotesPerAdd;
  }

  public int maxVotesPerAdd() {
    return maxVotesPerAdd;
  }

  /**
   * Adds {@code count} votes of {@code type} to {@code authorId}'s totals.
   *
   * @param guildId guild whose audit channel receives the entry
   * @param adminId administrator recorded as voter
   * @param authorId participant receiving the votes
   * @param type stance of the votes
   * @param count number of votes, between 1 and {@link #maxVotesPerAdd()}
   * @return the new vote IDs, or {@link ErrorCode#INVALID_AMOUNT} without any change
   */
  public AddResult addVotes(long guildId, long adminId, long authorId, VoteType type, int count) {
    if (count <= 0) {
      return new AddResult(
          OperationResult.failure(ErrorCode.INVALID_AMOUNT, "amount must be positive"), List.of());
    }
    if (count > maxVotesPerAdd) {
      return new AddResult(
          OperationResult.failure(
              ErrorCode.INVALID_AMOUNT, "amount exceeds maximum of " + maxVotesPerAdd),
          List.of());
    }
    if (type == null) {
      return new AddResult(
          OperationResult.failure(ErrorCode.INVALID_ARGUMENT, "vote type required"), List.of());
    }
    List<VoteRecord> created = ledger.addAdminVotes(adminId, authorId, type, count);
    List<String> ids = created.stream().map(VoteRecord::voteId).toList();
    flush.run();
    audit.notify(guildId, AuditEntries.adminAdded(adminId, authorId, type, ids));
    if (metrics != null) {
      metrics.recordAdminVotesAdded(ids.size());
    }
    LOG.info(
        "(repute) op={} admin={} author={} type={} count={}",
        "admin.addVotes",
        adminId,
        authorId,
        type.key(),
        count);
    return new AddResult(OperationResult.success(), ids);
  }

  /**
   * Reverses each listed vote, whatever created it.
   *
   * <p>IDs are trimmed; blank entries are reported as not found. One bad ID never aborts the rest.
   */
  public RemovalReport removeVotesById(long guildId, long adminId, List<String> voteIds) {
    List<String> removed = new ArrayList<>();
    List<String> alreadyReversed = new ArrayList<>();
    List<String> notFound = new ArrayList<>();
    for (String raw : voteIds) {
      String id = raw == null ? "" : raw.strip();
      if (id.isEmpty()) {
        notFound.add(id);
        continue;
      }
      ReversalResult result = ledger.reverseVote(id);
      switch (result.status()) {
        case OK -> removed.add(id);
        case ALREADY_REVERSED -> alreadyReversed.add(id);
        case NOT_FOUND -> notFound.add(id);
        default -> throw new IllegalStateException("unexpected status " + result.status());
      }
    }
    if (!removed.isEmpty()) {
      flush.run();
      audit.notify(guildId, AuditEntries.adminRemoved(adminId, removed));
      if (metrics != null) {
        metrics.recordAdminVotesRemoved(removed.size());
      }
    }
    LOG.info(
        "(repute) op={} admin={} removed={} alreadyReversed={} notFound={}",
        "admin.removeVotes",
        adminId,
        removed.size(),
        alreadyReversed.size(),
        notFound.size());
    return new RemovalReport(removed, alreadyReversed, notFound);
  }

  /**
   * Outcome of {@link #addVotes}.
   *
   * @param result success or the validation failure
   * @param voteIds created vote IDs in creation order, empty on failure
   */
  public record AddResult(OperationResult result, List<String> voteIds) {
    public AddResult {
      voteIds = List.copyOf(voteIds);
    }
  }
}
