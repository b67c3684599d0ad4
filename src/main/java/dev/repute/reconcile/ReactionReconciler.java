/* Repute © 2025 Repute Devs — MIT */
package dev.repute.reconcile;

import dev.repute.api.ErrorCode;
import dev.repute.api.VoteType;
import dev.repute.api.events.ReactionEvent;
import dev.repute.audit.AuditEntries;
import dev.repute.audit.AuditNotifier;
import dev.repute.core.Metrics;
import dev.repute.ledger.ApplyOutcome;
import dev.repute.ledger.DisabledVoters;
import dev.repute.ledger.ReputationLedger;
import dev.repute.ledger.ReputationLedger.Retraction;
import dev.repute.ledger.ReputationLedger.VoteChange;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns reaction add/remove events on tracked voting messages into ledger mutations.
 *
 * <p>Events may arrive concurrently, duplicated or out of order. Each handler is total: unexpected
 * errors are logged, counted and reported as {@link ReconcileOutcome#FAILED}. Persistence and audit
 * follow the mutation and never undo it.
 */
public final class ReactionReconciler {
  private static final Logger LOG = LoggerFactory.getLogger("repute");

  private final ReputationLedger ledger;
  private final TrackedMessages tracked;
  private final DisabledVoters disabledVoters;
  private final VoteGlyphs glyphs;
  private final SelfVoteGuard selfVotes;
  private final Runnable flush;
  private final AuditNotifier audit;
  private final Metrics metrics;

  /**
   * Creates a reconciler.
   *
   * @param flush requests a coalesced persistence flush after each mutation
   */
  public ReactionReconciler(
      ReputationLedger ledger,
      TrackedMessages tracked,
      DisabledVoters disabledVoters,
      VoteGlyphs glyphs,
      SelfVoteGuard selfVotes,
      Runnable flush,
      AuditNotifier audit,
      Metrics metrics) {
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.tracked = Objects.requireNonNull(tracked, "tracked");
    this.disabledVoters = Objects.requireNonNull(disabledVoters, "disabledVoters");
    this.glyphs = Objects.requireNonNull(glyphs, "glyphs");
    this.selfVotes = Objects.requireNonNull(selfVotes, "selfVotes");
    this.flush = Objects.requireNonNull(flush, "flush");
    this.audit = Objects.requireNonNull(audit, "audit");
    this.metrics = metrics;
  }

  public ReconcileOutcome onReactionAdded(ReactionEvent event) {
    try {
      return added(event);
    } catch (RuntimeException e) {
      return failed("reconcile.added", event, e);
    }
  }

  public ReconcileOutcome onReactionRemoved(ReactionEvent event) {
    try {
      return removed(event);
    } catch (RuntimeException e) {
      return failed("reconcile.removed", event, e);
    }
  }

  private ReconcileOutcome added(ReactionEvent event) {
    if (event.actorIsBot()) {
      return ReconcileOutcome.IGNORED_BOT;
    }
    if (disabledVoters.contains(event.actorId())) {
      return ReconcileOutcome.IGNORED_DISABLED;
    }
    Optional<VoteType> type = glyphs.typeOf(event.glyph());
    if (type.isEmpty()) {
      return ReconcileOutcome.IGNORED_GLYPH;
    }
    Optional<TrackedMessage> context = tracked.find(event.messageId());
    if (context.isEmpty()) {
      return ReconcileOutcome.IGNORED_UNTRACKED;
    }
    TrackedMessage message = context.get();
    if (event.actorId() == message.authorId()) {
      selfVotes.reject(event);
      if (metrics != null) {
        metrics.recordSelfVoteRejected();
      }
      LOG.debug(
          "(repute) code={} op={} actor={} message={}",
          ErrorCode.SELF_VOTE,
          "reconcile.added",
          event.actorId(),
          event.messageId());
      return ReconcileOutcome.REJECTED_SELF_VOTE;
    }

    VoteChange change =
        ledger.castVote(
            message.authorId(),
            event.actorId(),
            message.tokenAddress(),
            message.tokenSymbol(),
            type.get(),
            event.messageId());
    if (change.outcome() == ApplyOutcome.UNCHANGED) {
      if (metrics != null) {
        metrics.recordDuplicateVote();
      }
      return ReconcileOutcome.DUPLICATE;
    }
    if (change.ambiguous()) {
      ambiguous("reconcile.switch", event);
    }
    boolean switched = change.outcome() == ApplyOutcome.SWITCHED;
    flush.run();
    audit.notify(
        event.guildId(), AuditEntries.voteCast(change.recorded(), message.tokenSymbol(), switched));
    if (metrics != null) {
      if (switched) {
        metrics.recordVoteSwitched();
      } else {
        metrics.recordVoteAdded();
      }
    }
    LOG.debug(
        "(repute) op={} vote={} voter={} author={} type={} switched={}",
        "reconcile.added",
        change.recorded().voteId(),
        event.actorId(),
        message.authorId(),
        type.get().key(),
        switched);
    return switched ? ReconcileOutcome.SWITCHED : ReconcileOutcome.ADDED;
  }

  private ReconcileOutcome removed(ReactionEvent event) {
    if (event.actorIsBot()) {
      return ReconcileOutcome.IGNORED_BOT;
    }
    if (disabledVoters.contains(event.actorId())) {
      return ReconcileOutcome.IGNORED_DISABLED;
    }
    Optional<VoteType> type = glyphs.typeOf(event.glyph());
    if (type.isEmpty()) {
      return ReconcileOutcome.IGNORED_GLYPH;
    }
    Optional<TrackedMessage> context = tracked.find(event.messageId());
    if (context.isEmpty()) {
      return ReconcileOutcome.IGNORED_UNTRACKED;
    }
    TrackedMessage message = context.get();
    if (event.actorId() == message.authorId()) {
      return ReconcileOutcome.IGNORED_SELF;
    }

    Retraction retraction =
        ledger.retractReactionVote(
            message.authorId(),
            event.actorId(),
            message.tokenAddress(),
            type.get(),
            event.messageId());
    if (!retraction.found()) {
      return ReconcileOutcome.NO_MATCH;
    }
    if (retraction.ambiguous()) {
      ambiguous("reconcile.removed", event);
    }
    flush.run();
    audit.notify(
        event.guildId(), AuditEntries.voteRemoved(retraction.reversed(), message.tokenSymbol()));
    if (metrics != null) {
      metrics.recordVoteRemoved();
    }
    return ReconcileOutcome.REMOVED;
  }

  private void ambiguous(String op, ReactionEvent event) {
    if (metrics != null) {
      metrics.recordAmbiguousMatch();
    }
    LOG.warn(
        "(repute) code={} op={} voter={} message={} detail={}",
        ErrorCode.AMBIGUOUS_VOTE_STATE,
        op,
        event.actorId(),
        event.messageId(),
        "several active votes matched; the most recent one was reversed");
  }

  private ReconcileOutcome failed(String op, ReactionEvent event, RuntimeException e) {
    if (metrics != null) {
      metrics.recordReconcileFailure();
    }
    LOG.error(
        "(repute) op={} voter={} message={} glyph={} error={}",
        op,
        event.actorId(),
        event.messageId(),
        event.glyph(),
        e.getMessage(),
        e);
    return ReconcileOutcome.FAILED;
  }
}
