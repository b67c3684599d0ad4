/* Repute © 2025 Repute Devs — MIT */
package dev.repute.reconcile;

import dev.repute.api.ChatGateway;
import dev.repute.api.ErrorCode;
import dev.repute.api.GatewayException;
import dev.repute.api.events.ReactionEvent;
import dev.repute.core.LocaleManager;
import dev.repute.core.Metrics;
import dev.repute.util.TokenBucketRateLimiter;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undoes an author's reaction on their own voting message and tells them why.
 *
 * <p>Fire-and-forget on the notice executor. The notice goes by private message, falling back to a
 * transient channel message; notices are rate limited per participant.
 */
public final class SelfVoteGuard {
  private static final Logger LOG = LoggerFactory.getLogger("repute");

  private final ChatGateway gateway;
  private final Executor executor;
  private final TokenBucketRateLimiter notices;
  private final Duration transientTtl;
  private final Metrics metrics;

  public SelfVoteGuard(
      ChatGateway gateway,
      Executor executor,
      TokenBucketRateLimiter notices,
      Duration transientTtl,
      Metrics metrics) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.notices = Objects.requireNonNull(notices, "notices");
    this.transientTtl = Objects.requireNonNull(transientTtl, "transientTtl");
    this.metrics = metrics;
  }

  /** Queues removal of the reaction plus the notice. */
  public void reject(ReactionEvent event) {
    try {
      executor.execute(() -> compensate(event));
    } catch (RejectedExecutionException e) {
      LOG.warn(
          "(repute) code={} op={} actor={} message={}",
          ErrorCode.GATEWAY_FAILURE,
          "selfVote.queue",
          event.actorId(),
          e.getMessage());
    }
  }

  void compensate(ReactionEvent event) {
    try {
      gateway.removeReaction(
          event.channelId(), event.messageId(), event.actorId(), event.glyph());
    } catch (GatewayException e) {
      LOG.warn(
          "(repute) code={} op={} actor={} message={}",
          ErrorCode.GATEWAY_FAILURE,
          "selfVote.removeReaction",
          event.actorId(),
          e.getMessage());
    }
    if (!notices.tryAcquire(event.actorId())) {
      LOG.debug("(repute) op={} actor={} notice rate limited", "selfVote.notice", event.actorId());
      return;
    }
    try {
      gateway.sendDirectMessage(event.actorId(), LocaleManager.translate("notice.self_vote.dm"));
    } catch (GatewayException dmFailure) {
      String mention = gateway.mention(event.actorId());
      String text = LocaleManager.format("notice.self_vote.channel", "user", mention);
      try {
        gateway.sendTransient(event.channelId(), text, transientTtl);
      } catch (GatewayException e) {
        if (metrics != null) {
          metrics.recordNotificationFailure();
        }
        LOG.warn(
            "(repute) code={} op={} actor={} message={} dm={}",
            ErrorCode.NOTIFICATION_FAILURE,
            "selfVote.notice",
            event.actorId(),
            e.getMessage(),
            dmFailure.getMessage());
      }
    }
  }
}
