/* Repute © 2025 Repute Devs — MIT */
package dev.repute.audit;

import dev.repute.api.Card;
import dev.repute.api.ChatGateway;
import dev.repute.api.ErrorCode;
import dev.repute.api.GatewayException;
import dev.repute.core.Metrics;
import dev.repute.ledger.AuditSinks;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts audit entries to each guild's configured audit channel.
 *
 * <p>Delivery is asynchronous and best-effort: failures are logged and counted, never propagated
 * to the mutation that produced the entry.
 */
public final class AuditNotifier {
  private static final Logger LOG = LoggerFactory.getLogger("repute");

  private final ChatGateway gateway;
  private final AuditSinks sinks;
  private final Executor executor;
  private final Metrics metrics;

  public AuditNotifier(ChatGateway gateway, AuditSinks sinks, Executor executor, Metrics metrics) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.sinks = Objects.requireNonNull(sinks, "sinks");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.metrics = metrics;
  }

  /**
   * Queues an entry for the guild's audit channel.
   *
   * @return {@code true} if the guild has a sink and the entry was queued
   */
  public boolean notify(long guildId, Card entry) {
    Optional<Long> channel = sinks.find(guildId);
    if (channel.isEmpty()) {
      return false;
    }
    long channelId = channel.get();
    try {
      executor.execute(() -> deliver(guildId, channelId, entry));
      return true;
    } catch (RejectedExecutionException e) {
      failed(guildId, channelId, "audit executor rejected entry", e);
      return false;
    }
  }

  private void deliver(long guildId, long channelId, Card entry) {
    try {
      gateway.sendCard(channelId, entry);
    } catch (GatewayException | RuntimeException e) {
      failed(guildId, channelId, e.getMessage(), e);
    }
  }

  private void failed(long guildId, long channelId, String message, Throwable cause) {
    if (metrics != null) {
      metrics.recordNotificationFailure();
    }
    LOG.warn(
        "(repute) code={} op={} guild={} channel={} message={}",
        ErrorCode.NOTIFICATION_FAILURE,
        "audit.deliver",
        guildId,
        channelId,
        message,
        cause);
  }
}
