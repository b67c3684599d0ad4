/* Repute © 2025 Repute Devs — MIT */
package dev.repute.core;

import dev.repute.admin.AdminAdjustmentService;
import dev.repute.commands.ReputationCommands;
import dev.repute.ledger.ReputationLedger;
import dev.repute.persist.PersistenceService;
import dev.repute.reconcile.ReactionReconciler;
import dev.repute.reconcile.VotingMessagePublisher;
import java.io.IOException;

/**
 * Service locator for the running ledger.
 *
 * <p>Created once at boot by {@link CoreServices#start}. Platform adapters feed reaction and
 * message events into {@link #reconciler()} and {@link #publisher()} and route commands to {@link
 * #commands()}. Call {@link #shutdown()} on stop so pending state is flushed.
 */
public interface Services {

  /** Ledger facade holding aggregates and the vote log. */
  ReputationLedger ledger();

  /** Reaction add/remove handler. */
  ReactionReconciler reconciler();

  /** Turns source-bot posts into tracked voting messages. */
  VotingMessagePublisher publisher();

  /** Command surface. */
  ReputationCommands commands();

  /** Administrative vote corrections. */
  AdminAdjustmentService admin();

  /** Snapshot writer. */
  PersistenceService persistence();

  /**
   * JMX counters.
   *
   * @return metrics registry or {@code null} when unavailable
   */
  default Metrics metrics() {
    return null;
  }

  /**
   * Flushes pending state, stops background executors and closes storage.
   *
   * @throws IOException if closing storage fails
   */
  void shutdown() throws IOException;
}
