/* Repute © 2025 Repute Devs — MIT */
package dev.repute.core;

import dev.repute.api.ErrorCode;
import java.lang.management.ManagementFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import javax.management.InstanceAlreadyExistsException;
import javax.management.MBeanRegistrationException;
import javax.management.MBeanServer;
import javax.management.MalformedObjectNameException;
import javax.management.NotCompliantMBeanException;
import javax.management.ObjectName;
import javax.management.StandardMBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counters for vote reconciliation, admin adjustments, persistence and notifications, exposed via
 * JMX as {@code dev.repute:type=ReputeMetrics}.
 */
public final class Metrics implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("repute");
  private static final String MBEAN_NAME = "dev.repute:type=ReputeMetrics";

  private final AtomicLong votesAdded = new AtomicLong();
  private final AtomicLong votesSwitched = new AtomicLong();
  private final AtomicLong votesRemoved = new AtomicLong();
  private final AtomicLong duplicateVotes = new AtomicLong();
  private final AtomicLong selfVotesRejected = new AtomicLong();
  private final AtomicLong adminVotesAdded = new AtomicLong();
  private final AtomicLong adminVotesRemoved = new AtomicLong();
  private final AtomicLong ambiguousMatches = new AtomicLong();
  private final AtomicLong flushSuccess = new AtomicLong();
  private final AtomicLong flushFailure = new AtomicLong();
  private final AtomicLong notificationFailures = new AtomicLong();
  private final AtomicLong reconcileFailures = new AtomicLong();

  private final AtomicReference<String> lastPersistenceErrorCode = new AtomicReference<>("NONE");

  private final MBeanServer server;
  private final ObjectName objectName;

  /** Creates and registers the metrics MBean. */
  public Metrics() {
    this.server = ManagementFactory.getPlatformMBeanServer();
    this.objectName = createObjectName();
    registerMBean();
  }

  public void recordVoteAdded() {
    votesAdded.incrementAndGet();
  }

  public void recordVoteSwitched() {
    votesSwitched.incrementAndGet();
  }

  public void recordVoteRemoved() {
    votesRemoved.incrementAndGet();
  }

  public void recordDuplicateVote() {
    duplicateVotes.incrementAndGet();
  }

  public void recordSelfVoteRejected() {
    selfVotesRejected.incrementAndGet();
  }

  public void recordAdminVotesAdded(int count) {
    adminVotesAdded.addAndGet(Math.max(0, count));
  }

  public void recordAdminVotesRemoved(int count) {
    adminVotesRemoved.addAndGet(Math.max(0, count));
  }

  public void recordAmbiguousMatch() {
    ambiguousMatches.incrementAndGet();
  }

  /** Records a snapshot flush outcome. */
  public void recordFlush(boolean ok, ErrorCode code) {
    (ok ? flushSuccess : flushFailure).incrementAndGet();
    if (!ok && code != null) {
      lastPersistenceErrorCode.set(code.name());
    }
  }

  public void recordNotificationFailure() {
    notificationFailures.incrementAndGet();
  }

  public void recordReconcileFailure() {
    reconcileFailures.incrementAndGet();
  }

  public long votesAdded() {
    return votesAdded.get();
  }

  public long votesSwitched() {
    return votesSwitched.get();
  }

  public long votesRemoved() {
    return votesRemoved.get();
  }

  public long duplicateVotes() {
    return duplicateVotes.get();
  }

  public long selfVotesRejected() {
    return selfVotesRejected.get();
  }

  public long adminVotesAdded() {
    return adminVotesAdded.get();
  }

  public long adminVotesRemoved() {
    return adminVotesRemoved.get();
  }

  public long ambiguousMatches() {
    return ambiguousMatches.get();
  }

  public long flushSuccess() {
    return flushSuccess.get();
  }

  public long flushFailure() {
    return flushFailure.get();
  }

  public long notificationFailures() {
    return notificationFailures.get();
  }

  public long reconcileFailures() {
    return reconcileFailures.get();
  }

  private ObjectName createObjectName() {
    try {
      return new ObjectName(MBEAN_NAME);
    } catch (MalformedObjectNameException e) {
      throw new IllegalStateException("Invalid metrics object name", e);
    }
  }

  private void registerMBean() {
    try {
      if (server.isRegistered(objectName)) {
        server.unregisterMBean(objectName);
      }
      server.registerMBean(new StandardMBean(new Bean(), ReputeMetricsMBean.class), objectName);
    } catch (InstanceAlreadyExistsException
        | MBeanRegistrationException
        | NotCompliantMBeanException e) {
      LOG.warn("(repute) metrics registration failed", e);
    } catch (Exception e) {
      LOG.warn("(repute) metrics registration unexpected failure", e);
    }
  }

  @Override
  public void close() {
    try {
      if (server.isRegistered(objectName)) {
        server.unregisterMBean(objectName);
      }
    } catch (Exception e) {
      LOG.debug("(repute) metrics unregister failed", e);
    }
  }

  private final class Bean implements ReputeMetricsMBean {
    @Override
    public long getVotesAdded() {
      return votesAdded.get();
    }

    @Override
    public long getVotesSwitched() {
      return votesSwitched.get();
    }

    @Override
    public long getVotesRemoved() {
      return votesRemoved.get();
    }

    @Override
    public long getDuplicateVotes() {
      return duplicateVotes.get();
    }

    @Override
    public long getSelfVotesRejected() {
      return selfVotesRejected.get();
    }

    @Override
    public long getAdminVotesAdded() {
      return adminVotesAdded.get();
    }

    @Override
    public long getAdminVotesRemoved() {
      return adminVotesRemoved.get();
    }

    @Override
    public long getAmbiguousMatches() {
      return ambiguousMatches.get();
    }

    @Override
    public long getFlushSuccess() {
      return flushSuccess.get();
    }

    @Override
    public long getFlushFailure() {
      return flushFailure.get();
    }

    @Override
    public long getNotificationFailures() {
      return notificationFailures.get();
    }

    @Override
    public long getReconcileFailures() {
      return reconcileFailures.get();
    }

    @Override
    public String getLastPersistenceErrorCode() {
      return lastPersistenceErrorCode.get();
    }
  }

  /** JMX view of the metrics registry. */
  public interface ReputeMetricsMBean {
    /** Reaction votes recorded as new stances. */
    long getVotesAdded();

    /** Reaction votes that replaced the opposite stance. */
    long getVotesSwitched();

    /** Reaction votes reversed by reaction removal. */
    long getVotesRemoved();

    /** Add events for a stance the voter already held. */
    long getDuplicateVotes();

    /** Reactions rejected because the actor was the tracked author. */
    long getSelfVotesRejected();

    /** Votes created by administrators. */
    long getAdminVotesAdded();

    /** Votes reversed by administrators. */
    long getAdminVotesRemoved();

    /** Removals where more than one active vote matched. */
    long getAmbiguousMatches();

    /** Successful snapshot flushes. */
    long getFlushSuccess();

    /** Failed snapshot flushes. */
    long getFlushFailure();

    /** Audit entries or notices that could not be delivered. */
    long getNotificationFailures();

    /** Reaction events that failed with an unexpected error. */
    long getReconcileFailures();

    /** Last observed persistence error code. */
    String getLastPersistenceErrorCode();
  }
}
