/* Repute © 2025 Repute Devs — MIT */
package dev.repute.core;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dev.repute.admin.AdminAdjustmentService;
import dev.repute.api.ChatGateway;
import dev.repute.api.OperationResult;
import dev.repute.audit.AuditNotifier;
import dev.repute.commands.ReputationCommands;
import dev.repute.ledger.AuditSinks;
import dev.repute.ledger.DisabledVoters;
import dev.repute.ledger.ReputationLedger;
import dev.repute.persist.BlobStore;
import dev.repute.persist.FileBlobStore;
import dev.repute.persist.JdbcBlobStore;
import dev.repute.persist.PersistenceService;
import dev.repute.persist.StorageException;
import dev.repute.reconcile.ReactionReconciler;
import dev.repute.reconcile.SelfVoteGuard;
import dev.repute.reconcile.TrackedMessages;
import dev.repute.reconcile.VoteGlyphs;
import dev.repute.reconcile.VotingMessagePublisher;
import dev.repute.util.TokenBucketRateLimiter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Wires the ledger, reconciler, commands and persistence and owns their background threads. */
public final class CoreServices implements Services, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger("repute");

  private final ReputationLedger ledger;
  private final ReactionReconciler reconciler;
  private final VotingMessagePublisher publisher;
  private final ReputationCommands commands;
  private final AdminAdjustmentService admin;
  private final PersistenceService persistence;
  private final BlobStore store;
  private final HikariDataSource pool;
  private final ScheduledExecutorService scheduler;
  private final ExecutorService notifier;
  private final Metrics metrics;

  private CoreServices(
      ReputationLedger ledger,
      ReactionReconciler reconciler,
      VotingMessagePublisher publisher,
      ReputationCommands commands,
      AdminAdjustmentService admin,
      PersistenceService persistence,
      BlobStore store,
      HikariDataSource pool,
      ScheduledExecutorService scheduler,
      ExecutorService notifier,
      Metrics metrics) {
    this.ledger = ledger;
    this.reconciler = reconciler;
    this.publisher = publisher;
    this.commands = commands;
    this.admin = admin;
    this.persistence = persistence;
    this.store = store;
    this.pool = pool;
    this.scheduler = scheduler;
    this.notifier = notifier;
    this.metrics = metrics;
  }

  /**
   * Starts core services using the configured storage backend.
   *
   * @param cfg runtime configuration
   * @param gateway chat platform adapter
   * @return service container
   * @throws IllegalStateException if storage cannot be opened or persisted state cannot be read
   */
  public static Services start(Config cfg, ChatGateway gateway) {
    Config.Storage storage = cfg.storage();
    if (storage.backend() == Config.Backend.MARIADB) {
      HikariDataSource ds = openPool(storage.db());
      JdbcBlobStore jdbc = new JdbcBlobStore(ds);
      try {
        jdbc.ensureSchema();
      } catch (StorageException e) {
        ds.close();
        throw new IllegalStateException("Unable to create snapshot table: " + e.getMessage(), e);
      }
      return wire(cfg, gateway, jdbc, ds);
    }
    return wire(cfg, gateway, new FileBlobStore(Path.of(storage.dir())), null);
  }

  /**
   * Starts core services on a caller-supplied store. The store is closed on shutdown.
   *
   * @param cfg runtime configuration
   * @param gateway chat platform adapter
   * @param store snapshot storage
   * @return service container
   */
  public static Services start(Config cfg, ChatGateway gateway, BlobStore store) {
    return wire(cfg, gateway, store, null);
  }

  private static Services wire(
      Config cfg, ChatGateway gateway, BlobStore store, HikariDataSource pool) {
    ScheduledExecutorService scheduler =
        Executors.newSingleThreadScheduledExecutor(daemon("repute-persist"));
    ExecutorService notifier = Executors.newSingleThreadExecutor(daemon("repute-notify"));
    Metrics metrics = new Metrics();

    ReputationLedger ledger = new ReputationLedger();
    DisabledVoters disabledVoters = new DisabledVoters();
    AuditSinks auditSinks = new AuditSinks();
    PersistenceService persistence =
        new PersistenceService(
            ledger,
            disabledVoters,
            auditSinks,
            store,
            scheduler,
            cfg.storage().flushDebounceMs(),
            metrics);

    OperationResult restored = persistence.restore();
    if (!restored.ok()) {
      scheduler.shutdownNow();
      notifier.shutdownNow();
      metrics.close();
      closeQuietly(store, pool);
      throw new IllegalStateException(
          "Refusing to start with unreadable state (" + restored.code() + "): "
              + restored.message());
    }

    Runnable flush = persistence::requestFlush;
    VoteGlyphs glyphs = new VoteGlyphs(cfg.votes().goodGlyph(), cfg.votes().badGlyph());
    TrackedMessages tracked = new TrackedMessages(cfg.tracking().maxMessages());
    AuditNotifier audit = new AuditNotifier(gateway, auditSinks, notifier, metrics);
    Config.Notices notices = cfg.notices();
    SelfVoteGuard selfVotes =
        new SelfVoteGuard(
            gateway,
            notifier,
            new TokenBucketRateLimiter(
                notices.selfVoteCapacity(), notices.selfVoteRefillPerSec()),
            Duration.ofSeconds(notices.transientSeconds()),
            metrics);

    ReactionReconciler reconciler =
        new ReactionReconciler(
            ledger, tracked, disabledVoters, glyphs, selfVotes, flush, audit, metrics);
    VotingMessagePublisher publisher =
        new VotingMessagePublisher(gateway, ledger, tracked, glyphs, cfg.bot().sourceBotId());
    AdminAdjustmentService admin =
        new AdminAdjustmentService(
            ledger, flush, audit, metrics, cfg.admin().maxVotesPerAdd());
    ReputationCommands commands =
        new ReputationCommands(
            ledger, admin, disabledVoters, auditSinks, gateway, flush, cfg.bot());

    LOG.info(
        "(repute) started backend={} users={} votes={} active={}",
        cfg.storage().backend(),
        ledger.users().size(),
        ledger.voteCount(),
        ledger.activeVoteCount());
    return new CoreServices(
        ledger,
        reconciler,
        publisher,
        commands,
        admin,
        persistence,
        store,
        pool,
        scheduler,
        notifier,
        metrics);
  }

  static HikariDataSource openPool(Config.Db db) {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.jdbcUrl());
    hc.setUsername(db.user());
    hc.setPassword(db.password());
    hc.setMaximumPoolSize(db.pool().maxPoolSize());
    hc.setMinimumIdle(Math.min(db.pool().minimumIdle(), db.pool().maxPoolSize()));
    hc.setConnectionTimeout(db.pool().connectionTimeoutMs());
    hc.setIdleTimeout(db.pool().idleTimeoutMs());
    hc.setMaxLifetime(db.pool().maxLifetimeMs());
    hc.setAutoCommit(true);
    hc.setPoolName("repute-hikari");

    if (!db.tlsEnabled() && !isLocalHost(db.host())) {
      LOG.warn(
          "(repute) code={} op={} message={}",
          "DB_TLS_DISABLED",
          "config",
          "TLS is disabled for a non-local database host; enable storage.db.tls for security");
    }
    if ("change-me".equals(db.password())) {
      LOG.warn(
          "(repute) code={} op={} message={}",
          "DB_PASSWORD_DEFAULT",
          "config",
          "Database password is still set to the default 'change-me'");
    }

    RuntimeException last = null;
    int attempts = Math.max(1, db.pool().startupAttempts());
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        return new HikariDataSource(hc);
      } catch (RuntimeException ex) {
        last = ex;
        LOG.warn(
            "(repute) failed to start Hikari (attempt {}/{}): {}",
            attempt,
            attempts,
            ex.getMessage());
        if (attempt < attempts) {
          try {
            Thread.sleep(250L * attempt);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting datasource", ie);
          }
        }
      }
    }
    throw new IllegalStateException("Unable to start datasource", last);
  }

  @Override
  public ReputationLedger ledger() {
    return ledger;
  }

  @Override
  public ReactionReconciler reconciler() {
    return reconciler;
  }

  @Override
  public VotingMessagePublisher publisher() {
    return publisher;
  }

  @Override
  public ReputationCommands commands() {
    return commands;
  }

  @Override
  public AdminAdjustmentService admin() {
    return admin;
  }

  @Override
  public PersistenceService persistence() {
    return persistence;
  }

  @Override
  public Metrics metrics() {
    return metrics;
  }

  /** Writes pending state, drains notifications and closes storage. */
  @Override
  public void shutdown() throws IOException {
    scheduler.shutdownNow();
    OperationResult flushed = persistence.flushNow();
    if (!flushed.ok()) {
      LOG.error(
          "(repute) code={} op={} message={}", flushed.code(), "shutdown.flush", flushed.message());
    }
    notifier.shutdown();
    try {
      if (!notifier.awaitTermination(5, TimeUnit.SECONDS)) {
        notifier.shutdownNow();
      }
    } catch (InterruptedException e) {
      notifier.shutdownNow();
      Thread.currentThread().interrupt();
    }
    metrics.close();
    try {
      store.close();
    } catch (Exception e) {
      throw new IOException("Failed to close snapshot store", e);
    } finally {
      if (pool != null) {
        pool.close();
      }
    }
  }

  /** Alias for {@link #shutdown()}. */
  @Override
  public void close() throws IOException {
    shutdown();
  }

  private static ThreadFactory daemon(String name) {
    return r -> {
      Thread t = new Thread(r, name);
      t.setDaemon(true);
      return t;
    };
  }

  private static void closeQuietly(BlobStore store, HikariDataSource pool) {
    try {
      store.close();
    } catch (Exception e) {
      LOG.debug("(repute) store close issue", e);
    }
    if (pool != null) {
      pool.close();
    }
  }

  private static boolean isLocalHost(String host) {
    if (host == null) {
      return false;
    }
    String normalized = host.trim();
    if (normalized.isEmpty()) {
      return false;
    }
    return normalized.equalsIgnoreCase("localhost")
        || normalized.equals("127.0.0.1")
        || normalized.equals("0.0.0.0")
        || normalized.equals("::1")
        || normalized.equalsIgnoreCase("[::1]");
  }
}
