/* Repute © 2025 Repute Devs — MIT */
package dev.repute.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.repute.api.VoteType;
import dev.repute.api.events.ReactionEvent;
import dev.repute.api.events.SourceMessageEvent;
import dev.repute.console.LoggingChatGateway;
import dev.repute.extract.StructuredContent;
import dev.repute.persist.FileBlobStore;
import dev.repute.reconcile.ReconcileOutcome;
import dev.repute.reconcile.TrackedMessage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CoreServicesTest {
  private static final String TOKEN = "7GCihgDB8fe6KNjn2MYtkzZcRjQy3t9GHdC8uHYmW2hr";

  @TempDir Path tempDir;

  private Config cfg;

  @BeforeEach
  void setUp() {
    cfg = Config.parse("{ bot: { sourceBotId: 900 }, storage: { flushDebounceMs: 10 } }", Map.of());
    LocaleManager.initialize(cfg.i18n());
  }

  @AfterEach
  void tearDown() {
    LocaleManager.resetForTests();
  }

  @Test
  void stateSurvivesRestart() throws Exception {
    Services first = CoreServices.start(cfg, new LoggingChatGateway(1_000L), store());
    TrackedMessage message = first.publisher().onMessage(sourcePost()).orElseThrow();
    assertEquals(1_000L, message.messageId());
    assertEquals(10L, message.authorId());
    assertEquals(
        ReconcileOutcome.ADDED,
        first.reconciler().onReactionAdded(new ReactionEvent(1L, 2L, 1_000L, 21L, false, "🟢")));
    first.admin().addVotes(1L, 5L, 10L, VoteType.BAD, 2);
    first.shutdown();

    assertTrue(Files.exists(tempDir.resolve("reputation_log.json")));

    Services second = CoreServices.start(cfg, new LoggingChatGateway(2_000L), store());
    try {
      assertEquals(3, second.ledger().voteCount());
      assertEquals(-1, second.ledger().user(10L).orElseThrow().score());
      assertEquals("WIF", second.ledger().user(10L).orElseThrow().tokens().get(TOKEN).symbol());
    } finally {
      second.shutdown();
    }
  }

  @Test
  void unreadableStateRefusesToStart() throws Exception {
    Files.writeString(tempDir.resolve("reputation.json"), "{broken");

    IllegalStateException ex =
        assertThrows(
            IllegalStateException.class,
            () -> CoreServices.start(cfg, new LoggingChatGateway(1L), store()));

    assertTrue(ex.getMessage().startsWith("Refusing to start with unreadable state"));
  }

  private FileBlobStore store() {
    return new FileBlobStore(tempDir);
  }

  private static SourceMessageEvent sourcePost() {
    StructuredContent embed =
        new StructuredContent("Call", "CA " + TOKEN, List.of(), "10 via scanner");
    return new SourceMessageEvent(1L, 2L, 300L, 900L, "**$WIF** sent", List.of(embed));
  }
}
