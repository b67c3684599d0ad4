/* Repute © 2025 Repute Devs — MIT */
package dev.repute.reconcile;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import dev.repute.api.ChatGateway;
import dev.repute.api.GatewayException;
import dev.repute.api.events.ReactionEvent;
import dev.repute.core.Config;
import dev.repute.core.LocaleManager;
import dev.repute.util.TokenBucketRateLimiter;
import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class SelfVoteGuardTest {
  private static final ReactionEvent SELF = new ReactionEvent(1L, 2L, 500L, 10L, false, "🟢");

  private ChatGateway gateway;

  @BeforeEach
  void setUp() {
    LocaleManager.initialize(Config.defaults().i18n());
    gateway = mock(ChatGateway.class, Mockito.CALLS_REAL_METHODS);
  }

  @Test
  void noticeStillSentWhenReactionRemovalFails() throws Exception {
    doThrow(new GatewayException("missing permission", true, null))
        .when(gateway)
        .removeReaction(anyLong(), anyLong(), anyLong(), anyString());

    guard(1).compensate(SELF);

    verify(gateway).sendDirectMessage(eq(10L), eq(LocaleManager.translate("notice.self_vote.dm")));
  }

  @Test
  void channelFallbackFailureIsContained() throws Exception {
    doThrow(new GatewayException("dms closed", true, null))
        .when(gateway)
        .sendDirectMessage(anyLong(), anyString());
    doThrow(new GatewayException("channel gone", false, null))
        .when(gateway)
        .sendTransient(anyLong(), anyString(), any(Duration.class));

    guard(1).compensate(SELF);

    verify(gateway).sendTransient(eq(2L), anyString(), eq(Duration.ofSeconds(10)));
  }

  @Test
  void noticeSkippedWhenRateLimited() throws Exception {
    SelfVoteGuard guard = guard(1);

    guard.compensate(SELF);
    guard.compensate(SELF);

    verify(gateway, times(2)).removeReaction(2L, 500L, 10L, "🟢");
    verify(gateway, times(1)).sendDirectMessage(anyLong(), anyString());
    verify(gateway, never()).sendTransient(anyLong(), anyString(), any(Duration.class));
  }

  @Test
  void rejectedQueueIsContained() throws Exception {
    SelfVoteGuard guard =
        new SelfVoteGuard(
            gateway,
            command -> {
              throw new RejectedExecutionException("shut down");
            },
            new TokenBucketRateLimiter(1, 1.0),
            Duration.ofSeconds(10),
            null);

    guard.reject(SELF);

    verify(gateway, never()).removeReaction(anyLong(), anyLong(), anyLong(), anyString());
  }

  @Test
  void noticeTextMentionsVoter() {
    String text =
        LocaleManager.format("notice.self_vote.channel", "user", gateway.mention(SELF.actorId()));

    assertTrue(text.contains("<@10>"));
  }

  private SelfVoteGuard guard(int capacity) {
    return new SelfVoteGuard(
        gateway,
        Runnable::run,
        new TokenBucketRateLimiter(capacity, 0.001),
        Duration.ofSeconds(10),
        null);
  }
}
