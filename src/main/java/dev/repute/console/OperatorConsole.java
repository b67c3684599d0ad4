/* Repute © 2025 Repute Devs — MIT */
package dev.repute.console;

import dev.repute.api.OperationResult;
import dev.repute.api.events.ReactionEvent;
import dev.repute.api.events.SourceMessageEvent;
import dev.repute.commands.CommandContext;
import dev.repute.commands.CommandResponse;
import dev.repute.core.Services;
import dev.repute.extract.StructuredContent;
import dev.repute.reconcile.ReconcileOutcome;
import dev.repute.reconcile.TrackedMessage;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Line-oriented operator console.
 *
 * <p>Every line is either a command ({@code rep}, {@code repadd <@1> 3 good}, ...) issued as an
 * administrator, or one of the simulation verbs:
 *
 * <ul>
 *   <li>{@code post <memberId> <address> [text]} as the source bot
 *   <li>{@code react+ <messageId> <userId> <glyph>} / {@code react- ...}
 *   <li>{@code flush}, {@code quit}
 * </ul>
 */
public final class OperatorConsole {
  private final Services services;
  private final CommandContext operator;
  private final long sourceBotId;
  private final PrintStream out;
  private long nextSourceMessage = 1;

  public OperatorConsole(
      Services services, CommandContext operator, long sourceBotId, PrintStream out) {
    this.services = services;
    this.operator = operator;
    this.sourceBotId = sourceBotId;
    this.out = out;
  }

  /** Reads lines until {@code quit} or end of input. */
  public void run(BufferedReader in) throws IOException {
    String line;
    while ((line = in.readLine()) != null) {
      if (!handle(line)) {
        return;
      }
    }
  }

  /**
   * Handles one line.
   *
   * @return {@code false} once the operator asked to quit
   */
  boolean handle(String line) {
    String trimmed = line.trim();
    if (trimmed.isEmpty()) {
      return true;
    }
    String[] parts = trimmed.split("\\s+", 2);
    String verb = parts[0].toLowerCase(Locale.ROOT);
    String rest = parts.length > 1 ? parts[1] : "";
    try {
      switch (verb) {
        case "quit", "exit" -> {
          return false;
        }
        case "flush" -> {
          OperationResult result = services.persistence().flushNow();
          out.println(result.ok() ? "flushed" : "flush failed: " + result.code());
        }
        case "post" -> post(rest);
        case "react+" -> out.println(react(rest, true));
        case "react-" -> out.println(react(rest, false));
        default -> {
          CommandResponse response = services.commands().execute(operator, verb, rest);
          out.println(response.text());
        }
      }
    } catch (IllegalArgumentException e) {
      out.println("error: " + e.getMessage());
    }
    return true;
  }

  private void post(String rest) {
    if (sourceBotId == 0) {
      throw new IllegalArgumentException("bot.sourceBotId is not configured");
    }
    String[] args = rest.split("\\s+", 3);
    if (args.length < 2) {
      throw new IllegalArgumentException("usage: post <memberId> <address> [text]");
    }
    String text = args.length > 2 ? args[2] : "";
    StructuredContent embed =
        new StructuredContent("", args[1], List.of(), args[0] + " via console");
    SourceMessageEvent event =
        new SourceMessageEvent(
            operator.guildId(),
            operator.channelId(),
            nextSourceMessage++,
            sourceBotId,
            text,
            List.of(embed));
    Optional<TrackedMessage> tracked = services.publisher().onMessage(event);
    out.println(
        tracked.map(m -> "tracking message " + m.messageId()).orElse("no member named in post"));
  }

  private ReconcileOutcome react(String rest, boolean added) {
    String[] args = rest.trim().split("\\s+");
    if (args.length != 3) {
      throw new IllegalArgumentException("usage: react+|react- <messageId> <userId> <glyph>");
    }
    ReactionEvent event =
        new ReactionEvent(
            operator.guildId(),
            operator.channelId(),
            Long.parseLong(args[0]),
            Long.parseLong(args[1]),
            false,
            args[2]);
    return added
        ? services.reconciler().onReactionAdded(event)
        : services.reconciler().onReactionRemoved(event);
  }
}
