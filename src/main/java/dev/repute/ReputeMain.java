/* Repute © 2025 Repute Devs — MIT */
package dev.repute;

import dev.repute.commands.CommandContext;
import dev.repute.console.LoggingChatGateway;
import dev.repute.console.OperatorConsole;
import dev.repute.core.Config;
import dev.repute.core.CoreServices;
import dev.repute.core.LocaleManager;
import dev.repute.core.LoggingConfigurator;
import dev.repute.core.Services;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Standalone entrypoint.
 *
 * <p>Boot sequence:
 *
 * <ol>
 *   <li>Load config (writes default JSON5 if missing)
 *   <li>Apply logging settings and load locale bundles
 *   <li>Start services against a logging-only gateway (restores persisted state)
 *   <li>Register the shutdown hook that flushes state
 *   <li>Run the operator console on stdin
 * </ol>
 *
 * <p>The console acts in guild {@code repute.console.guild}, channel {@code
 * repute.console.channel} as administrator {@code repute.console.operator} (system properties).
 */
public final class ReputeMain {
  private static final Logger LOG = LoggerFactory.getLogger("repute");

  private ReputeMain() {}

  public static void main(String[] args) throws IOException {
    LOG.info("(repute) booting Repute 1.0.0");
    Path cfgPath = args.length > 0 ? Path.of(args[0]) : Path.of("config", "repute.json5");
    Config cfg = Config.loadOrWriteDefault(cfgPath);
    LoggingConfigurator.configure(cfg.log());
    LocaleManager.initialize(cfg.i18n());

    Services services = CoreServices.start(cfg, new LoggingChatGateway(1_000_000L));
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  try {
                    services.shutdown();
                  } catch (Exception e) {
                    LOG.warn("(repute) shutdown error", e);
                  }
                },
                "repute-shutdown"));

    CommandContext operator =
        new CommandContext(
            Long.getLong("repute.console.guild", 1L),
            Long.getLong("repute.console.channel", 1L),
            Long.getLong("repute.console.operator", 1L),
            true);
    LOG.info("(repute) initialized; console ready");
    BufferedReader in =
        new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    new OperatorConsole(services, operator, cfg.bot().sourceBotId(), System.out).run(in);
    System.exit(0);
  }
}
