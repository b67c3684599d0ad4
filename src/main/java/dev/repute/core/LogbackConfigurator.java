/* Repute © 2025 Repute Devs — MIT */
package dev.repute.core;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/** Configures Repute logging for Logback backends. */
final class LogbackConfigurator {
  private static final org.slf4j.Logger LOG = LoggerFactory.getLogger("repute");
  static final String CONSOLE_APPENDER = "repute-console";

  private LogbackConfigurator() {}

  static void configure(Config.Log logCfg) {
    if (logCfg == null) {
      return;
    }
    try {
      ILoggerFactory factory = LoggerFactory.getILoggerFactory();
      if (factory instanceof LoggerContext context) {
        configure(context, logCfg);
      } else {
        LOG.debug(
            "(repute) skipping logback configuration; factory is {}",
            factory.getClass().getName());
      }
    } catch (NoClassDefFoundError e) {
      LOG.debug("(repute) logback not available; leaving logging as-is");
    }
  }

  static void configure(LoggerContext context, Config.Log logCfg) {
    if (context == null || logCfg == null) {
      return;
    }
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    Level level = levelFrom(logCfg.level());
    if (level == null) {
      level = Level.INFO;
      LOG.warn("(repute) invalid log.level {}; defaulting to INFO", logCfg.level());
    }
    root.setLevel(level);

    if (root.getAppender(CONSOLE_APPENDER) != null) {
      root.detachAppender(CONSOLE_APPENDER);
    }
    ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
    console.setName(CONSOLE_APPENDER);
    console.setContext(context);
    if (logCfg.json()) {
      ReputeJsonLayout layout = new ReputeJsonLayout();
      layout.setContext(context);
      layout.start();
      LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
      encoder.setContext(context);
      encoder.setLayout(layout);
      encoder.start();
      console.setEncoder(encoder);
    } else {
      PatternLayoutEncoder encoder = new PatternLayoutEncoder();
      encoder.setContext(context);
      encoder.setPattern("%d{ISO8601} %-5level [%thread] %logger{36} - %msg%n");
      encoder.start();
      console.setEncoder(encoder);
    }
    console.start();
    root.addAppender(console);
  }

  private static Level levelFrom(String level) {
    if (level == null) {
      return null;
    }
    // Level.toLevel falls back to DEBUG for garbage, so compare against the known names.
    String normalized = level.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF", "ALL" -> Level.toLevel(normalized);
      default -> null;
    };
  }
}
