/* Repute © 2025 Repute Devs — MIT */
package dev.repute.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

class LoggingConfiguratorTest {

  @Test
  void appliesConfiguredLogLevel() {
    LoggerContext context = new LoggerContext();
    context.start();
    Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.INFO);

    LogbackConfigurator.configure(context, new Config.Log(false, "DEBUG"));
    assertEquals(Level.DEBUG, root.getLevel());

    LogbackConfigurator.configure(context, new Config.Log(false, "ERROR"));
    assertEquals(Level.ERROR, root.getLevel());

    context.stop();
  }

  @Test
  void invalidLevelFallsBackToInfo() {
    LoggerContext context = new LoggerContext();
    context.start();
    Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

    LogbackConfigurator.configure(context, new Config.Log(false, "chatty"));

    assertEquals(Level.INFO, root.getLevel());
    context.stop();
  }

  @Test
  @SuppressWarnings("unchecked")
  void jsonModeInstallsJsonLayout() {
    LoggerContext context = new LoggerContext();
    context.start();
    Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

    LogbackConfigurator.configure(context, new Config.Log(true, "INFO"));

    ConsoleAppender<ILoggingEvent> appender =
        (ConsoleAppender<ILoggingEvent>) root.getAppender(LogbackConfigurator.CONSOLE_APPENDER);
    assertNotNull(appender);
    LayoutWrappingEncoder<ILoggingEvent> encoder =
        (LayoutWrappingEncoder<ILoggingEvent>) appender.getEncoder();
    assertTrue(encoder.getLayout() instanceof ReputeJsonLayout);

    LoggingEvent event =
        new LoggingEvent(
            Logger.class.getName(),
            root,
            Level.WARN,
            "(repute) code={} op={}",
            null,
            new Object[] {"X", "y"});
    String line = encoder.getLayout().doLayout(event);
    JsonObject json = JsonParser.parseString(line).getAsJsonObject();
    assertEquals("WARN", json.get("level").getAsString());
    assertEquals("(repute) code=X op=y", json.get("message").getAsString());
    context.stop();
  }
}
