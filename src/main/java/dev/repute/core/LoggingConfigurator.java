/* Repute © 2025 Repute Devs — MIT */
package dev.repute.core;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Dispatches logging configuration to the active backend when available. */
public final class LoggingConfigurator {
  private static final Logger LOG = LoggerFactory.getLogger("repute");
  private static final String LOGBACK_CLASS = "dev.repute.core.LogbackConfigurator";

  private LoggingConfigurator() {}

  /**
   * Applies the {@code log} block to whichever SLF4J backend is bound.
   *
   * @param logCfg logging block, ignored when {@code null}
   */
  public static void configure(Config.Log logCfg) {
    if (logCfg == null) {
      return;
    }
    try {
      Class<?> configurator = Class.forName(LOGBACK_CLASS);
      Method configure = configurator.getDeclaredMethod("configure", Config.Log.class);
      configure.setAccessible(true);
      configure.invoke(null, logCfg);
    } catch (ClassNotFoundException | NoClassDefFoundError e) {
      LOG.debug("(repute) logback backend not detected; leaving logging at defaults");
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      LOG.warn("(repute) failed to configure logging: {}", cause.getMessage(), cause);
    } catch (ReflectiveOperationException e) {
      LOG.warn("(repute) failed to configure logging: {}", e.getMessage(), e);
    }
  }
}
