package ca.gc.cra.devlog.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts the level of devlog's own diagnostics at runtime.
 * <p><strong>Why:</strong> The library reports write failures and unattributable frames through SLF4J; when
 * troubleshooting, these can be raised without editing the Logback configuration.</p>
 * <p><strong>Thread-safety:</strong> Delegates to Logback, whose level changes are atomic per logger.</p>
 * <p><strong>Observability:</strong> Warns when the SLF4J binding is not Logback.</p>
 *
 * @implNote Other SLF4J bindings are left untouched.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Logger name covering every devlog class. */
  public static final String DIAGNOSTICS_LOGGER = "ca.gc.cra.devlog";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets devlog's diagnostics to {@code DEBUG}.
   */
  public static void enableVerboseLogging() {
    setDiagnosticsLevel("DEBUG");
  }

  /**
   * Sets the level of the {@value #DIAGNOSTICS_LOGGER} logger.
   *
   * @param level Logback level name such as {@code DEBUG}, {@code WARN} or {@code OFF}
   * @return {@code true} when the level was applied
   * @throws IllegalArgumentException when {@code level} is not a Logback level name
   */
  public static boolean setDiagnosticsLevel(String level) {
    Level parsed = Level.toLevel(level, null);
    if (parsed == null) {
      throw new IllegalArgumentException("Unknown diagnostics level: " + level);
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger diagnostics = context.getLogger(DIAGNOSTICS_LOGGER);
      if (!parsed.equals(diagnostics.getLevel())) {
        diagnostics.setLevel(parsed);
      }
      return true;
    }
    log.warn("Diagnostics level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
    return false;
  }
}
