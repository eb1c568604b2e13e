package ca.gc.cra.devlog.domain;

import java.util.Locale;

/**
 * <strong>What:</strong> Ordered severity of a log record.
 * <p><strong>Why:</strong> Handlers filter and color records by severity; the numeric gaps leave room for
 * intermediate levels without renumbering.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum Level {
  /** Diagnostic detail. */
  DEBUG(-4),
  /** Normal operation. */
  INFO(0),
  /** Unexpected but recoverable condition. */
  WARN(4),
  /** Failed operation. */
  ERROR(8);

  private final int severity;

  Level(int severity) {
    this.severity = severity;
  }

  /**
   * Returns the numeric severity; higher is more severe.
   *
   * @return severity value
   */
  public int severity() {
    return severity;
  }

  /**
   * Reports whether this level is at least as severe as {@code floor}.
   *
   * @param floor minimum level; must not be {@code null}
   * @return {@code true} when {@code this >= floor}
   */
  public boolean isAtLeast(Level floor) {
    return severity >= floor.severity;
  }

  /**
   * Parses a level name case-insensitively; {@code WARNING} is accepted as an alias of {@link #WARN}.
   *
   * @param text level name; must not be {@code null}
   * @return parsed level
   * @throws IllegalArgumentException when the name is unknown
   */
  public static Level parse(String text) {
    String normalized = text.trim().toUpperCase(Locale.ROOT);
    if ("WARNING".equals(normalized)) {
      return WARN;
    }
    try {
      return Level.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown log level: " + text, ex);
    }
  }
}
