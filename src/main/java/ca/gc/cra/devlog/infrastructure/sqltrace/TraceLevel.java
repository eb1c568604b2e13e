package ca.gc.cra.devlog.infrastructure.sqltrace;

import ca.gc.cra.devlog.domain.Level;

/**
 * Verbosity of {@link SqlTraceLogger}, mirroring the levels ORM loggers expose.
 *
 * @since 0.1.0
 */
public enum TraceLevel {
  /** Nothing is logged. */
  SILENT(null),
  /** Failed statements and explicit error messages only. */
  ERROR(Level.ERROR),
  /** Adds explicit warnings. */
  WARN(Level.WARN),
  /** Every statement and message. */
  INFO(Level.INFO);

  private final Level floor;

  TraceLevel(Level floor) {
    this.floor = floor;
  }

  /**
   * Reports whether a message at {@code level} passes this verbosity.
   */
  public boolean allows(Level level) {
    return floor != null && level.isAtLeast(floor);
  }
}
