package ca.gc.cra.devlog.domain;

/**
 * Context keys recognized by the handlers.
 *
 * @since 0.1.0
 */
public final class ContextKeys {
  /** Explicit call site, a {@link Source}. */
  public static final String SOURCE = "source";
  /** Elapsed time of a traced statement, a {@link java.time.Duration}. */
  public static final String DURATION = "duration";
  /** Rows affected by a traced statement, a {@link Number}. */
  public static final String ROWS = "rows";
  /** Statement text, a {@link String}. */
  public static final String SQL = "sql";

  private ContextKeys() {}
}
