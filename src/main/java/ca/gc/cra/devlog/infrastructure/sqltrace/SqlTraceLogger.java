package ca.gc.cra.devlog.infrastructure.sqltrace;

import ca.gc.cra.devlog.application.StructuredLogger;
import ca.gc.cra.devlog.application.port.CallerResolver;
import ca.gc.cra.devlog.application.port.ClockPort;
import ca.gc.cra.devlog.domain.Attr;
import ca.gc.cra.devlog.domain.Level;
import ca.gc.cra.devlog.domain.LogContext;
import ca.gc.cra.devlog.domain.LogError;
import ca.gc.cra.devlog.domain.Source;
import ca.gc.cra.devlog.infrastructure.caller.StackWalkerCallerResolver;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Adapter between a data-access layer's statement tracing hook and a
 * {@link StructuredLogger}.
 * <p><strong>Why:</strong> ORMs report each statement from deep inside their own code; this adapter measures the
 * statement, finds the application frame that issued it and hands everything to the handlers through the
 * {@link LogContext}, where {@code DevHandler} renders the SQL block.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Forward plain info, warn and error messages when the {@link TraceLevel} allows them.</li>
 *   <li>On {@link #trace}, record SQL text, row count, elapsed time and the calling application frame.</li>
 *   <li>Drop bind parameters from statements unless parameters are shown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; {@link #logMode(TraceLevel)} returns a copy.</p>
 *
 * @since 0.1.0
 */
public final class SqlTraceLogger {
  private final StructuredLogger logger;
  private final TraceLevel level;
  private final boolean showParams;
  private final List<Attr> attrs;
  private final CallerResolver callerResolver;
  private final ClockPort clock;

  /**
   * Creates an adapter at {@link TraceLevel#INFO} that attributes statements to the first frame outside this
   * library.
   *
   * @param logger destination logger
   * @param showParams keep bind parameters in {@link #paramsFilter(SqlStatement)}
   * @param attrs attributes attached to every successful statement line
   */
  public SqlTraceLogger(StructuredLogger logger, boolean showParams, List<Attr> attrs) {
    this(logger, TraceLevel.INFO, showParams, attrs, new StackWalkerCallerResolver(), ClockPort.SYSTEM);
  }

  /**
   * Creates an adapter with explicit collaborators.
   *
   * @param logger destination logger
   * @param level verbosity
   * @param showParams keep bind parameters
   * @param attrs attributes attached to every successful statement line
   * @param callerResolver finds the application frame; see {@link StackWalkerCallerResolver#forLibraries}
   * @param clock time source for elapsed time
   */
  public SqlTraceLogger(
      StructuredLogger logger,
      TraceLevel level,
      boolean showParams,
      List<Attr> attrs,
      CallerResolver callerResolver,
      ClockPort clock) {
    this.logger = Objects.requireNonNull(logger, "logger");
    this.level = Objects.requireNonNull(level, "level");
    this.showParams = showParams;
    this.attrs = attrs == null ? List.of() : List.copyOf(attrs);
    this.callerResolver = Objects.requireNonNull(callerResolver, "callerResolver");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public TraceLevel level() {
    return level;
  }

  public boolean showParams() {
    return showParams;
  }

  /**
   * Returns a copy at {@code newLevel}.
   */
  public SqlTraceLogger logMode(TraceLevel newLevel) {
    return new SqlTraceLogger(logger, newLevel, showParams, attrs, callerResolver, clock);
  }

  public void info(LogContext context, String message, Object... args) {
    if (level.allows(Level.INFO)) {
      logger.info(context, message, args);
    }
  }

  public void warn(LogContext context, String message, Object... args) {
    if (level.allows(Level.WARN)) {
      logger.warn(context, message, args);
    }
  }

  public void error(LogContext context, String message, Object... args) {
    if (level.allows(Level.ERROR)) {
      logger.error(context, message, args);
    }
  }

  /**
   * Logs one executed statement.
   *
   * <p>The result supplier is only invoked when the line will be logged. A failed statement is logged at
   * {@code ERROR} with the failure message; a successful one at {@code INFO} with an empty message and the bound
   * attributes.</p>
   *
   * @param context caller context; {@code null} means none
   * @param begin time the statement started
   * @param result supplies the statement text and row count
   * @param error failure, or {@code null} on success
   */
  public void trace(LogContext context, Instant begin, Supplier<SqlTrace> result, Throwable error) {
    if (!level.allows(error != null ? Level.ERROR : Level.INFO)) {
      return;
    }
    SqlTrace executed = result.get();
    Duration elapsed = Duration.between(begin, clock.now());

    LogContext enriched = (context == null ? LogContext.empty() : context)
        .withSql(executed.sql())
        .withRows(executed.rows())
        .withDuration(elapsed);
    Optional<Source> caller = callerResolver.resolve(0);
    if (caller.isPresent()) {
      enriched = enriched.withSource(caller.get());
    }

    if (error != null) {
      logger.error(enriched, new LogError(error).message());
      return;
    }
    logger.logAttrs(enriched, Level.INFO, "", attrs.toArray(new Attr[0]));
  }

  /**
   * Hides bind parameters unless this adapter was created with {@code showParams}.
   *
   * @param statement statement as prepared by the data-access layer
   * @return {@code statement} unchanged, or the same text without parameters
   */
  public SqlStatement paramsFilter(SqlStatement statement) {
    if (showParams) {
      return statement;
    }
    return new SqlStatement(statement.sql(), List.of());
  }
}
