package ca.gc.cra.devlog.application;

import ca.gc.cra.devlog.application.port.ClockPort;
import ca.gc.cra.devlog.application.port.RecordHandler;
import ca.gc.cra.devlog.domain.Attr;
import ca.gc.cra.devlog.domain.CallSite;
import ca.gc.cra.devlog.domain.Level;
import ca.gc.cra.devlog.domain.LogContext;
import ca.gc.cra.devlog.domain.LogRecord;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Logging handle that turns calls into {@link LogRecord}s for a {@link RecordHandler}.
 * <p><strong>Why:</strong> Components hold an explicit logger instead of reaching for a process-wide default;
 * {@code Loggers} can still install one for call sites that have nothing to inject.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Skip disabled levels before any allocation beyond the varargs array.</li>
 *   <li>Capture the calling frame and the current time.</li>
 *   <li>Convert loose {@code key, value} arguments into attributes.</li>
 *   <li>Absorb sink failures: they are reported through SLF4J and never reach the caller.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; derived loggers share the handler family.</p>
 *
 * @since 0.1.0
 */
public final class StructuredLogger {
  private static final Logger log = LoggerFactory.getLogger(StructuredLogger.class);

  /** Key used for arguments that are not preceded by a string key. */
  public static final String BAD_KEY = "!BADKEY";

  private static final StackWalker WALKER = StackWalker.getInstance();
  private static final String FACADE_CLASS = StructuredLogger.class.getName();

  private final RecordHandler handler;
  private final ClockPort clock;

  public StructuredLogger(RecordHandler handler) {
    this(handler, ClockPort.SYSTEM);
  }

  /**
   * Creates a logger stamping records with {@code clock}.
   *
   * @param handler destination of every record
   * @param clock time source
   */
  public StructuredLogger(RecordHandler handler, ClockPort clock) {
    this.handler = Objects.requireNonNull(handler, "handler");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public RecordHandler handler() {
    return handler;
  }

  public boolean enabled(Level level) {
    return handler.enabled(level);
  }

  public void debug(String message, Object... args) {
    log(LogContext.empty(), Level.DEBUG, message, args);
  }

  public void info(String message, Object... args) {
    log(LogContext.empty(), Level.INFO, message, args);
  }

  public void warn(String message, Object... args) {
    log(LogContext.empty(), Level.WARN, message, args);
  }

  public void error(String message, Object... args) {
    log(LogContext.empty(), Level.ERROR, message, args);
  }

  public void debug(LogContext context, String message, Object... args) {
    log(context, Level.DEBUG, message, args);
  }

  public void info(LogContext context, String message, Object... args) {
    log(context, Level.INFO, message, args);
  }

  public void warn(LogContext context, String message, Object... args) {
    log(context, Level.WARN, message, args);
  }

  public void error(LogContext context, String message, Object... args) {
    log(context, Level.ERROR, message, args);
  }

  /**
   * Logs {@code message} with loosely typed arguments.
   *
   * @param context enrichment values; {@code null} means none
   * @param level severity
   * @param message message text
   * @param args attributes, or alternating {@code String} keys and values
   * @see #toAttrs(Object...)
   */
  public void log(LogContext context, Level level, String message, Object... args) {
    if (!handler.enabled(level)) {
      return;
    }
    emit(context, level, message, toAttrs(args));
  }

  /**
   * Logs {@code message} with already typed attributes.
   */
  public void logAttrs(LogContext context, Level level, String message, Attr... attrs) {
    if (!handler.enabled(level)) {
      return;
    }
    emit(context, level, message, List.of(attrs));
  }

  /**
   * Returns a logger whose records always carry {@code args}.
   *
   * @param args attributes, or alternating keys and values
   * @return derived logger; {@code this} when there is nothing to bind
   */
  public StructuredLogger with(Object... args) {
    List<Attr> attrs = toAttrs(args);
    if (attrs.isEmpty()) {
      return this;
    }
    return new StructuredLogger(handler.withAttrs(attrs), clock);
  }

  /**
   * Returns a logger that nests subsequent attributes under {@code name}.
   */
  public StructuredLogger withGroup(String name) {
    if (name == null || name.isEmpty()) {
      return this;
    }
    return new StructuredLogger(handler.withGroup(name), clock);
  }

  /**
   * Converts loose arguments: an {@link Attr} is taken as is, a {@code String} consumes the next argument as its
   * value, and anything else (including a trailing string) becomes a {@value #BAD_KEY} attribute.
   *
   * @param args arguments; may be {@code null}
   * @return attributes in argument order
   */
  public static List<Attr> toAttrs(Object... args) {
    if (args == null || args.length == 0) {
      return List.of();
    }
    List<Attr> attrs = new ArrayList<>(args.length);
    int i = 0;
    while (i < args.length) {
      Object arg = args[i];
      if (arg instanceof Attr attr) {
        attrs.add(attr);
        i++;
      } else if (arg instanceof String key && i + 1 < args.length) {
        attrs.add(Attr.any(key, args[i + 1]));
        i += 2;
      } else {
        attrs.add(Attr.any(BAD_KEY, arg));
        i++;
      }
    }
    return attrs;
  }

  private void emit(LogContext context, Level level, String message, List<Attr> attrs) {
    LogRecord record = new LogRecord(clock.now(), level, message, callSite(), attrs);
    try {
      handler.handle(context == null ? LogContext.empty() : context, record);
    } catch (IOException ex) {
      log.warn("Failed to write {} record", level, ex);
    }
  }

  private static CallSite callSite() {
    return WALKER.walk(frames -> frames
        .filter(frame -> !FACADE_CLASS.equals(frame.getClassName()))
        .findFirst()
        .map(CallSite::of)
        .orElse(null));
  }
}
