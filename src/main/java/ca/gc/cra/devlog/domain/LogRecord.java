package ca.gc.cra.devlog.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One structured log event.
 * <p><strong>Role:</strong> Built by {@code StructuredLogger} at the call site and read by exactly one handler
 * chain.</p>
 * <p><strong>Thread-safety:</strong> Immutable; decorators derive copies through {@link #withAttrs(List)}.</p>
 *
 * @param time event time; {@code null} is the zero time and suppresses the timestamp
 * @param level severity; never {@code null}
 * @param message message text; {@code null} is normalized to empty
 * @param callSite frame of the log call; {@code null} when not captured
 * @param attrs ordered attributes; defensively copied
 * @since 0.1.0
 */
public record LogRecord(Instant time, Level level, String message, CallSite callSite, List<Attr> attrs) {
  public LogRecord {
    level = Objects.requireNonNull(level, "level");
    message = message == null ? "" : message;
    attrs = attrs == null ? List.of() : List.copyOf(attrs);
  }

  /**
   * Creates a record without call site information.
   */
  public static LogRecord of(Instant time, Level level, String message, Attr... attrs) {
    return new LogRecord(time, level, message, null, List.of(attrs));
  }

  public Optional<CallSite> optionalCallSite() {
    return Optional.ofNullable(callSite);
  }

  /**
   * Returns a copy with {@code extra} appended after the existing attributes.
   *
   * @param extra attributes to append
   * @return new record; {@code this} when {@code extra} is empty
   */
  public LogRecord withAttrs(List<Attr> extra) {
    if (extra.isEmpty()) {
      return this;
    }
    List<Attr> merged = new ArrayList<>(attrs.size() + extra.size());
    merged.addAll(attrs);
    merged.addAll(extra);
    return new LogRecord(time, level, message, callSite, merged);
  }
}
