package ca.gc.cra.devlog.domain;

import ca.gc.cra.devlog.validation.Strings;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Immutable enrichment record passed alongside a log call.
 * <p><strong>Why:</strong> Request-scoped values (the traced SQL statement, its duration and row count, an
 * explicit call site, caller-defined keys) travel next to the record instead of inside it, and handlers decide
 * which of them to surface.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Store values under string keys; a {@code null} value removes the key.</li>
 *   <li>Expose typed views of the recognized {@link ContextKeys}; a value of the wrong type is ignored by the
 *   typed view instead of failing the render.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; every {@code with*} call returns a new instance.</p>
 *
 * @since 0.1.0
 */
public final class LogContext {
  private static final LogContext EMPTY = new LogContext(Map.of());

  private final Map<String, Object> values;

  private LogContext(Map<String, Object> values) {
    this.values = values;
  }

  /**
   * Returns the context carrying no values.
   */
  public static LogContext empty() {
    return EMPTY;
  }

  /**
   * Returns a copy with {@code key} bound to {@code value}.
   *
   * @param key context key; must be non-blank
   * @param value value; {@code null} removes the key
   * @return derived context
   * @throws IllegalArgumentException when {@code key} is blank
   */
  public LogContext withValue(String key, Object value) {
    String name = Strings.requireNonBlank("key", key);
    if (value == null && !values.containsKey(name)) {
      return this;
    }
    Map<String, Object> copy = new LinkedHashMap<>(values);
    if (value == null) {
      copy.remove(name);
    } else {
      copy.put(name, value);
    }
    return new LogContext(Collections.unmodifiableMap(copy));
  }

  public LogContext withSource(Source source) {
    return withValue(ContextKeys.SOURCE, source);
  }

  public LogContext withSql(String sql) {
    return withValue(ContextKeys.SQL, sql);
  }

  public LogContext withDuration(Duration duration) {
    return withValue(ContextKeys.DURATION, duration);
  }

  public LogContext withRows(long rows) {
    return withValue(ContextKeys.ROWS, rows);
  }

  /**
   * Looks up a raw value.
   *
   * @param key context key
   * @return bound value, if any
   */
  public Optional<Object> value(String key) {
    return Optional.ofNullable(values.get(key));
  }

  public Optional<Source> source() {
    return typed(ContextKeys.SOURCE, Source.class);
  }

  public Optional<String> sql() {
    return typed(ContextKeys.SQL, String.class);
  }

  public Optional<Duration> duration() {
    return typed(ContextKeys.DURATION, Duration.class);
  }

  public OptionalLong rows() {
    Object raw = values.get(ContextKeys.ROWS);
    return raw instanceof Number n ? OptionalLong.of(n.longValue()) : OptionalLong.empty();
  }

  /**
   * Returns an unmodifiable view of all bound values in insertion order.
   */
  public Map<String, Object> asMap() {
    return values;
  }

  private <T> Optional<T> typed(String key, Class<T> type) {
    Object raw = values.get(key);
    return type.isInstance(raw) ? Optional.of(type.cast(raw)) : Optional.empty();
  }

  @Override
  public String toString() {
    return "LogContext" + values;
  }
}
