package ca.gc.cra.devlog.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Named, typed value attached to a record or nested in a group.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param key attribute name; empty only for inline groups and the zero attribute
 * @param value typed value
 * @since 0.1.0
 */
public record Attr(String key, Value value) {
  /** The zero attribute: empty key and a {@code null} any value. Handlers skip it. */
  public static final Attr EMPTY = new Attr("", Value.ofAny(null));

  public Attr {
    key = key == null ? "" : key;
    value = Objects.requireNonNull(value, "value");
  }

  public static Attr string(String key, String value) {
    return new Attr(key, Value.ofString(value));
  }

  public static Attr int64(String key, long value) {
    return new Attr(key, Value.ofInt64(value));
  }

  public static Attr uint64(String key, long value) {
    return new Attr(key, Value.ofUint64(value));
  }

  public static Attr float64(String key, double value) {
    return new Attr(key, Value.ofFloat64(value));
  }

  public static Attr bool(String key, boolean value) {
    return new Attr(key, Value.ofBool(value));
  }

  public static Attr duration(String key, Duration value) {
    return new Attr(key, Value.ofDuration(value));
  }

  public static Attr time(String key, Instant value) {
    return new Attr(key, Value.ofTime(value));
  }

  public static Attr group(String key, Attr... members) {
    return new Attr(key, Value.ofGroup(List.of(members)));
  }

  public static Attr group(String key, List<Attr> members) {
    return new Attr(key, Value.ofGroup(members));
  }

  /**
   * Creates an attribute whose kind is derived from the runtime type of {@code value}.
   *
   * @see Value#of(Object)
   */
  public static Attr any(String key, Object value) {
    return new Attr(key, Value.of(value));
  }

  /**
   * Creates an attribute rendered as an error: handlers highlight its key and print the throwable's message.
   *
   * @param key attribute name, usually {@code err}
   * @param error failure to report; must not be {@code null}
   * @return error attribute
   */
  public static Attr error(String key, Throwable error) {
    return new Attr(key, Value.ofAny(new LogError(error)));
  }

  /**
   * Returns a copy whose value has been resolved through {@link Value#resolve()}.
   */
  public Attr resolve() {
    Value resolved = value.resolve();
    return resolved == value ? this : new Attr(key, resolved);
  }

  /**
   * Reports whether this attribute equals {@link #EMPTY}.
   */
  public boolean isEmpty() {
    return key.isEmpty() && value.isNullAny();
  }
}
