package ca.gc.cra.devlog.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed attribute value tagged with a {@link ValueKind}.
 * <p><strong>Why:</strong> Lets handlers pick a canonical text form per kind without reflection on every
 * attribute.</p>
 * <p><strong>Thread-safety:</strong> Immutable; group members are defensively copied. An {@link ValueKind#ANY}
 * payload is shared by reference and is as thread-safe as the wrapped object.</p>
 *
 * @since 0.1.0
 */
public final class Value {
  private static final int MAX_RESOLVE_DEPTH = 100;
  private static final Value NULL_ANY = new Value(ValueKind.ANY, null, 0L);

  private final ValueKind kind;
  private final Object payload;
  private final long bits;

  private Value(ValueKind kind, Object payload, long bits) {
    this.kind = kind;
    this.payload = payload;
    this.bits = bits;
  }

  public static Value ofString(String value) {
    return new Value(ValueKind.STRING, Objects.requireNonNull(value, "value"), 0L);
  }

  public static Value ofInt64(long value) {
    return new Value(ValueKind.INT64, null, value);
  }

  /**
   * Wraps an unsigned 64-bit quantity stored in a signed {@code long}.
   *
   * @param value raw bits interpreted as unsigned
   * @return unsigned value
   */
  public static Value ofUint64(long value) {
    return new Value(ValueKind.UINT64, null, value);
  }

  public static Value ofFloat64(double value) {
    return new Value(ValueKind.FLOAT64, null, Double.doubleToRawLongBits(value));
  }

  public static Value ofBool(boolean value) {
    return new Value(ValueKind.BOOL, null, value ? 1L : 0L);
  }

  public static Value ofDuration(Duration value) {
    return new Value(ValueKind.DURATION, Objects.requireNonNull(value, "value"), 0L);
  }

  public static Value ofTime(Instant value) {
    return new Value(ValueKind.TIME, Objects.requireNonNull(value, "value"), 0L);
  }

  /**
   * Creates a group value; {@code null} members are rejected.
   *
   * @param members ordered members
   * @return group value
   */
  public static Value ofGroup(List<Attr> members) {
    return new Value(ValueKind.GROUP, List.copyOf(members), 0L);
  }

  /**
   * Wraps an arbitrary object without inspecting its type.
   *
   * @param value payload; may be {@code null}
   * @return any-kind value
   */
  public static Value ofAny(Object value) {
    return value == null ? NULL_ANY : new Value(ValueKind.ANY, value, 0L);
  }

  /**
   * Maps common Java types onto their dedicated kinds and everything else onto {@link ValueKind#ANY}.
   *
   * @param value payload; may be {@code null}
   * @return typed value
   */
  public static Value of(Object value) {
    if (value instanceof Value v) {
      return v;
    }
    if (value instanceof String s) {
      return ofString(s);
    }
    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ofInt64(((Number) value).longValue());
    }
    if (value instanceof Double || value instanceof Float) {
      return ofFloat64(((Number) value).doubleValue());
    }
    if (value instanceof Boolean b) {
      return ofBool(b);
    }
    if (value instanceof Duration d) {
      return ofDuration(d);
    }
    if (value instanceof Instant t) {
      return ofTime(t);
    }
    return ofAny(value);
  }

  public ValueKind kind() {
    return kind;
  }

  public String string() {
    require(ValueKind.STRING);
    return (String) payload;
  }

  public long int64() {
    require(ValueKind.INT64);
    return bits;
  }

  /**
   * Returns the raw bits of an unsigned value; format with {@link Long#toUnsignedString(long)}.
   */
  public long uint64() {
    require(ValueKind.UINT64);
    return bits;
  }

  public double float64() {
    require(ValueKind.FLOAT64);
    return Double.longBitsToDouble(bits);
  }

  public boolean bool() {
    require(ValueKind.BOOL);
    return bits != 0L;
  }

  public Duration duration() {
    require(ValueKind.DURATION);
    return (Duration) payload;
  }

  public Instant time() {
    require(ValueKind.TIME);
    return (Instant) payload;
  }

  @SuppressWarnings("unchecked")
  public List<Attr> group() {
    require(ValueKind.GROUP);
    return (List<Attr>) payload;
  }

  public Object any() {
    require(ValueKind.ANY);
    return payload;
  }

  /**
   * Reports whether this is the zero value: an any-kind value wrapping {@code null}.
   */
  public boolean isNullAny() {
    return kind == ValueKind.ANY && payload == null;
  }

  /**
   * Repeatedly expands {@link LogValuer} payloads until a plain value is reached.
   *
   * <p>A valuer that throws, or a chain longer than 100 steps, resolves to a string describing the failure
   * so a single attribute can never abort rendering.</p>
   *
   * @return resolved value; {@code this} when no expansion is needed
   */
  public Value resolve() {
    Value current = this;
    for (int i = 0; i < MAX_RESOLVE_DEPTH; i++) {
      if (current.kind != ValueKind.ANY || !(current.payload instanceof LogValuer valuer)) {
        return current;
      }
      Value next;
      try {
        next = valuer.logValue();
      } catch (RuntimeException ex) {
        return ofString("!PANIC: LogValue failed: " + ex);
      }
      current = next == null ? NULL_ANY : next;
    }
    return ofString("!ERROR: LogValue called too many times on type "
        + current.payload.getClass().getName());
  }

  private void require(ValueKind expected) {
    if (kind != expected) {
      throw new IllegalStateException("value kind is " + kind + ", not " + expected);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Value other)) {
      return false;
    }
    return kind == other.kind && bits == other.bits && Objects.equals(payload, other.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, payload, bits);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case STRING -> (String) payload;
      case INT64 -> Long.toString(bits);
      case UINT64 -> Long.toUnsignedString(bits);
      case FLOAT64 -> Double.toString(float64());
      case BOOL -> Boolean.toString(bits != 0L);
      default -> String.valueOf(payload);
    };
  }
}
