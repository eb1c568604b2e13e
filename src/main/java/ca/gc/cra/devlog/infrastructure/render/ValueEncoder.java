package ca.gc.cra.devlog.infrastructure.render;

import ca.gc.cra.devlog.domain.Attr;
import ca.gc.cra.devlog.domain.Level;
import ca.gc.cra.devlog.domain.LogError;
import ca.gc.cra.devlog.domain.Source;
import ca.gc.cra.devlog.domain.TextMarshalException;
import ca.gc.cra.devlog.domain.TextMarshaler;
import ca.gc.cra.devlog.domain.Value;
import ca.gc.cra.devlog.domain.ValueKind;
import ca.gc.cra.devlog.infrastructure.buffer.GrowableBuffer;
import ca.gc.cra.devlog.infrastructure.caller.FunctionNames;
import ca.gc.cra.devlog.infrastructure.caller.SourcePaths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Appends attributes and values to a line buffer in {@code key=value } form.
 * <p><strong>Why:</strong> Keeps the per-kind text rules in one place so {@link DevHandler} only decides layout
 * and ordering.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve lazily computed values and skip the zero attribute.</li>
 *   <li>Flatten groups into dotted keys.</li>
 *   <li>Render error attributes on a highlighted path.</li>
 *   <li>Contain failures of arbitrary values so the rest of the line is still written.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share between handlers and threads. Buffers passed in are
 * owned by the calling thread.</p>
 *
 * @since 0.1.0
 */
public final class ValueEncoder {
  private static final Logger log = LoggerFactory.getLogger(ValueEncoder.class);

  private final AnsiPalette palette;
  private final ZoneId zone;

  /**
   * Creates an encoder.
   *
   * @param palette colors to emit; {@link AnsiPalette#NONE} also strips escape runs from quoted strings
   * @param zone zone used to render time values
   */
  public ValueEncoder(AnsiPalette palette, ZoneId zone) {
    this.palette = Objects.requireNonNull(palette, "palette");
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public AnsiPalette palette() {
    return palette;
  }

  /**
   * Appends {@code attr} followed by a space. Groups expand to one entry per member with {@code key.} added to
   * the prefix; an empty group key inlines the members.
   *
   * @param buf destination
   * @param attr attribute; resolved before rendering
   * @param groupPrefix dotted prefix of enclosing groups, empty at top level
   */
  public void appendAttr(GrowableBuffer buf, Attr attr, String groupPrefix) {
    Attr resolved = attr.resolve();
    if (resolved.isEmpty()) {
      return;
    }
    Value value = resolved.value();
    if (value.kind() == ValueKind.ANY && value.any() instanceof LogError error) {
      appendError(buf, error, resolved.key(), groupPrefix);
      buf.writeByte(' ');
      return;
    }
    if (value.kind() == ValueKind.GROUP) {
      String prefix = resolved.key().isEmpty() ? groupPrefix : groupPrefix + resolved.key() + ".";
      for (Attr member : value.group()) {
        appendAttr(buf, member, prefix);
      }
      return;
    }
    appendKey(buf, resolved.key(), groupPrefix);
    appendValue(buf, value, true);
    buf.writeByte(' ');
  }

  /**
   * Appends a faint {@code prefix+key=}; keys are never quoted.
   */
  public void appendKey(GrowableBuffer buf, String key, String groupPrefix) {
    buf.writeString(palette.faint());
    StringQuoter.append(buf, groupPrefix + key, false, palette.enabled());
    buf.writeByte('=');
    buf.writeString(palette.reset());
  }

  /**
   * Appends the text of {@code value}.
   *
   * @param buf destination
   * @param value value to render
   * @param quote whether strings, durations, times and arbitrary values may be quoted
   */
  public void appendValue(GrowableBuffer buf, Value value, boolean quote) {
    boolean color = palette.enabled();
    switch (value.kind()) {
      case STRING -> StringQuoter.append(buf, value.string(), quote, color);
      case INT64 -> buf.writeLong(value.int64());
      case UINT64 -> buf.writeString(Long.toUnsignedString(value.uint64()));
      case FLOAT64 -> buf.writeString(CompactFormats.formatFloat(value.float64()));
      case BOOL -> buf.writeString(Boolean.toString(value.bool()));
      case DURATION -> StringQuoter.append(buf, CompactFormats.formatDuration(value.duration()), quote, color);
      case TIME -> StringQuoter.append(buf, CompactFormats.formatTime(value.time(), zone), quote, color);
      case GROUP -> {
        // expanded member by member in appendAttr
      }
      case ANY -> appendAny(buf, value.any(), quote);
      default -> throw new IllegalStateException("Unhandled value kind " + value.kind());
    }
  }

  /**
   * Appends the level name in its severity color.
   */
  public void appendLevel(GrowableBuffer buf, Level level) {
    String color = switch (level) {
      case INFO -> palette.brightGreen();
      case WARN -> palette.brightYellow();
      default -> palette.red();
    };
    buf.writeString(color);
    buf.writeString(level.name());
    buf.writeString(palette.reset());
  }

  /**
   * Appends {@code dir/File.java:line function}; the line is omitted when zero. No trailing space.
   */
  public void appendSource(GrowableBuffer buf, Source source) {
    buf.writeString(palette.faint());
    buf.writeString(SourcePaths.shortFile(source.file()));
    if (source.line() != 0) {
      buf.writeByte(':');
      buf.writeLong(source.line());
    }
    buf.writeString(palette.reset());
    buf.writeByte(' ');
    buf.writeString(palette.blue());
    buf.writeString(FunctionNames.shortName(source.function()));
    buf.writeString(palette.reset());
  }

  /**
   * Appends a blue {@code "key"=} followed by the faint error message.
   */
  public void appendError(GrowableBuffer buf, LogError error, String key, String groupPrefix) {
    boolean color = palette.enabled();
    buf.writeString(palette.blue());
    StringQuoter.append(buf, groupPrefix + key, true, color);
    buf.writeByte('=');
    buf.writeString(palette.faint());
    StringQuoter.append(buf, error.message(), true, color);
    buf.writeString(palette.reset());
  }

  /**
   * Unquoted text of a context value: durations and doubles in their compact forms, anything else through
   * {@code String.valueOf}.
   *
   * @param value context value; may be {@code null}
   * @return text form, never {@code null}
   */
  public static String plainText(Object value) {
    if (value instanceof Duration duration) {
      return CompactFormats.formatDuration(duration);
    }
    if (value instanceof Double || value instanceof Float) {
      return CompactFormats.formatFloat(((Number) value).doubleValue());
    }
    try {
      return AnyText.format(value);
    } catch (ValueEncodingException ex) {
      return "!PANIC: " + failureMessage(ex.getCause());
    }
  }

  private void appendAny(GrowableBuffer buf, Object any, boolean quote) {
    if (any == null) {
      StringQuoter.append(buf, "<nil>", false, false);
      return;
    }
    try {
      writeAny(buf, any, quote);
    } catch (ValueEncodingException ex) {
      if (ex.causedByNull()) {
        StringQuoter.append(buf, "<nil>", false, false);
      } else {
        StringQuoter.append(buf, "!PANIC: " + failureMessage(ex.getCause()), true, palette.enabled());
      }
    }
  }

  private void writeAny(GrowableBuffer buf, Object any, boolean quote) throws ValueEncodingException {
    boolean color = palette.enabled();
    if (any instanceof Level level) {
      appendLevel(buf, level);
    } else if (any instanceof TextMarshaler marshaler) {
      String text;
      try {
        text = marshaler.marshalText();
      } catch (TextMarshalException ex) {
        log.debug("Skipping value of {}: {}", any.getClass().getName(), ex.getMessage());
        return;
      } catch (RuntimeException ex) {
        throw new ValueEncodingException("marshalText failed for " + any.getClass().getName(), ex);
      }
      StringQuoter.append(buf, text == null ? "" : text, quote, color);
    } else if (any instanceof Source source) {
      appendSource(buf, source);
    } else {
      StringQuoter.append(buf, AnyText.format(any), quote, color);
    }
  }

  private static String failureMessage(Throwable failure) {
    String message = failure.getMessage();
    return message != null ? message : failure.getClass().getName();
  }
}
