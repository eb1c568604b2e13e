package ca.gc.cra.devlog.infrastructure.json;

import ca.gc.cra.devlog.application.port.RecordHandler;
import ca.gc.cra.devlog.config.HandlerOptions;
import ca.gc.cra.devlog.domain.Attr;
import ca.gc.cra.devlog.domain.Level;
import ca.gc.cra.devlog.domain.LogContext;
import ca.gc.cra.devlog.domain.LogError;
import ca.gc.cra.devlog.domain.LogRecord;
import ca.gc.cra.devlog.domain.Source;
import ca.gc.cra.devlog.domain.TextMarshalException;
import ca.gc.cra.devlog.domain.TextMarshaler;
import ca.gc.cra.devlog.domain.Value;
import ca.gc.cra.devlog.domain.ValueKind;
import ca.gc.cra.devlog.infrastructure.buffer.BufferPool;
import ca.gc.cra.devlog.infrastructure.buffer.BufferPools;
import ca.gc.cra.devlog.infrastructure.buffer.GrowableBuffer;
import ca.gc.cra.devlog.infrastructure.render.AnyText;
import ca.gc.cra.devlog.infrastructure.render.ValueEncodingException;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> {@link RecordHandler} writing one JSON object per line.
 * <p><strong>Why:</strong> Production output is consumed by log collectors, so the record and every attribute keep
 * their structure; {@code ContextEnrichingHandler} in front of it contributes the context values.</p>
 * <p><strong>Values:</strong> A {@link TextMarshaler} whose {@code marshalText} reports a
 * {@link TextMarshalException} is written as {@code "!ERROR:<msg>"}. Any other failure while turning a value into
 * text stays inside that value: {@code "<nil>"} for a null dereference, {@code "!PANIC: <msg>"} otherwise.</p>
 * <p><strong>Layout:</strong> {@code time}, {@code level}, {@code msg}, then bound attributes, with each open group
 * as a nested object holding the attributes bound after it and, innermost, the record attributes. Groups that
 * would end up empty are omitted.</p>
 * <p><strong>Thread-safety:</strong> Immutable; derived handlers share the sink and one write lock.</p>
 * <p><strong>Performance:</strong> Streams through jackson-core into a pooled buffer; one sink write per record.</p>
 *
 * @since 0.1.0
 */
public final class JsonHandler implements RecordHandler {
  private static final JsonFactory JSON_FACTORY = new JsonFactory();

  private final OutputStream output;
  private final Level floor;
  private final DateTimeFormatter timeFormatter;
  private final BufferPool bufferPool;
  private final ReentrantLock writeLock;
  private final List<Scope> scopes;

  /**
   * Creates a handler writing to {@code options.output()} at {@code options.level()} and above.
   */
  public JsonHandler(HandlerOptions options) {
    this(options.output(), options.level(), options.zone(), BufferPools.lineBuffers());
  }

  /**
   * Creates a handler with explicit settings.
   *
   * @param output sink receiving JSON lines
   * @param floor minimum level
   * @param zone zone for time values
   * @param bufferPool pool supplying line buffers
   */
  public JsonHandler(OutputStream output, Level floor, ZoneId zone, BufferPool bufferPool) {
    this(Objects.requireNonNull(output, "output"),
        Objects.requireNonNull(floor, "floor"),
        DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(Objects.requireNonNull(zone, "zone")),
        Objects.requireNonNull(bufferPool, "bufferPool"),
        new ReentrantLock(),
        List.of(new Scope(null, List.of())));
  }

  private JsonHandler(
      OutputStream output,
      Level floor,
      DateTimeFormatter timeFormatter,
      BufferPool bufferPool,
      ReentrantLock writeLock,
      List<Scope> scopes) {
    this.output = output;
    this.floor = floor;
    this.timeFormatter = timeFormatter;
    this.bufferPool = bufferPool;
    this.writeLock = writeLock;
    this.scopes = scopes;
  }

  @Override
  public boolean enabled(Level level) {
    return level.isAtLeast(floor);
  }

  @Override
  public void handle(LogContext context, LogRecord record) throws IOException {
    Objects.requireNonNull(record, "record");
    try (BufferPool.PooledBuffer pooled = bufferPool.acquire()) {
      GrowableBuffer buf = pooled.buffer();
      try (JsonGenerator gen = JSON_FACTORY.createGenerator(buf.asOutputStream())) {
        gen.writeStartObject();
        if (record.time() != null) {
          gen.writeStringField("time", timeFormatter.format(record.time()));
        }
        gen.writeStringField("level", record.level().name());
        gen.writeStringField("msg", record.message());
        writeScope(gen, 0, record.attrs());
        gen.writeEndObject();
      }
      buf.writeByte('\n');

      writeLock.lock();
      try {
        buf.writeTo(output);
        output.flush();
      } finally {
        writeLock.unlock();
      }
    }
  }

  @Override
  public RecordHandler withAttrs(List<Attr> attrs) {
    if (attrs == null || attrs.isEmpty()) {
      return this;
    }
    List<Scope> derived = new ArrayList<>(scopes);
    Scope last = derived.get(derived.size() - 1);
    List<Attr> merged = new ArrayList<>(last.attrs());
    merged.addAll(attrs);
    derived.set(derived.size() - 1, new Scope(last.group(), List.copyOf(merged)));
    return new JsonHandler(output, floor, timeFormatter, bufferPool, writeLock, List.copyOf(derived));
  }

  @Override
  public RecordHandler withGroup(String name) {
    if (name == null || name.isEmpty()) {
      return this;
    }
    List<Scope> derived = new ArrayList<>(scopes);
    derived.add(new Scope(name, List.of()));
    return new JsonHandler(output, floor, timeFormatter, bufferPool, writeLock, List.copyOf(derived));
  }

  private void writeScope(JsonGenerator gen, int index, List<Attr> recordAttrs) throws IOException {
    Scope scope = scopes.get(index);
    for (Attr attr : scope.attrs()) {
      writeAttr(gen, attr);
    }
    boolean innermost = index == scopes.size() - 1;
    if (innermost) {
      for (Attr attr : recordAttrs) {
        writeAttr(gen, attr);
      }
      return;
    }
    if (!hasContent(index + 1, recordAttrs)) {
      return;
    }
    gen.writeObjectFieldStart(scopes.get(index + 1).group());
    writeScope(gen, index + 1, recordAttrs);
    gen.writeEndObject();
  }

  private boolean hasContent(int from, List<Attr> recordAttrs) {
    if (hasVisible(recordAttrs)) {
      return true;
    }
    for (int i = from; i < scopes.size(); i++) {
      if (hasVisible(scopes.get(i).attrs())) {
        return true;
      }
    }
    return false;
  }

  private static boolean hasVisible(List<Attr> attrs) {
    for (Attr attr : attrs) {
      Attr resolved = attr.resolve();
      if (resolved.isEmpty()) {
        continue;
      }
      if (resolved.value().kind() != ValueKind.GROUP || hasVisible(resolved.value().group())) {
        return true;
      }
    }
    return false;
  }

  private void writeAttr(JsonGenerator gen, Attr attr) throws IOException {
    Attr resolved = attr.resolve();
    if (resolved.isEmpty()) {
      return;
    }
    Value value = resolved.value();
    if (value.kind() == ValueKind.GROUP) {
      List<Attr> members = value.group();
      if (!hasVisible(members)) {
        return;
      }
      if (resolved.key().isEmpty()) {
        for (Attr member : members) {
          writeAttr(gen, member);
        }
        return;
      }
      gen.writeObjectFieldStart(resolved.key());
      for (Attr member : members) {
        writeAttr(gen, member);
      }
      gen.writeEndObject();
      return;
    }
    gen.writeFieldName(resolved.key());
    writeValue(gen, value);
  }

  private void writeValue(JsonGenerator gen, Value value) throws IOException {
    switch (value.kind()) {
      case STRING -> gen.writeString(value.string());
      case INT64 -> gen.writeNumber(value.int64());
      case UINT64 -> gen.writeNumber(new BigInteger(Long.toUnsignedString(value.uint64())));
      case FLOAT64 -> {
        double d = value.float64();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
          gen.writeString(Double.toString(d));
        } else {
          gen.writeNumber(d);
        }
      }
      case BOOL -> gen.writeBoolean(value.bool());
      case DURATION -> gen.writeNumber(nanos(value.duration()));
      case TIME -> gen.writeString(timeFormatter.format(value.time()));
      case ANY -> writeAny(gen, value.any());
      default -> throw new IllegalStateException("Unhandled value kind " + value.kind());
    }
  }

  private void writeAny(JsonGenerator gen, Object any) throws IOException {
    if (any == null) {
      gen.writeNull();
    } else if (any instanceof LogError error) {
      gen.writeString(error.message());
    } else if (any instanceof Source source) {
      gen.writeStartObject();
      gen.writeStringField("function", source.function());
      gen.writeStringField("file", source.file());
      gen.writeNumberField("line", source.line());
      gen.writeEndObject();
    } else if (any instanceof Level level) {
      gen.writeString(level.name());
    } else if (any instanceof TextMarshaler marshaler) {
      try {
        gen.writeString(marshaler.marshalText());
      } catch (TextMarshalException ex) {
        gen.writeString("!ERROR:" + ex.getMessage());
      } catch (RuntimeException ex) {
        writeFailure(gen, new ValueEncodingException("marshalText failed for " + any.getClass().getName(), ex));
      }
    } else {
      try {
        gen.writeString(AnyText.format(any));
      } catch (ValueEncodingException ex) {
        writeFailure(gen, ex);
      }
    }
  }

  private static void writeFailure(JsonGenerator gen, ValueEncodingException ex) throws IOException {
    gen.writeString(ex.causedByNull() ? "<nil>" : "!PANIC: " + failureMessage(ex.getCause()));
  }

  private static String failureMessage(Throwable failure) {
    String message = failure.getMessage();
    return message != null ? message : failure.getClass().getName();
  }

  private static long nanos(Duration duration) {
    try {
      return duration.toNanos();
    } catch (ArithmeticException ex) {
      return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }

  /** Attributes bound at one nesting level; {@code group} is {@code null} for the top level. */
  private record Scope(String group, List<Attr> attrs) {}
}
