package ca.gc.cra.devlog.infrastructure.render;

import ca.gc.cra.devlog.application.port.CallerResolver;
import ca.gc.cra.devlog.application.port.RecordHandler;
import ca.gc.cra.devlog.config.HandlerOptions;
import ca.gc.cra.devlog.domain.Attr;
import ca.gc.cra.devlog.domain.Level;
import ca.gc.cra.devlog.domain.LogContext;
import ca.gc.cra.devlog.domain.LogRecord;
import ca.gc.cra.devlog.domain.Source;
import ca.gc.cra.devlog.infrastructure.buffer.BufferPool;
import ca.gc.cra.devlog.infrastructure.buffer.BufferPools;
import ca.gc.cra.devlog.infrastructure.buffer.GrowableBuffer;
import ca.gc.cra.devlog.infrastructure.caller.StackWalkerCallerResolver;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> {@link RecordHandler} that renders one colorized, human-readable line per record.
 * <p><strong>Why:</strong> During development a terse colored line with the caller, the traced statement and its
 * timing is faster to scan than JSON.</p>
 * <p><strong>Role:</strong> Terminal renderer; the development stack installs it directly and
 * {@code ContextEnrichingHandler} can wrap it.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Lay out time, level, caller, message, attributes, context values and the SQL block.</li>
 *   <li>Pre-render bound attributes once when a handler is derived.</li>
 *   <li>Serialize writes to the shared sink.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable apart from the sink. A handler and everything derived from it share
 * one lock, held only while the finished line is written and flushed; rendering happens in a pooled buffer owned by
 * the calling thread.</p>
 * <p><strong>Performance:</strong> One pooled buffer and a single sink write per record.</p>
 * <p><strong>Observability:</strong> Sink failures propagate as {@link IOException}.</p>
 *
 * @since 0.1.0
 */
public final class DevHandler implements RecordHandler {
  private static final byte[] NO_BYTES = new byte[0];

  private final HandlerOptions options;
  private final ValueEncoder encoder;
  private final DateTimeFormatter timeFormatter;
  private final CallerResolver callerResolver;
  private final BufferPool bufferPool;
  private final ReentrantLock writeLock;
  private final byte[] attrsPrefix;
  private final String groupPrefix;
  private final List<String> groups;

  /**
   * Creates a handler with the stack-walking caller resolver and the shared line buffer pool.
   *
   * @param options rendering options; must not be {@code null}
   */
  public DevHandler(HandlerOptions options) {
    this(options, new StackWalkerCallerResolver(), BufferPools.lineBuffers());
  }

  /**
   * Creates a handler with explicit collaborators.
   *
   * @param options rendering options
   * @param callerResolver turns record call sites into display sources
   * @param bufferPool pool supplying line buffers
   */
  public DevHandler(HandlerOptions options, CallerResolver callerResolver, BufferPool bufferPool) {
    this(Objects.requireNonNull(options, "options"),
        new ValueEncoder(options.color() ? AnsiPalette.ANSI : AnsiPalette.NONE, options.zone()),
        options.timeFormatter(),
        Objects.requireNonNull(callerResolver, "callerResolver"),
        Objects.requireNonNull(bufferPool, "bufferPool"),
        new ReentrantLock(),
        NO_BYTES,
        "",
        List.of());
  }

  private DevHandler(
      HandlerOptions options,
      ValueEncoder encoder,
      DateTimeFormatter timeFormatter,
      CallerResolver callerResolver,
      BufferPool bufferPool,
      ReentrantLock writeLock,
      byte[] attrsPrefix,
      String groupPrefix,
      List<String> groups) {
    this.options = options;
    this.encoder = encoder;
    this.timeFormatter = timeFormatter;
    this.callerResolver = callerResolver;
    this.bufferPool = bufferPool;
    this.writeLock = writeLock;
    this.attrsPrefix = attrsPrefix;
    this.groupPrefix = groupPrefix;
    this.groups = groups;
  }

  public HandlerOptions options() {
    return options;
  }

  /**
   * Names of the groups opened on this handler, outermost first.
   */
  public List<String> groups() {
    return groups;
  }

  @Override
  public boolean enabled(Level level) {
    return level.isAtLeast(options.level());
  }

  /**
   * Renders {@code record} as one line. The level floor is not re-checked here; callers consult
   * {@link #enabled(Level)} first.
   */
  @Override
  public void handle(LogContext context, LogRecord record) throws IOException {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(record, "record");
    AnsiPalette palette = encoder.palette();
    try (BufferPool.PooledBuffer pooled = bufferPool.acquire()) {
      GrowableBuffer buf = pooled.buffer();

      if (record.time() != null) {
        buf.writeString(palette.faint());
        buf.writeString(timeFormatter.format(record.time()));
        buf.writeString(palette.reset());
        buf.writeByte(' ');
      }

      encoder.appendLevel(buf, record.level());
      buf.writeByte(' ');

      if (options.source() && record.callSite() != null && record.callSite().hasFile()) {
        Optional<Source> source = context.source();
        if (source.isEmpty()) {
          source = callerResolver.resolve(record.callSite());
        }
        if (source.isPresent()) {
          encoder.appendSource(buf, source.get());
          buf.writeByte(' ');
        }
      }

      appendMessage(buf, record.level(), record.message());

      for (Attr attr : record.attrs()) {
        encoder.appendAttr(buf, attr, groupPrefix);
      }

      appendContextValues(buf, context);

      if (attrsPrefix.length > 0) {
        buf.write(attrsPrefix);
      }

      appendSql(buf, context, record.level());

      if (buf.isEmpty()) {
        return;
      }
      buf.setLastByte('\n');

      OutputStream out = options.output();
      writeLock.lock();
      try {
        buf.writeTo(out);
        out.flush();
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
    byte[] rendered;
    try (BufferPool.PooledBuffer pooled = bufferPool.acquire()) {
      GrowableBuffer buf = pooled.buffer();
      buf.write(attrsPrefix);
      for (Attr attr : attrs) {
        encoder.appendAttr(buf, attr, groupPrefix);
      }
      rendered = buf.toByteArray();
    }
    return new DevHandler(options, encoder, timeFormatter, callerResolver, bufferPool, writeLock,
        rendered, groupPrefix, groups);
  }

  @Override
  public RecordHandler withGroup(String name) {
    if (name == null || name.isEmpty()) {
      return this;
    }
    List<String> nested = new ArrayList<>(groups.size() + 1);
    nested.addAll(groups);
    nested.add(name);
    return new DevHandler(options, encoder, timeFormatter, callerResolver, bufferPool, writeLock,
        attrsPrefix, groupPrefix + name + ".", Collections.unmodifiableList(nested));
  }

  private void appendMessage(GrowableBuffer buf, Level level, String message) {
    if (message.isEmpty()) {
      return;
    }
    AnsiPalette palette = encoder.palette();
    buf.writeString(level == Level.ERROR ? palette.red() : palette.cyan());
    buf.writeString(message);
    buf.writeString(palette.reset());
    buf.writeByte(' ');
  }

  private void appendContextValues(GrowableBuffer buf, LogContext context) {
    AnsiPalette palette = encoder.palette();
    for (String key : options.addCxtAttr()) {
      Optional<Object> value = context.value(key);
      if (value.isEmpty()) {
        continue;
      }
      buf.writeString(palette.faint());
      buf.writeString(key);
      buf.writeByte('=');
      buf.writeString(palette.reset());
      buf.writeString(ValueEncoder.plainText(value.get()));
      buf.writeByte(' ');
    }
  }

  private void appendSql(GrowableBuffer buf, LogContext context, Level level) {
    Optional<String> sql = context.sql();
    if (sql.isEmpty()) {
      return;
    }
    AnsiPalette palette = encoder.palette();
    buf.writeByte('\n');

    Optional<Duration> elapsed = context.duration();
    if (elapsed.isPresent()) {
      boolean slow = elapsed.get().compareTo(options.slowThreshold()) > 0;
      buf.writeString(slow ? palette.red() : palette.green());
      buf.writeByte('[');
      buf.writeString(CompactFormats.seconds4(elapsed.get()));
      buf.writeString("] ");
      buf.writeString(palette.reset());
    }

    OptionalLong rows = context.rows();
    if (rows.isPresent()) {
      buf.writeString(palette.yellow());
      buf.writeString("rows:");
      buf.writeLong(rows.getAsLong());
      buf.writeByte(' ');
      buf.writeString(palette.reset());
    }

    buf.writeString(level == Level.ERROR ? palette.red() : palette.magenta());
    buf.writeString(sql.get());
    buf.writeByte(' ');
    buf.writeString(palette.reset());
    buf.writeByte('\n');
  }

  @Override
  public String toString() {
    return "DevHandler[groups=" + groups + ", boundBytes=" + attrsPrefix.length + "]";
  }
}
