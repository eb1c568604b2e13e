package ca.gc.cra.devlog.infrastructure.middleware;

import ca.gc.cra.devlog.application.port.CallerResolver;
import ca.gc.cra.devlog.application.port.RecordHandler;
import ca.gc.cra.devlog.config.HandlerOptions;
import ca.gc.cra.devlog.domain.Attr;
import ca.gc.cra.devlog.domain.ContextKeys;
import ca.gc.cra.devlog.domain.Level;
import ca.gc.cra.devlog.domain.LogContext;
import ca.gc.cra.devlog.domain.LogRecord;
import ca.gc.cra.devlog.domain.Source;
import ca.gc.cra.devlog.infrastructure.caller.StackWalkerCallerResolver;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Decorator that copies context values into record attributes before forwarding.
 * <p><strong>Why:</strong> Structured downstream handlers such as {@code JsonHandler} only see attributes; this
 * moves the configured context keys, the traced SQL statement and the caller into the record itself.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Attach each configured {@code addCxtAttr} key present in the context, in configured order.</li>
 *   <li>Always attach the {@value ContextKeys#SQL} context value when present.</li>
 *   <li>When source resolution is on and the context carries no explicit source, attach the resolved caller
 *   under {@value ContextKeys#SOURCE}.</li>
 * </ul>
 * <p><strong>Derivation:</strong> {@link #withAttrs(List)} and {@link #withGroup(String)} derive the downstream
 * handler and wrap it in a decorator with the same configuration, so derived loggers keep their enrichment.
 * Earlier releases of this pattern returned an unconfigured decorator; carrying the configuration forward is a
 * deliberate behavioral choice.</p>
 * <p><strong>Thread-safety:</strong> Immutable; thread-safe when the downstream handler is.</p>
 *
 * @since 0.1.0
 */
public final class ContextEnrichingHandler implements RecordHandler {
  private final RecordHandler next;
  private final List<String> addCxtAttr;
  private final boolean source;
  private final CallerResolver callerResolver;

  /**
   * Wraps {@code next} using the {@code addCxtAttr} and {@code source} settings of {@code options}.
   */
  public ContextEnrichingHandler(RecordHandler next, HandlerOptions options) {
    this(next, options.addCxtAttr(), options.source(), new StackWalkerCallerResolver());
  }

  /**
   * Creates a decorator with explicit settings.
   *
   * @param next downstream handler
   * @param addCxtAttr context keys to attach, in order
   * @param source whether to attach the resolved caller
   * @param callerResolver resolver for record call sites
   */
  public ContextEnrichingHandler(
      RecordHandler next, List<String> addCxtAttr, boolean source, CallerResolver callerResolver) {
    this.next = Objects.requireNonNull(next, "next");
    this.addCxtAttr = List.copyOf(Objects.requireNonNull(addCxtAttr, "addCxtAttr"));
    this.source = source;
    this.callerResolver = Objects.requireNonNull(callerResolver, "callerResolver");
  }

  public RecordHandler next() {
    return next;
  }

  public List<String> addCxtAttr() {
    return addCxtAttr;
  }

  public boolean source() {
    return source;
  }

  @Override
  public boolean enabled(Level level) {
    return next.enabled(level);
  }

  @Override
  public void handle(LogContext context, LogRecord record) throws IOException {
    List<Attr> extra = new ArrayList<>();
    for (String key : addCxtAttr) {
      context.value(key).ifPresent(value -> extra.add(Attr.any(key, value)));
    }
    context.value(ContextKeys.SQL).ifPresent(sql -> extra.add(Attr.any(ContextKeys.SQL, sql)));

    if (source && context.value(ContextKeys.SOURCE).isEmpty() && record.callSite() != null) {
      Optional<Source> resolved = callerResolver.resolve(record.callSite());
      resolved.ifPresent(src -> extra.add(Attr.any(ContextKeys.SOURCE, src)));
    }

    next.handle(context, record.withAttrs(extra));
  }

  @Override
  public RecordHandler withAttrs(List<Attr> attrs) {
    if (attrs == null || attrs.isEmpty()) {
      return this;
    }
    return new ContextEnrichingHandler(next.withAttrs(attrs), addCxtAttr, source, callerResolver);
  }

  @Override
  public RecordHandler withGroup(String name) {
    if (name == null || name.isEmpty()) {
      return this;
    }
    return new ContextEnrichingHandler(next.withGroup(name), addCxtAttr, source, callerResolver);
  }
}
