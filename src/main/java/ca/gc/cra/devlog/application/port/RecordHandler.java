package ca.gc.cra.devlog.application.port;

import ca.gc.cra.devlog.domain.Attr;
import ca.gc.cra.devlog.domain.Level;
import ca.gc.cra.devlog.domain.LogContext;
import ca.gc.cra.devlog.domain.LogRecord;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Contract implemented by every record renderer and decorator.
 * <p><strong>Why:</strong> Lets decorators such as {@code ContextEnrichingHandler} wrap any downstream renderer,
 * text or JSON, without knowing its output format.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Report whether a level would be rendered.</li>
 *   <li>Render one record together with its {@link LogContext}.</li>
 *   <li>Derive handlers with bound attributes or an open group, leaving the receiver untouched.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent {@link #handle} calls; derived
 * handlers are immutable.</p>
 *
 * @since 0.1.0
 */
public interface RecordHandler {
  /**
   * Reports whether records at {@code level} are rendered.
   *
   * @param level candidate level; must not be {@code null}
   * @return {@code true} when {@link #handle} would produce output
   */
  boolean enabled(Level level);

  /**
   * Renders one record.
   *
   * @param context enrichment values for this call; never {@code null}
   * @param record record to render; never {@code null}
   * @throws IOException when the output sink rejects the write
   */
  void handle(LogContext context, LogRecord record) throws IOException;

  /**
   * Returns a handler that renders {@code attrs} on every subsequent record.
   *
   * @param attrs attributes to bind
   * @return derived handler, or {@code this} when {@code attrs} is empty
   */
  RecordHandler withAttrs(List<Attr> attrs);

  /**
   * Returns a handler that nests subsequent attributes under {@code name}.
   *
   * @param name group name
   * @return derived handler, or {@code this} when {@code name} is empty
   */
  RecordHandler withGroup(String name);
}
