package ca.gc.cra.devlog.api;

import ca.gc.cra.devlog.application.StructuredLogger;
import ca.gc.cra.devlog.config.HandlerOptions;
import ca.gc.cra.devlog.infrastructure.json.JsonHandler;
import ca.gc.cra.devlog.infrastructure.middleware.ContextEnrichingHandler;
import ca.gc.cra.devlog.infrastructure.render.DevHandler;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds the standard handler stacks and optionally installs one as the process default.
 * <p><strong>Why:</strong> Most code should receive a {@link StructuredLogger} explicitly; legacy call sites that
 * cannot be given one use {@link #getLogger()}.</p>
 * <p><strong>Stacks:</strong>
 * <ul>
 *   <li>{@link #production(HandlerOptions)}: {@link ContextEnrichingHandler} over {@link JsonHandler}.</li>
 *   <li>{@link #development(HandlerOptions)}: {@link DevHandler} alone.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Installation is atomic and happens at most once. Until then
 * {@link #getLogger()} lazily creates a production logger with default options, which a later
 * {@link #install(StructuredLogger)} replaces.</p>
 *
 * @since 0.1.0
 */
public final class Loggers {
  private static final Logger log = LoggerFactory.getLogger(Loggers.class);

  private static final AtomicReference<Installed> DEFAULT = new AtomicReference<>();

  private Loggers() {}

  /**
   * Creates a JSON logger whose records are enriched from their context.
   */
  public static StructuredLogger production(HandlerOptions options) {
    Objects.requireNonNull(options, "options");
    return new StructuredLogger(new ContextEnrichingHandler(new JsonHandler(options), options));
  }

  /**
   * Creates a colorized console logger.
   */
  public static StructuredLogger development(HandlerOptions options) {
    Objects.requireNonNull(options, "options");
    return new StructuredLogger(new DevHandler(options));
  }

  /**
   * Builds and installs the production stack.
   *
   * @return installed logger
   * @throws IllegalStateException when a logger was already installed
   */
  public static StructuredLogger initLogger(HandlerOptions options) {
    return install(production(options));
  }

  /**
   * Builds and installs the development stack.
   *
   * @return installed logger
   * @throws IllegalStateException when a logger was already installed
   */
  public static StructuredLogger initDevLogger(HandlerOptions options) {
    return install(development(options));
  }

  /**
   * Installs {@code logger} as the process default.
   *
   * @param logger logger returned by {@link #getLogger()} from now on
   * @return {@code logger}
   * @throws IllegalStateException when a logger was already installed
   */
  public static StructuredLogger install(StructuredLogger logger) {
    Objects.requireNonNull(logger, "logger");
    Installed next = new Installed(logger, true);
    while (true) {
      Installed current = DEFAULT.get();
      if (current != null && current.explicit()) {
        throw new IllegalStateException("A default logger is already installed");
      }
      if (DEFAULT.compareAndSet(current, next)) {
        log.debug("Installed default logger over {}", logger.handler().getClass().getSimpleName());
        return logger;
      }
    }
  }

  /**
   * Returns the installed logger, creating a production logger with default options when none was installed.
   */
  public static StructuredLogger getLogger() {
    Installed current = DEFAULT.get();
    if (current != null) {
      return current.logger();
    }
    Installed fallback = new Installed(production(HandlerOptions.defaults()), false);
    return DEFAULT.compareAndSet(null, fallback) ? fallback.logger() : DEFAULT.get().logger();
  }

  static void reset() {
    DEFAULT.set(null);
  }

  private record Installed(StructuredLogger logger, boolean explicit) {}
}
