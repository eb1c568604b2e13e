package ca.gc.cra.devlog.config;

import ca.gc.cra.devlog.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds {@link HandlerOptions} from a YAML profile.
 * <p><strong>Role:</strong> Bootstrap helper used before {@code Loggers} installs a stack.</p>
 * <p><strong>Observability:</strong> Logs at DEBUG which file and profile were applied. A {@code diagnostics} key
 * sets the level of devlog's own SLF4J output through {@link LoggingConfigurator}.</p>
 *
 * @since 0.1.0
 */
public final class HandlerOptionsLoader {
  private static final Logger log = LoggerFactory.getLogger(HandlerOptionsLoader.class);

  private HandlerOptionsLoader() {}

  /**
   * Loads options from {@code path}, falling back to {@link HandlerOptions#defaults()} when the file is absent.
   *
   * @param path YAML document
   * @param profile section merged over {@code common}
   * @return parsed options
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the document or a value is invalid
   */
  public static HandlerOptions load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    Optional<Map<String, String>> settings = YamlConfigLoader.load(path, profile);
    if (settings.isEmpty()) {
      log.debug("No logging config at {}; using defaults", path);
      return HandlerOptions.defaults();
    }
    Map<String, String> kv = settings.get();
    String diagnostics = kv.get("diagnostics");
    if (diagnostics != null && !diagnostics.isBlank()) {
      LoggingConfigurator.setDiagnosticsLevel(diagnostics.trim());
    }
    HandlerOptions options = HandlerOptions.fromMap(kv);
    log.debug("Loaded logging profile {} from {}", profile, path);
    return options;
  }
}
