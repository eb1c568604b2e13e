package ca.gc.cra.devlog.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a YAML logging document and flattens the {@code common} section plus one named profile section into
 * dotted {@code key=value} pairs; profile values override common ones.
 *
 * <pre>
 * common:
 *   addCxtAttr: [requestId, userId]
 * dev:
 *   source: true
 *   slowThreshold: 200ms
 * </pre>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and merges {@code common} with the {@code profile} section.
   *
   * @param path YAML document
   * @param profile section name, matched case-insensitively (for example {@code dev} or {@code prod})
   * @return flattened settings; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not a mapping of mappings
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(profile, "profile");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String wanted = profile.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> settings = new LinkedHashMap<>();
      Object common = section(root, "common");
      if (common != null) {
        flatten(asMap(common, "common"), "", settings);
      }
      Object selected = section(root, wanted);
      if (selected != null) {
        flatten(asMap(selected, wanted), "", settings);
      }
      return Optional.of(Map.copyOf(settings));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML logging config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(where + " section contains a non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object section(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> node, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : node.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML logging config contains a blank key");
      }
      String dotted = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(dotted, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, dotted), dotted, target);
      } else if (value instanceof Iterable<?> items) {
        // lists become comma separated, the form HandlerOptions.fromMap splits
        StringJoiner joined = new StringJoiner(",");
        for (Object item : items) {
          if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
            throw new IllegalArgumentException("Nested collections are not supported for key " + dotted);
          }
          joined.add(String.valueOf(item));
        }
        target.put(dotted, joined.toString());
      } else {
        target.put(dotted, value.toString());
      }
    }
  }
}
