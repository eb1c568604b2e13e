package ca.gc.cra.devlog.config;

import ca.gc.cra.devlog.domain.Level;
import ca.gc.cra.devlog.infrastructure.render.CompactFormats;
import ca.gc.cra.devlog.validation.Strings;
import java.io.OutputStream;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable options shared by the text handler, the enrichment decorator and the
 * bootstrap.
 * <p><strong>Why:</strong> One record carries every knob so derived handlers can share it by reference.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; the output stream is shared and only written under the
 * owning handler's lock.</p>
 *
 * @param addCxtAttr context keys whose values are rendered on every line, in this order
 * @param output sink receiving rendered lines
 * @param source whether the caller's file, line and function are rendered
 * @param slowThreshold statement durations strictly above this are highlighted as slow
 * @param level minimum level rendered
 * @param timeFormat {@link DateTimeFormatter} pattern for the record time
 * @param zone zone used to render times
 * @param color whether ANSI color codes are emitted
 * @since 0.1.0
 */
public record HandlerOptions(
    List<String> addCxtAttr,
    OutputStream output,
    boolean source,
    Duration slowThreshold,
    Level level,
    String timeFormat,
    ZoneId zone,
    boolean color) {

  public static final Duration DEFAULT_SLOW_THRESHOLD = Duration.ofSeconds(1);
  public static final String DEFAULT_TIME_FORMAT = "HH:mm:ss";

  public HandlerOptions {
    List<String> keys = new ArrayList<>();
    for (String key : Objects.requireNonNullElse(addCxtAttr, List.<String>of())) {
      keys.add(Strings.requireNonBlank("addCxtAttr", key));
    }
    addCxtAttr = List.copyOf(keys);
    output = Objects.requireNonNullElse(output, System.out);
    slowThreshold = Objects.requireNonNullElse(slowThreshold, DEFAULT_SLOW_THRESHOLD);
    if (slowThreshold.isNegative()) {
      throw new IllegalArgumentException("slowThreshold must not be negative");
    }
    level = Objects.requireNonNullElse(level, Level.DEBUG);
    timeFormat = Objects.requireNonNullElse(timeFormat, DEFAULT_TIME_FORMAT);
    try {
      DateTimeFormatter.ofPattern(timeFormat, Locale.ROOT);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("timeFormat is not a valid pattern: " + timeFormat, ex);
    }
    zone = Objects.requireNonNullElse(zone, ZoneId.systemDefault());
  }

  /**
   * Defaults: no context keys, standard output, no source, one-second slow threshold, {@code DEBUG},
   * {@code HH:mm:ss}, the system zone, colors on.
   *
   * @return default options
   */
  public static HandlerOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Parses flat {@code key=value} settings, as produced by {@link YamlConfigLoader}. Unknown keys are ignored.
   *
   * <p>Recognized keys: {@code addCxtAttr} (comma separated), {@code source}, {@code slowThreshold}
   * ({@code 250ms} or ISO-8601), {@code level}, {@code timeFormat}, {@code zone}, {@code color},
   * {@code output} ({@code stdout} or {@code stderr}).</p>
   *
   * @param settings flat settings; may be {@code null}
   * @return parsed options
   * @throws IllegalArgumentException when a value is invalid
   */
  public static HandlerOptions fromMap(Map<String, String> settings) {
    Map<String, String> kv = settings == null ? Map.of() : settings;
    Builder builder = builder();
    String keys = kv.get("addCxtAttr");
    if (keys != null && !keys.isBlank()) {
      List<String> parsed = new ArrayList<>();
      for (String key : keys.split(",")) {
        if (!key.isBlank()) {
          parsed.add(key.trim());
        }
      }
      builder.addCxtAttr(parsed);
    }
    builder.source(parseBoolean("source", kv.get("source"), false));
    builder.color(parseBoolean("color", kv.get("color"), true));
    String slow = kv.get("slowThreshold");
    if (slow != null && !slow.isBlank()) {
      builder.slowThreshold(CompactFormats.parseDuration(slow));
    }
    String level = kv.get("level");
    if (level != null && !level.isBlank()) {
      builder.level(Level.parse(level));
    }
    String timeFormat = kv.get("timeFormat");
    if (timeFormat != null && !timeFormat.isBlank()) {
      builder.timeFormat(timeFormat);
    }
    String zone = kv.get("zone");
    if (zone != null && !zone.isBlank()) {
      try {
        builder.zone(ZoneId.of(zone.trim()));
      } catch (DateTimeException ex) {
        throw new IllegalArgumentException("Unknown zone: " + zone, ex);
      }
    }
    String output = kv.get("output");
    if (output != null && !output.isBlank()) {
      builder.output(parseOutput(output));
    }
    return builder.build();
  }

  /**
   * Returns a formatter for the record time in the configured zone.
   */
  public DateTimeFormatter timeFormatter() {
    return DateTimeFormatter.ofPattern(timeFormat, Locale.ROOT).withZone(zone);
  }

  public Builder toBuilder() {
    return new Builder()
        .addCxtAttr(addCxtAttr)
        .output(output)
        .source(source)
        .slowThreshold(slowThreshold)
        .level(level)
        .timeFormat(timeFormat)
        .zone(zone)
        .color(color);
  }

  private static boolean parseBoolean(String name, String raw, boolean fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "true":
      case "yes":
      case "on":
      case "1":
        return true;
      case "false":
      case "no":
      case "off":
      case "0":
        return false;
      default:
        throw new IllegalArgumentException(name + " must be a boolean, got " + raw);
    }
  }

  private static OutputStream parseOutput(String raw) {
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "stdout" -> System.out;
      case "stderr" -> System.err;
      default -> throw new IllegalArgumentException("output must be stdout or stderr, got " + raw);
    };
  }

  /**
   * Mutable builder; unset fields take the defaults documented on {@link HandlerOptions#defaults()}.
   */
  public static final class Builder {
    private List<String> addCxtAttr = List.of();
    private OutputStream output;
    private boolean source;
    private Duration slowThreshold;
    private Level level;
    private String timeFormat;
    private ZoneId zone;
    private boolean color = true;

    private Builder() {}

    public Builder addCxtAttr(List<String> keys) {
      this.addCxtAttr = keys;
      return this;
    }

    public Builder addCxtAttr(String... keys) {
      return addCxtAttr(List.of(keys));
    }

    public Builder output(OutputStream output) {
      this.output = output;
      return this;
    }

    public Builder source(boolean source) {
      this.source = source;
      return this;
    }

    public Builder slowThreshold(Duration slowThreshold) {
      this.slowThreshold = slowThreshold;
      return this;
    }

    public Builder level(Level level) {
      this.level = level;
      return this;
    }

    public Builder timeFormat(String timeFormat) {
      this.timeFormat = timeFormat;
      return this;
    }

    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    public Builder color(boolean color) {
      this.color = color;
      return this;
    }

    public HandlerOptions build() {
      return new HandlerOptions(addCxtAttr, output, source, slowThreshold, level, timeFormat, zone, color);
    }
  }
}
