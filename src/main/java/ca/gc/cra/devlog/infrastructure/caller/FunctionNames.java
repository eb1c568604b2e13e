package ca.gc.cra.devlog.infrastructure.caller;

import java.util.List;

/**
 * <strong>What:</strong> Reduces fully qualified function names to short display names.
 * <p><strong>Why:</strong> A qualified name such as {@code com.acme.orders.OrderService.lambda$submit$0} is too
 * long for a console line, while the bare last segment would lose the enclosing method of a closure.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class FunctionNames {
  /** Segment prefixes that denote compiler-generated closures. */
  private static final List<String> CLOSURE_MARKERS = List.of("func", "lambda$");

  private FunctionNames() {}

  /**
   * Splits {@code qualified} on dots and walks from the end, absorbing numeric segments and closure segments
   * into a dotted suffix until the first ordinary segment, which becomes the head of the display name.
   *
   * <p>Examples: {@code pkg.(*Type).Method.func1.1} becomes {@code Method.func1.1};
   * {@code com.acme.Service.lambda$run$0} becomes {@code Service.lambda$run$0}; {@code com.acme.Service.run}
   * becomes {@code run}.</p>
   *
   * @param qualified qualified function name; {@code null} is treated as empty
   * @return display name
   */
  public static String shortName(String qualified) {
    if (qualified == null || qualified.isEmpty()) {
      return "";
    }
    String[] segments = qualified.split("\\.", -1);
    StringBuilder suffix = new StringBuilder();
    for (int i = segments.length - 1; i >= 0; i--) {
      String segment = segments[i];
      if (isSynthetic(segment)) {
        suffix.insert(0, segment).insert(0, '.');
        continue;
      }
      return segment + suffix;
    }
    // every segment was synthetic
    return suffix.length() > 0 ? suffix.substring(1) : qualified;
  }

  /**
   * Returns the final dotted component of {@code qualified}.
   */
  public static String lastSegment(String qualified) {
    if (qualified == null) {
      return "";
    }
    int dot = qualified.lastIndexOf('.');
    return dot < 0 ? qualified : qualified.substring(dot + 1);
  }

  private static boolean isSynthetic(String segment) {
    for (String marker : CLOSURE_MARKERS) {
      if (segment.startsWith(marker)) {
        return true;
      }
    }
    return isInteger(segment);
  }

  private static boolean isInteger(String segment) {
    int start = segment.startsWith("+") || segment.startsWith("-") ? 1 : 0;
    if (segment.length() <= start) {
      return false;
    }
    for (int i = start; i < segment.length(); i++) {
      char c = segment.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }
}
