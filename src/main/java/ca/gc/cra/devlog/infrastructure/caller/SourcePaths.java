package ca.gc.cra.devlog.infrastructure.caller;

/**
 * Reduces source paths to {@code parentDir/File.java}.
 *
 * @since 0.1.0
 */
public final class SourcePaths {
  private SourcePaths() {}

  /**
   * Keeps the file name and the base name of its parent directory, discarding the rest of the path.
   * Backslashes are treated as separators.
   *
   * @param path file path; {@code null} is treated as empty
   * @return reduced path, e.g. {@code orders/OrderService.java}; the bare file name when there is no directory
   */
  public static String shortFile(String path) {
    if (path == null || path.isEmpty()) {
      return "";
    }
    String normalized = path.replace('\\', '/');
    int slash = normalized.lastIndexOf('/');
    if (slash < 0) {
      return normalized;
    }
    String file = normalized.substring(slash + 1);
    int end = slash;
    while (end > 0 && normalized.charAt(end - 1) == '/') {
      end--;
    }
    if (end == 0) {
      return "/" + file;
    }
    String dir = normalized.substring(0, end);
    String base = dir.substring(dir.lastIndexOf('/') + 1);
    return base + "/" + file;
  }
}
