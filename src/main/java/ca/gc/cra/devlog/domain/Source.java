package ca.gc.cra.devlog.domain;

/**
 * <strong>What:</strong> Resolved origin of a log record.
 * <p><strong>Role:</strong> Produced by caller resolution from a {@link CallSite}, or supplied explicitly through
 * {@link LogContext#withSource(Source)} when an adapter has already attributed the call.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param function display name of the calling function
 * @param file file path, normally reduced to {@code parentDir/File.java}
 * @param line line number; {@code 0} when unknown
 * @since 0.1.0
 */
public record Source(String function, String file, int line) {
  public Source {
    function = function == null ? "" : function;
    file = file == null ? "" : file;
  }

  @Override
  public String toString() {
    return line == 0 ? file + " " + function : file + ":" + line + " " + function;
  }
}
