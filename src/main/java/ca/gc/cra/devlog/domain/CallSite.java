package ca.gc.cra.devlog.domain;

/**
 * <strong>What:</strong> Stack frame captured where a log call was made.
 * <p><strong>Why:</strong> Capturing the raw frame is cheap; turning it into a display {@link Source} is deferred
 * to handlers that actually render source information.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param className fully qualified declaring class name
 * @param methodName method name as reported by the JVM (lambdas appear as {@code lambda$outer$0})
 * @param fileName source file name without directories; empty when the class was compiled without it
 * @param lineNumber line number; non-positive when unknown
 * @since 0.1.0
 */
public record CallSite(String className, String methodName, String fileName, int lineNumber) {
  public CallSite {
    className = className == null ? "" : className;
    methodName = methodName == null ? "" : methodName;
    fileName = fileName == null ? "" : fileName;
  }

  /**
   * Builds a call site from a stack walker frame.
   *
   * @param frame captured frame; must not be {@code null}
   * @return call site
   */
  public static CallSite of(StackWalker.StackFrame frame) {
    return new CallSite(frame.getClassName(), frame.getMethodName(), frame.getFileName(), frame.getLineNumber());
  }

  /**
   * Builds a call site from a stack trace element.
   *
   * @param element stack trace element; must not be {@code null}
   * @return call site
   */
  public static CallSite of(StackTraceElement element) {
    return new CallSite(element.getClassName(), element.getMethodName(), element.getFileName(),
        element.getLineNumber());
  }

  /**
   * Reports whether the frame carries a source file.
   */
  public boolean hasFile() {
    return !fileName.isEmpty();
  }

  /**
   * Returns {@code className.methodName}, with nested class separators turned into dots.
   */
  public String qualifiedFunction() {
    return className.replace('$', '.') + "." + methodName;
  }

  /**
   * Returns the file path implied by the package, e.g. {@code com/acme/orders/OrderService.java}.
   */
  public String filePath() {
    int lastDot = className.lastIndexOf('.');
    if (lastDot < 0 || fileName.isEmpty()) {
      return fileName;
    }
    return className.substring(0, lastDot).replace('.', '/') + "/" + fileName;
  }
}
