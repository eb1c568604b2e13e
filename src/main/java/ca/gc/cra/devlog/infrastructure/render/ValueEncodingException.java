package ca.gc.cra.devlog.infrastructure.render;

/**
 * Raised when an arbitrary attribute value cannot be turned into text.
 *
 * @since 0.1.0
 */
public class ValueEncodingException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception wrapping the failure raised by the value itself.
   *
   * @param message description
   * @param cause failure thrown while formatting; never {@code null}
   */
  public ValueEncodingException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Reports whether the value failed by dereferencing {@code null}.
   */
  public boolean causedByNull() {
    return getCause() instanceof NullPointerException;
  }
}
