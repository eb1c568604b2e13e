package ca.gc.cra.devlog.domain;

/**
 * Signals that a {@link TextMarshaler} could not produce its text form.
 *
 * @since 0.1.0
 */
public class TextMarshalException extends Exception {
  private static final long serialVersionUID = 1L;

  public TextMarshalException(String message) {
    super(message);
  }

  public TextMarshalException(String message, Throwable cause) {
    super(message, cause);
  }
}
