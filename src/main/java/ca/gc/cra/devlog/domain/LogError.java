package ca.gc.cra.devlog.domain;

import java.util.Objects;

/**
 * Marks an attribute value as an error so handlers render it on the dedicated error path.
 *
 * @param cause wrapped failure; never {@code null}
 * @since 0.1.0
 */
public record LogError(Throwable cause) {
  public LogError {
    Objects.requireNonNull(cause, "cause");
  }

  /**
   * Returns the throwable's message, or its class name when it carries none.
   */
  public String message() {
    String message = cause.getMessage();
    return message != null ? message : cause.getClass().getName();
  }

  @Override
  public String toString() {
    return message();
  }
}
