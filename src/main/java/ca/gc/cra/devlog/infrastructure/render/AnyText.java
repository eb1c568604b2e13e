package ca.gc.cra.devlog.infrastructure.render;

/**
 * Text form of an arbitrary object, with the object's own failures turned into a checked exception.
 *
 * @since 0.1.0
 */
public final class AnyText {
  private AnyText() {}

  /**
   * Returns {@code String.valueOf(value)}.
   *
   * @param value object to describe; may be {@code null}
   * @return text form
   * @throws ValueEncodingException when the object's {@code toString} throws
   */
  public static String format(Object value) throws ValueEncodingException {
    try {
      return String.valueOf(value);
    } catch (RuntimeException ex) {
      throw new ValueEncodingException("toString failed for " + value.getClass().getName(), ex);
    }
  }
}
