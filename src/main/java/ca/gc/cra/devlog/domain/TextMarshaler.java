package ca.gc.cra.devlog.domain;

/**
 * Implemented by values that provide a dedicated text form for logging.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TextMarshaler {
  /**
   * Produces the text form of this value.
   *
   * @return text representation; never {@code null}
   * @throws TextMarshalException when the value cannot be represented; the text renderer then omits the value and
   *     the JSON handler writes {@code "!ERROR:<msg>"}
   */
  String marshalText() throws TextMarshalException;
}
