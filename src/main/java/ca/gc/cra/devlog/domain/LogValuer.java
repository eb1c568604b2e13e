package ca.gc.cra.devlog.domain;

/**
 * Implemented by types that decide their own logged representation.
 *
 * <p>Handlers call {@link #logValue()} lazily, only when a record carrying the value is actually rendered,
 * so expensive representations cost nothing for disabled levels.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LogValuer {
  /**
   * Returns the value to log in place of this object.
   *
   * @return replacement value; may itself be a {@link LogValuer}
   */
  Value logValue();
}
