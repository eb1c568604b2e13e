package ca.gc.cra.devlog.domain;

/**
 * Discriminates the payload carried by a {@link Value}.
 *
 * @since 0.1.0
 */
public enum ValueKind {
  STRING,
  INT64,
  UINT64,
  FLOAT64,
  BOOL,
  DURATION,
  TIME,
  GROUP,
  ANY
}
