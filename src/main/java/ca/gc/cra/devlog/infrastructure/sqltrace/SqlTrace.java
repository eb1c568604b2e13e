package ca.gc.cra.devlog.infrastructure.sqltrace;

/**
 * Result of an executed statement as reported by the data-access layer.
 *
 * @param sql statement text, usually with bound values inlined
 * @param rows affected or returned rows; {@code -1} when unknown
 * @since 0.1.0
 */
public record SqlTrace(String sql, long rows) {
  public SqlTrace {
    sql = sql == null ? "" : sql;
  }
}
