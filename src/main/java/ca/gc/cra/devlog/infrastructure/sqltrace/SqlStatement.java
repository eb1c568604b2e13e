package ca.gc.cra.devlog.infrastructure.sqltrace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Statement text with its bind parameters, as passed through {@link SqlTraceLogger#paramsFilter}.
 *
 * @param sql statement text with placeholders
 * @param params bind parameters in placeholder order; may contain {@code null}
 * @since 0.1.0
 */
public record SqlStatement(String sql, List<Object> params) {
  public SqlStatement {
    sql = sql == null ? "" : sql;
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }
}
