/**
 * <strong>Purpose:</strong> Adapter from data-access statement tracing hooks to structured log records.
 * <p><strong>Observability:</strong> Each statement becomes one record whose context carries the SQL text, row
 * count, elapsed time and the application frame that issued it.
 *
 * @since 0.1.0
 */
package ca.gc.cra.devlog.infrastructure.sqltrace;
