/**
 * <strong>Purpose:</strong> Control of devlog's own SLF4J diagnostics.
 * <p><strong>Observability:</strong> Coordinates with Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.devlog.logging;
