/**
 * <strong>Purpose:</strong> Caller attribution: stack walking, function-name and path reduction.
 * <p><strong>Concurrency:</strong> Stateless or immutable; safe from any logging thread.
 * <p><strong>Observability:</strong> Logs at DEBUG through SLF4J when no frame can be attributed.
 *
 * @since 0.1.0
 */
package ca.gc.cra.devlog.infrastructure.caller;
