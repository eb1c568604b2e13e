/**
 * <strong>Purpose:</strong> Log record model shared by the facade, the handlers and the trace adapter.
 * <p><strong>Concurrency:</strong> Every type is immutable; records, attributes and contexts may be shared between
 * threads without locking.
 * <p><strong>Observability:</strong> Pure data; emits nothing itself.
 *
 * @since 0.1.0
 */
package ca.gc.cra.devlog.domain;
