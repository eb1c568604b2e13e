/**
 * <strong>Purpose:</strong> JSON-lines record handler built on jackson-core streaming.
 * <p><strong>Concurrency:</strong> Same single-lock write model as the text handler.
 *
 * @since 0.1.0
 */
package ca.gc.cra.devlog.infrastructure.json;
