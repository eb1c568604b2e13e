/**
 * <strong>Purpose:</strong> Colorized text rendering: palette, quoting, compact number and duration forms, the value
 * encoder and {@link ca.gc.cra.devlog.infrastructure.render.DevHandler}.
 * <p><strong>Concurrency:</strong> Encoders are immutable; handlers serialize sink writes behind one lock per handler
 * family.
 * <p><strong>Performance:</strong> Lines are assembled in pooled buffers and written with a single call.
 *
 * @since 0.1.0
 */
package ca.gc.cra.devlog.infrastructure.render;
