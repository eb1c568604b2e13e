/**
 * <strong>Purpose:</strong> Handler options and their YAML loading.
 * <p><strong>Concurrency:</strong> Options are immutable; safe to share.
 * <p><strong>Security:</strong> Context key names are validated through {@code ca.gc.cra.devlog.validation}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.devlog.config;
