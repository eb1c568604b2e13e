/**
 * Bootstrap entry points: standard handler stacks and the optional process default logger.
 * <p><strong>Concurrency:</strong> Default installation is atomic and one-time.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.devlog.api;
