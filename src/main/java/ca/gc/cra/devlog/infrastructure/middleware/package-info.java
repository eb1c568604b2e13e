/**
 * Record handler decorators.
 *
 * @since 0.1.0
 */
package ca.gc.cra.devlog.infrastructure.middleware;
