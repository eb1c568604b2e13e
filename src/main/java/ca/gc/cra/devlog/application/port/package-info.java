/**
 * <strong>Purpose:</strong> Ports between the logging facade and its handler, caller and clock adapters.
 * <p><strong>Concurrency:</strong> Implementations must tolerate concurrent callers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.devlog.application.port;
