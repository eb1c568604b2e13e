/**
 * <strong>Purpose:</strong> The logging facade applications call.
 * <p><strong>Concurrency:</strong> Loggers are immutable and shared freely.
 * <p><strong>Observability:</strong> Handler write failures are reported through SLF4J at WARN.
 *
 * @since 0.1.0
 */
package ca.gc.cra.devlog.application;
