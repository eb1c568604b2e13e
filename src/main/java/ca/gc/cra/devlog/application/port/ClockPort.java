package ca.gc.cra.devlog.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock instants to the logging facade and the SQL trace adapter.
 * <p><strong>Why:</strong> Record timestamps and trace durations become deterministic under test.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; clock reads happen on every logging
 * thread.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @implNote Default implementation delegates to {@link Instant#now()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return current wall-clock time; subject to system clock adjustments
   */
  Instant now();

  /**
   * Default {@link ClockPort} using {@link Instant#now()}.
   */
  ClockPort SYSTEM = Instant::now;
}
