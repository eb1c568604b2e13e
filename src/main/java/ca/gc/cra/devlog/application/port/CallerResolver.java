package ca.gc.cra.devlog.application.port;

import ca.gc.cra.devlog.domain.CallSite;
import ca.gc.cra.devlog.domain.Source;
import java.util.Optional;

/**
 * <strong>What:</strong> Port turning stack information into a display {@link Source}.
 * <p><strong>Why:</strong> Stack introspection depends on the runtime; keeping it behind a port lets tests stub
 * attribution and lets adapters apply their own frame filters.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or immutable.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.devlog.infrastructure.caller.StackWalkerCallerResolver
 */
public interface CallerResolver {
  /**
   * Resolves a single captured frame.
   *
   * @param callSite frame captured at the log call
   * @return reduced source, or empty when the frame carries no file
   */
  Optional<Source> resolve(CallSite callSite);

  /**
   * Walks the current thread's stack and returns the first frame attributable to application code.
   *
   * @param skip frames to skip above the immediate caller of this method
   * @return source of the attributed frame, or empty when no frame qualifies
   */
  Optional<Source> resolve(int skip);
}
