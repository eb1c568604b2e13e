package ca.gc.cra.devlog.infrastructure.buffer;

/**
 * Central registry for shared {@link BufferPool} instances used by handlers.
 */
public final class BufferPools {
  private static final int LINE_BUFFER_BYTES = 1024;
  private static final int MAX_RETAINED_BYTES = 16 * 1024;
  private static final int MAX_POOL_ENTRIES = Math.max(4, Runtime.getRuntime().availableProcessors() * 2);

  private static final BufferPool LINE_POOL = new BufferPool(LINE_BUFFER_BYTES, MAX_RETAINED_BYTES, MAX_POOL_ENTRIES);

  private BufferPools() {}

  /**
   * Provides the shared pool sized for one rendered log line; safe for concurrent borrow and return.
   */
  public static BufferPool lineBuffers() {
    return LINE_POOL;
  }
}
