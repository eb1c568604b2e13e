package ca.gc.cra.devlog.infrastructure.buffer;

import java.util.ArrayDeque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Simple bounded pool of reusable {@link GrowableBuffer}s to minimize temporary allocations while rendering.
 *
 * <p>Borrow with try-with-resources so the buffer goes back exactly once, even when rendering fails early:</p>
 * <pre>{@code
 * try (BufferPool.PooledBuffer pooled = pool.acquire()) {
 *   GrowableBuffer buf = pooled.buffer();
 *   ...
 * }
 * }</pre>
 */
public final class BufferPool {
  private final int initialCapacity;
  private final int maxRetainedCapacity;
  private final int maxPoolSize;
  private final ArrayDeque<GrowableBuffer> pool;
  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Creates a buffer pool.
   *
   * @param initialCapacity capacity of freshly allocated buffers in bytes
   * @param maxRetainedCapacity buffers that grew beyond this many bytes are dropped instead of pooled
   * @param maxPoolSize maximum number of buffers kept in the pool
   */
  public BufferPool(int initialCapacity, int maxRetainedCapacity, int maxPoolSize) {
    if (initialCapacity <= 0) {
      throw new IllegalArgumentException("initialCapacity must be positive");
    }
    if (maxRetainedCapacity < initialCapacity) {
      throw new IllegalArgumentException("maxRetainedCapacity must be >= initialCapacity");
    }
    if (maxPoolSize <= 0) {
      throw new IllegalArgumentException("maxPoolSize must be positive");
    }
    this.initialCapacity = initialCapacity;
    this.maxRetainedCapacity = maxRetainedCapacity;
    this.maxPoolSize = maxPoolSize;
    this.pool = new ArrayDeque<>(maxPoolSize);
  }

  /**
   * Borrows a buffer from the pool, creating one when the pool is empty.
   *
   * @return pooled buffer wrapper ready for use; empty
   */
  public PooledBuffer acquire() {
    GrowableBuffer buffer;
    lock.lock();
    try {
      buffer = pool.pollFirst();
    } finally {
      lock.unlock();
    }
    if (buffer == null) {
      buffer = new GrowableBuffer(initialCapacity);
    }
    return new PooledBuffer(this, buffer);
  }

  /**
   * Returns the number of idle buffers currently held.
   */
  public int idleCount() {
    lock.lock();
    try {
      return pool.size();
    } finally {
      lock.unlock();
    }
  }

  void release(GrowableBuffer buffer) {
    buffer.clear();
    if (buffer.capacity() > maxRetainedCapacity) {
      return;
    }
    lock.lock();
    try {
      if (pool.size() < maxPoolSize) {
        pool.addFirst(buffer);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Encapsulates a borrowed buffer and returns it to the pool when closed.
   */
  public static final class PooledBuffer implements AutoCloseable {
    private final BufferPool owner;
    private GrowableBuffer buffer;

    private PooledBuffer(BufferPool owner, GrowableBuffer buffer) {
      this.owner = owner;
      this.buffer = buffer;
    }

    /**
     * Exposes the borrowed buffer; callers must not retain it after closing.
     *
     * @return active buffer
     * @throws IllegalStateException when already released
     */
    public GrowableBuffer buffer() {
      if (buffer == null) {
        throw new IllegalStateException("buffer already released");
      }
      return buffer;
    }

    /**
     * Clears the buffer and returns it to the pool; repeated calls do nothing.
     */
    @Override
    public void close() {
      if (buffer == null) {
        return;
      }
      GrowableBuffer released = buffer;
      buffer = null;
      owner.release(released);
    }
  }
}
