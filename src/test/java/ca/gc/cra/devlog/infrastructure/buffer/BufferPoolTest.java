package ca.gc.cra.devlog.infrastructure.buffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class BufferPoolTest {

  @Test
  void releasedBufferIsResetAndReused() {
    BufferPool pool = new BufferPool(16, 1024, 2);
    GrowableBuffer first;
    try (BufferPool.PooledBuffer pooled = pool.acquire()) {
      first = pooled.buffer();
      first.writeString("payload");
    }
    assertEquals(1, pool.idleCount());

    try (BufferPool.PooledBuffer pooled = pool.acquire()) {
      assertSame(first, pooled.buffer());
      assertTrue(pooled.buffer().isEmpty());
    }
  }

  @Test
  void closeIsIdempotent() {
    BufferPool pool = new BufferPool(16, 1024, 4);
    BufferPool.PooledBuffer pooled = pool.acquire();
    pooled.close();
    pooled.close();

    assertEquals(1, pool.idleCount());
  }

  @Test
  void useAfterReleaseFails() {
    BufferPool pool = new BufferPool(16, 1024, 4);
    BufferPool.PooledBuffer pooled = pool.acquire();
    pooled.close();

    assertThrows(IllegalStateException.class, pooled::buffer);
  }

  @Test
  void oversizedBuffersAreDropped() {
    BufferPool pool = new BufferPool(16, 64, 4);
    try (BufferPool.PooledBuffer pooled = pool.acquire()) {
      pooled.buffer().writeString("x".repeat(500));
    }

    assertEquals(0, pool.idleCount());
  }

  @Test
  void poolSizeIsBounded() {
    BufferPool pool = new BufferPool(16, 1024, 2);
    BufferPool.PooledBuffer a = pool.acquire();
    BufferPool.PooledBuffer b = pool.acquire();
    BufferPool.PooledBuffer c = pool.acquire();
    a.close();
    b.close();
    c.close();

    assertEquals(2, pool.idleCount());
  }

  @Test
  void invalidSizingIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new BufferPool(0, 1024, 2));
    assertThrows(IllegalArgumentException.class, () -> new BufferPool(16, 1024, 0));
  }
}
