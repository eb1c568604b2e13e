/**
 * Buffer pooling utilities backing record rendering.
 * <p><strong>Role:</strong> Infrastructure adapters providing reusable byte buffers to handlers.</p>
 * <p><strong>Concurrency:</strong> Pools use a lock around a deque; a borrowed buffer belongs to one thread until
 * it is closed.</p>
 * <p><strong>Performance:</strong> Avoids per-record allocations by recycling buffers; oversized buffers are not
 * retained.</p>
 */
package ca.gc.cra.devlog.infrastructure.buffer;
