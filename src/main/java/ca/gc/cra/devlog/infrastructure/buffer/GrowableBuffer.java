package ca.gc.cra.devlog.infrastructure.buffer;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Expandable byte buffer backed by a single array with a manual write index.
 * <p>Supports amortized O(1) append operations with exponential growth. Handlers assemble one rendered record
 * here and hand the filled region to the sink in a single write.
 */
public final class GrowableBuffer {
  private static final int DEFAULT_CAPACITY = 1024;
  private static final int MAX_CAPACITY = 32 * 1024 * 1024; // 32 MiB safety guard

  private byte[] data;
  private int writeIndex;

  /**
   * Creates a buffer using the default initial capacity.
   */
  public GrowableBuffer() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a buffer with a caller-supplied initial capacity.
   *
   * @param initialCapacity minimum backing array size
   * @throws IllegalArgumentException when {@code initialCapacity} is not positive
   */
  public GrowableBuffer(int initialCapacity) {
    if (initialCapacity <= 0) {
      throw new IllegalArgumentException("initialCapacity must be positive");
    }
    data = new byte[Math.min(MAX_CAPACITY, align(initialCapacity))];
    writeIndex = 0;
  }

  /**
   * Appends a single byte into the buffer.
   */
  public void writeByte(int value) {
    ensureWritable(1);
    data[writeIndex++] = (byte) value;
  }

  /**
   * Appends the provided bytes into the buffer, growing it if required.
   *
   * @param src source array; must not be {@code null}
   */
  public void write(byte[] src) {
    Objects.requireNonNull(src, "src");
    write(src, 0, src.length);
  }

  /**
   * Appends a region of the provided array into the buffer, growing it if required.
   *
   * @param src source array; must not be {@code null}
   * @param offset starting offset within {@code src}
   * @param length number of bytes to append
   */
  public void write(byte[] src, int offset, int length) {
    Objects.requireNonNull(src, "src");
    if (length <= 0) {
      return;
    }
    if (offset < 0 || offset + length > src.length) {
      throw new IndexOutOfBoundsException("invalid offset/length");
    }
    ensureWritable(length);
    System.arraycopy(src, offset, data, writeIndex, length);
    writeIndex += length;
  }

  /**
   * Appends the UTF-8 encoding of {@code value}.
   *
   * <p>ASCII text is copied char by char; the first non-ASCII char switches to the JDK encoder for the rest.</p>
   */
  public void writeString(String value) {
    int length = value.length();
    ensureWritable(length);
    for (int i = 0; i < length; i++) {
      char c = value.charAt(i);
      if (c >= 0x80) {
        byte[] rest = value.substring(i).getBytes(StandardCharsets.UTF_8);
        write(rest, 0, rest.length);
        return;
      }
      data[writeIndex++] = (byte) c;
    }
  }

  /**
   * Appends the base-10 text of {@code value}.
   */
  public void writeLong(long value) {
    writeString(Long.toString(value));
  }

  /**
   * Overwrites the last written byte.
   *
   * @throws IllegalStateException when the buffer is empty
   */
  public void setLastByte(int value) {
    if (writeIndex == 0) {
      throw new IllegalStateException("buffer is empty");
    }
    data[writeIndex - 1] = (byte) value;
  }

  /**
   * Returns the number of readable bytes.
   */
  public int readableBytes() {
    return writeIndex;
  }

  public boolean isEmpty() {
    return writeIndex == 0;
  }

  /**
   * Returns the size of the backing array.
   */
  public int capacity() {
    return data.length;
  }

  /**
   * Copies all readable bytes into a freshly allocated array.
   */
  public byte[] toByteArray() {
    byte[] out = new byte[writeIndex];
    System.arraycopy(data, 0, out, 0, writeIndex);
    return out;
  }

  /**
   * Writes all readable bytes to {@code out} in one call.
   *
   * @throws IOException when the stream rejects the write
   */
  public void writeTo(OutputStream out) throws IOException {
    out.write(data, 0, writeIndex);
  }

  /**
   * Returns an {@link OutputStream} view appending to this buffer; closing it has no effect.
   */
  public OutputStream asOutputStream() {
    return new OutputStream() {
      @Override
      public void write(int b) {
        writeByte(b);
      }

      @Override
      public void write(byte[] b, int off, int len) {
        GrowableBuffer.this.write(b, off, len);
      }
    };
  }

  /**
   * Ensures at least {@code minWritableBytes} bytes can be appended without reallocating.
   */
  public void ensureWritable(int minWritableBytes) {
    if (minWritableBytes <= 0) {
      return;
    }
    int writable = data.length - writeIndex;
    if (writable >= minWritableBytes) {
      return;
    }
    int required = writeIndex + minWritableBytes;
    int newCapacity = data.length;
    while (newCapacity < required && newCapacity < MAX_CAPACITY) {
      newCapacity <<= 1;
    }
    if (newCapacity < required) {
      newCapacity = required;
    }
    if (newCapacity > MAX_CAPACITY) {
      throw new IllegalStateException("buffer would exceed max capacity: " + newCapacity);
    }
    byte[] next = new byte[newCapacity];
    System.arraycopy(data, 0, next, 0, writeIndex);
    data = next;
  }

  /**
   * Clears the buffer content without shrinking its capacity.
   */
  public void clear() {
    writeIndex = 0;
  }

  @Override
  public String toString() {
    return new String(data, 0, writeIndex, StandardCharsets.UTF_8);
  }

  private static int align(int value) {
    int n = 1;
    while (n < value) {
      n <<= 1;
    }
    return n;
  }
}
