package com.consullo.frames.extract;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.NoSuchElementException;

/**
 * Reads a file backwards in fixed-size chunks, starting at the end.
 *
 * <p>Each chunk is returned in file order; the chunk nearest the start of the file may be shorter than the
 * chunk size. Only one chunk is held at a time.
 *
 * @since 1.0
 */
public final class ReverseChunkReader implements AutoCloseable {

  private final FileChannel channel;
  private final int chunkSize;

  // Bytes [0, position) have not been returned yet.
  private long position;

  public ReverseChunkReader(final Path file, final int chunkSize) throws IOException {
    if (file == null) {
      throw new IllegalArgumentException("file must not be null.");
    }
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive.");
    }
    this.channel = FileChannel.open(file, StandardOpenOption.READ);
    this.chunkSize = chunkSize;
    this.position = channel.size();
  }

  public boolean hasMore() {
    return position > 0;
  }

  /**
   * Returns the chunk that ends where the previous one started.
   *
   * @return chunk bytes in file order
   * @throws IOException if reading fails
   * @throws NoSuchElementException if the start of the file has been reached
   */
  public byte[] nextChunkFromEnd() throws IOException {
    if (!hasMore()) {
      throw new NoSuchElementException("Start of file reached");
    }
    int length = (int) Math.min(chunkSize, position);
    long start = position - length;
    ByteBuffer buffer = ByteBuffer.allocate(length);
    while (buffer.hasRemaining()) {
      int n = channel.read(buffer, start + buffer.position());
      if (n < 0) {
        throw new EOFException("File shrank while reading backwards at offset " + (start + buffer.position()));
      }
    }
    position = start;
    return buffer.array();
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }
}
