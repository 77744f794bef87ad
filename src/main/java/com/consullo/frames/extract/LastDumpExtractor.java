package com.consullo.frames.extract;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers the last gfxinfo dump from a raw capture holding many of them.
 *
 * <p>
 * Every gfxinfo dump opens with a {@code ** Graphics info for pid ... **} line.
 * The file is scanned backwards chunk by chunk until the last such line is
 * found; only the chunks after it are kept, so memory stays proportional to the
 * size of one dump rather than the whole capture.
 * </p>
 */
public final class LastDumpExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(LastDumpExtractor.class);

  public static final int DEFAULT_CHUNK_SIZE = 1024;

  static final byte[] DUMP_START = "** Graphics".getBytes(StandardCharsets.US_ASCII);
  static final byte[] HEADER_END = " **\n".getBytes(StandardCharsets.US_ASCII);

  private final int chunkSize;

  public LastDumpExtractor() {
    this(DEFAULT_CHUNK_SIZE);
  }

  public LastDumpExtractor(int chunkSize) {
    if (chunkSize < DUMP_START.length) {
      throw new IllegalArgumentException("chunkSize must be at least " + DUMP_START.length);
    }
    this.chunkSize = chunkSize;
  }

  /**
   * Returns the text from the last dump start line to the end of the file.
   *
   * @param file raw gfxinfo capture
   * @return the last dump, or empty if the file holds none
   * @throws IOException if the file cannot be read
   * @throws IllegalStateException if a dump header line is cut off from its start marker
   */
  public Optional<String> extractLast(Path file) throws IOException {
    Deque<byte[]> tail = new ArrayDeque<>();
    try (ReverseChunkReader reader = new ReverseChunkReader(file, chunkSize)) {
      while (reader.hasMore()) {
        byte[] chunk = reader.nextChunkFromEnd();

        int ix = lastStartIn(chunk, tail.peekFirst());
        if (ix >= 0) {
          return Optional.of(assemble(chunk, ix, tail));
        }

        if (indexOf(chunk, HEADER_END) >= 0) {
          if (!reader.hasMore()) {
            break;
          }
          byte[] combined = concat(reader.nextChunkFromEnd(), chunk);
          ix = lastStartIn(combined, tail.peekFirst());
          if (ix < 0) {
            throw new IllegalStateException("\"" + file + "\" appears to be corrupted");
          }
          return Optional.of(assemble(combined, ix, tail));
        }

        tail.addFirst(chunk);
      }
    }
    LOGGER.debug("No gfxinfo dump found in {}", file);
    return Optional.empty();
  }

  /**
   * Finds the last start marker that begins inside {@code chunk}, including one that runs on into the
   * first bytes of {@code next}.
   */
  private static int lastStartIn(byte[] chunk, byte[] next) {
    byte[] window = chunk;
    if (next != null) {
      int overlap = Math.min(next.length, DUMP_START.length - 1);
      window = new byte[chunk.length + overlap];
      System.arraycopy(chunk, 0, window, 0, chunk.length);
      System.arraycopy(next, 0, window, chunk.length, overlap);
    }
    for (int i = Math.min(chunk.length - 1, window.length - DUMP_START.length); i >= 0; i--) {
      if (matchesAt(window, i, DUMP_START)) {
        return i;
      }
    }
    return -1;
  }

  private static int indexOf(byte[] data, byte[] pattern) {
    for (int i = 0; i <= data.length - pattern.length; i++) {
      if (matchesAt(data, i, pattern)) {
        return i;
      }
    }
    return -1;
  }

  private static boolean matchesAt(byte[] data, int offset, byte[] pattern) {
    for (int j = 0; j < pattern.length; j++) {
      if (data[offset + j] != pattern[j]) {
        return false;
      }
    }
    return true;
  }

  private static byte[] concat(byte[] a, byte[] b) {
    byte[] out = new byte[a.length + b.length];
    System.arraycopy(a, 0, out, 0, a.length);
    System.arraycopy(b, 0, out, a.length, b.length);
    return out;
  }

  private static String assemble(byte[] head, int from, Deque<byte[]> tail) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.write(head, from, head.length - from);
    for (byte[] chunk : tail) {
      out.write(chunk, 0, chunk.length);
    }
    return out.toString(Charset.defaultCharset());
  }
}
