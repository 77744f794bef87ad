package com.consullo.frames.parse;

import com.consullo.frames.model.FrameTable;
import com.consullo.frames.model.SurfaceFlingerFrame;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for concatenated {@code dumpsys SurfaceFlinger --latency} output.
 *
 * <p>
 * Line shapes:
 * <ul>
 * <li>one integer: the display refresh period; sets the drop threshold to
 * {@code period * 1000} for the frames that follow.</li>
 * <li>three integers: desired present, actual present and frame ready time of
 * one frame.</li>
 * <li>the unresponsive marker: counted, otherwise ignored.</li>
 * </ul>
 * Anything else is logged and skipped. Frames are filtered by a
 * {@link MonotonicFrameFilter} keyed on the ready time, so the duplicates that
 * repeated latency dumps produce are dropped across the whole session.
 * </p>
 */
public final class SurfaceFlingerDumpParser implements DumpParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(SurfaceFlingerDumpParser.class);

  public static final String UNRESPONSIVE_MARKER = "SurfaceFlinger appears to be unresponsive, dumping anyways";

  private final MonotonicFrameFilter<SurfaceFlingerFrame> filter =
      new MonotonicFrameFilter<>(SurfaceFlingerFrame::frameReadyTime, this::isPlausible);

  private Long refreshPeriod;
  private Long dropThreshold;
  private int unresponsiveCount;
  private int accepted;
  private int dropped;

  @Override
  public ParseReport parse(Reader raw, FrameTable table) throws IOException {
    if (raw == null || table == null) {
      throw new IllegalArgumentException("raw/table must not be null.");
    }
    BufferedReader in = raw instanceof BufferedReader ? (BufferedReader) raw : new BufferedReader(raw);
    String line;
    while ((line = in.readLine()) != null) {
      line = line.strip();
      if (!line.isEmpty()) {
        processLine(line, table);
      }
    }
    return new ParseReport(accepted, dropped, unresponsiveCount);
  }

  public Long refreshPeriod() {
    return refreshPeriod;
  }

  public Long dropThreshold() {
    return dropThreshold;
  }

  private void processLine(String line, FrameTable table) {
    long[] values = parseTokens(line);
    if (values != null && values.length == 3) {
      SurfaceFlingerFrame frame = new SurfaceFlingerFrame(values[0], values[1], values[2]);
      MonotonicFrameFilter.Verdict verdict = filter.offer(frame);
      if (verdict == MonotonicFrameFilter.Verdict.ACCEPTED) {
        table.add(frame.toRow());
        accepted++;
        return;
      }
      if (verdict == MonotonicFrameFilter.Verdict.INVALID) {
        LOGGER.debug("Dropping bogus frame {}.", line);
      }
      dropped++;
    } else if (values != null && values.length == 1) {
      try {
        dropThreshold = Math.multiplyExact(values[0], 1000L);
        refreshPeriod = values[0];
      } catch (ArithmeticException e) {
        LOGGER.warn("Unexpected SurfaceFlinger dump output: {}", line);
      }
    } else if (line.contains(UNRESPONSIVE_MARKER)) {
      unresponsiveCount++;
    } else {
      LOGGER.warn("Unexpected SurfaceFlinger dump output: {}", line);
    }
  }

  private boolean isPlausible(SurfaceFlingerFrame frame) {
    // No refresh period seen yet means no frame can be judged.
    if (dropThreshold == null) {
      return false;
    }
    try {
      return frame.readyLatency() <= dropThreshold;
    } catch (ArithmeticException e) {
      return false;
    }
  }

  /**
   * Splits on whitespace and parses every token as a long.
   *
   * @return parsed values, or null if any token is not an integer
   */
  private static long[] parseTokens(String line) {
    String[] parts = line.split("\\s+");
    long[] values = new long[parts.length];
    for (int i = 0; i < parts.length; i++) {
      try {
        values[i] = Long.parseLong(parts[i]);
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return values;
  }
}
