package com.consullo.frames.parse;

import com.consullo.frames.model.FrameTable;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for concatenated {@code dumpsys gfxinfo <package> framestats} output.
 *
 * <p>
 * Frame data sits between pairs of {@value #PROFILEDATA_MARKER} lines. The
 * first line of each block repeats the column names and is skipped; every
 * following line up to the closing marker is one frame. Each line ends with a
 * trailing comma, so the last field is always dropped.
 * </p>
 *
 * <p>
 * Every dump holds the device's ring buffer of recent frames, so consecutive
 * dumps overlap. This parser keeps every row it reads; removing the overlap is
 * up to the consumer.
 * </p>
 */
public final class GfxinfoDumpParser implements DumpParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(GfxinfoDumpParser.class);

  public static final String PROFILEDATA_MARKER = "---PROFILEDATA---";

  private enum State {
    SEEK_BLOCK,
    HEADER,
    DATA
  }

  @Override
  public ParseReport parse(Reader raw, FrameTable table) throws IOException {
    if (raw == null || table == null) {
      throw new IllegalArgumentException("raw/table must not be null.");
    }
    BufferedReader in = raw instanceof BufferedReader ? (BufferedReader) raw : new BufferedReader(raw);

    boolean found = false;
    int accepted = 0;
    int dropped = 0;
    State state = State.SEEK_BLOCK;

    String line;
    while ((line = in.readLine()) != null) {
      boolean marker = line.startsWith(PROFILEDATA_MARKER);
      switch (state) {
        case SEEK_BLOCK:
          if (marker) {
            found = true;
            state = State.HEADER;
          }
          break;
        case HEADER:
          state = marker ? State.SEEK_BLOCK : State.DATA;
          break;
        case DATA:
          if (marker) {
            state = State.SEEK_BLOCK;
            break;
          }
          String row = line.strip();
          if (row.isEmpty()) {
            break;
          }
          long[] values = parseRow(row, table.header().size());
          if (values == null) {
            dropped++;
          } else {
            table.add(values);
            accepted++;
          }
          break;
        default:
          throw new IllegalStateException("Unhandled state " + state);
      }
    }

    if (!found) {
      LOGGER.warn("Could not find frames data in gfxinfo output");
    }
    return new ParseReport(accepted, dropped, 0);
  }

  private static long[] parseRow(String row, int width) {
    String[] fields = row.split(",", -1);
    int n = fields.length - 1;
    if (n != width) {
      LOGGER.warn("Dropping gfxinfo row with {} values, expected {}: {}", n, width, row);
      return null;
    }
    long[] values = new long[n];
    for (int i = 0; i < n; i++) {
      try {
        values[i] = Long.parseLong(fields[i].strip());
      } catch (NumberFormatException e) {
        LOGGER.warn("Dropping malformed gfxinfo row: {}", row);
        return null;
      }
    }
    return values;
  }
}
