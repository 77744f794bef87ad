package com.consullo.frames.parse;

import com.consullo.frames.model.FrameTable;
import java.io.IOException;
import java.io.Reader;

/**
 * Turns the raw text accumulated by a frame collector into validated table rows.
 *
 * <p>A parser instance holds the state of one collection session (refresh period, watermark) and is
 * meant to be used for a single {@link #parse} call. Malformed records are logged and dropped; they
 * never fail the parse.
 *
 * @since 1.0
 */
public interface DumpParser {

  /**
   * Parses the raw capture and appends accepted frames to the table in file order.
   *
   * @param raw raw capture text; {@code \n}, {@code \r\n} and {@code \r} all end a line
   * @param table destination table, whose header matches the frames this parser produces
   * @return counts describing what was accepted and dropped
   * @throws IOException if reading the raw capture fails
   */
  ParseReport parse(final Reader raw, final FrameTable table) throws IOException;
}
