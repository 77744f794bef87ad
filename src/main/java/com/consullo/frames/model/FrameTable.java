package com.consullo.frames.model;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, in-memory table of parsed frames sharing one header.
 *
 * <p>
 * Rows are kept in arrival order and every row has exactly as many values as
 * the header has columns. Export is total: the whole table is written in one
 * call as CSV with {@code \n} row terminators.
 * </p>
 */
public final class FrameTable {

  private final List<String> header;
  private final List<long[]> rows = new ArrayList<>();

  public FrameTable(List<String> header) {
    if (header == null) {
      throw new IllegalArgumentException("header must not be null.");
    }
    this.header = List.copyOf(header);
  }

  public List<String> header() {
    return header;
  }

  /**
   * Appends one row.
   *
   * @param row values in header order
   * @throws IllegalArgumentException if the row width differs from the header
   */
  public void add(long[] row) {
    if (row == null) {
      throw new IllegalArgumentException("row must not be null.");
    }
    if (row.length != header.size()) {
      throw new IllegalArgumentException(
          "Row has " + row.length + " values but header has " + header.size() + " columns " + header);
    }
    rows.add(row.clone());
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /**
   * Returns a copy of the row at the given index.
   *
   * @param index row index in arrival order
   * @return row values
   */
  public long[] row(int index) {
    return rows.get(index).clone();
  }

  /**
   * Writes the table to a file, replacing its contents.
   *
   * @param outfile destination file
   * @param columns columns to export in order, or null for the whole header
   * @throws IOException if the file cannot be written
   * @throws IllegalArgumentException if a requested column is not in the header
   */
  public void write(Path outfile, List<String> columns) throws IOException {
    if (outfile == null) {
      throw new IllegalArgumentException("outfile must not be null.");
    }
    int[] indexes = resolve(columns);
    try (BufferedWriter out = Files.newBufferedWriter(outfile, Charset.defaultCharset())) {
      writeRows(out, columns == null ? header : columns, indexes);
    }
  }

  /**
   * Writes the table to a character stream. The stream is flushed, not closed.
   *
   * @param out destination
   * @param columns columns to export in order, or null for the whole header
   * @throws IOException if writing fails
   * @throws IllegalArgumentException if a requested column is not in the header
   */
  public void write(Writer out, List<String> columns) throws IOException {
    if (out == null) {
      throw new IllegalArgumentException("out must not be null.");
    }
    int[] indexes = resolve(columns);
    writeRows(out, columns == null ? header : columns, indexes);
    out.flush();
  }

  private int[] resolve(List<String> columns) {
    if (columns == null) {
      int[] all = new int[header.size()];
      for (int i = 0; i < all.length; i++) {
        all[i] = i;
      }
      return all;
    }
    int[] indexes = new int[columns.size()];
    for (int i = 0; i < indexes.length; i++) {
      String c = columns.get(i);
      int ix = header.indexOf(c);
      if (ix < 0) {
        throw new IllegalArgumentException("Invalid column \"" + c + "\"; must be in " + header);
      }
      indexes[i] = ix;
    }
    return indexes;
  }

  private void writeRows(Writer out, List<String> names, int[] indexes) throws IOException {
    if (!names.isEmpty()) {
      out.write(String.join(",", names));
      out.write('\n');
    }
    StringBuilder line = new StringBuilder();
    for (long[] r : rows) {
      line.setLength(0);
      for (int i = 0; i < indexes.length; i++) {
        if (i > 0) {
          line.append(',');
        }
        line.append(r[indexes[i]]);
      }
      line.append('\n');
      out.write(line.toString());
    }
  }
}
