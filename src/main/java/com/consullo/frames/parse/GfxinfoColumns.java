package com.consullo.frames.parse;

import com.consullo.frames.remote.RemoteExecutionException;
import com.consullo.frames.remote.RemoteExecutor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers the framestats column names a device reports.
 *
 * @since 1.0
 */
public final class GfxinfoColumns {

  private static final Logger LOGGER = LoggerFactory.getLogger(GfxinfoColumns.class);

  public static final String LIST_COLUMNS_COMMAND = "dumpsys gfxinfo --list framestats";

  private GfxinfoColumns() {
  }

  /**
   * Queries the device for its framestats columns.
   *
   * @param executor command channel to the device
   * @return column names, empty if the output has no profile data
   * @throws RemoteExecutionException if the query fails
   */
  public static List<String> read(RemoteExecutor executor) throws RemoteExecutionException {
    if (executor == null) {
      throw new IllegalArgumentException("executor must not be null.");
    }
    return parse(executor.execute(LIST_COLUMNS_COMMAND));
  }

  /**
   * Extracts the column names from {@code --list framestats} output: the line after the first
   * profile-data marker, without its trailing empty field.
   *
   * @param output command output
   * @return column names, empty if no marker or header line is present
   */
  public static List<String> parse(String output) {
    String[] lines = output.replace("\r\n", "\n").replace('\r', '\n').split("\n");
    for (int i = 0; i < lines.length; i++) {
      if (lines[i].startsWith(GfxinfoDumpParser.PROFILEDATA_MARKER)) {
        if (i + 1 >= lines.length) {
          break;
        }
        String[] fields = lines[i + 1].strip().split(",", -1);
        List<String> columns = new ArrayList<>(Arrays.asList(fields).subList(0, fields.length - 1));
        LOGGER.debug("gfxinfo columns: {}", columns);
        return columns;
      }
    }
    LOGGER.warn("Could not find framestats columns in gfxinfo output");
    return List.of();
  }
}
