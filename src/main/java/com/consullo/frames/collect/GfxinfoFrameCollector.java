package com.consullo.frames.collect;

import com.consullo.frames.parse.DumpParser;
import com.consullo.frames.parse.GfxinfoColumns;
import com.consullo.frames.parse.GfxinfoDumpParser;
import com.consullo.frames.remote.RemoteExecutionException;
import com.consullo.frames.remote.RemoteExecutor;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.util.List;

/**
 * Collects {@code dumpsys gfxinfo framestats} dumps for one application package.
 *
 * <p>Each tick appends one whole dump. The column header is read from the device when the collector is
 * created unless the caller already has it.
 *
 * @since 1.0
 */
public class GfxinfoFrameCollector extends FrameCollector {

  static final String FRAMESTATS_COMMAND = "dumpsys gfxinfo %s framestats";

  public GfxinfoFrameCollector(RemoteExecutor executor, FrameCollectorConfig config)
      throws RemoteExecutionException {
    this(executor, config, null);
  }

  /**
   * @param executor command channel to the device
   * @param config target package and sampling period
   * @param header framestats column names, or null to query them from the device
   * @throws RemoteExecutionException if the header has to be queried and the query fails
   */
  public GfxinfoFrameCollector(RemoteExecutor executor, FrameCollectorConfig config, List<String> header)
      throws RemoteExecutionException {
    super(executor, config, header != null ? header : GfxinfoColumns.read(executor));
  }

  @Override
  protected void collectOnce(OutputStream sink) throws RemoteExecutionException, IOException {
    String dump = executor.execute(String.format(FRAMESTATS_COMMAND, config.target()));
    sink.write(dump.getBytes(Charset.defaultCharset()));
  }

  @Override
  public void clear() {
    // gfxinfo rotates its own ring buffer.
  }

  @Override
  protected DumpParser newParser() {
    return new GfxinfoDumpParser();
  }
}
