package com.consullo.frames.instrument;

import com.consullo.frames.collect.FrameCollector;
import com.consullo.frames.collect.FrameCollectorConfig;
import com.consullo.frames.collect.GfxinfoFrameCollector;
import com.consullo.frames.parse.GfxinfoColumns;
import com.consullo.frames.remote.RemoteExecutionException;
import com.consullo.frames.remote.RemoteExecutor;
import java.time.Duration;
import java.util.List;

/**
 * Frames instrument over {@code dumpsys gfxinfo framestats} of one package.
 *
 * <p>Channels are the framestats columns reported by the device. {@code Flags} is a bit field; every other
 * column is a timestamp.
 *
 * @since 1.0
 */
public final class GfxinfoFramesInstrument extends FramesInstrument {

  static final String FLAGS_COLUMN = "Flags";

  public GfxinfoFramesInstrument(RemoteExecutor executor, String packageName) throws RemoteExecutionException {
    this(executor, packageName, DEFAULT_PERIOD, true);
  }

  public GfxinfoFramesInstrument(RemoteExecutor executor, String packageName, Duration period, boolean keepRaw)
      throws RemoteExecutionException {
    super(executor, packageName, period, keepRaw);
  }

  @Override
  protected void initChannels() throws RemoteExecutionException {
    for (String column : GfxinfoColumns.read(executor)) {
      if (FLAGS_COLUMN.equals(column)) {
        addChannel(column, InstrumentChannel.FLAGS);
      } else {
        addChannel(column, InstrumentChannel.TIME_US);
      }
    }
  }

  @Override
  protected FrameCollector newCollector(FrameCollectorConfig config, List<String> header)
      throws RemoteExecutionException {
    return new GfxinfoFrameCollector(executor, config, header);
  }
}
