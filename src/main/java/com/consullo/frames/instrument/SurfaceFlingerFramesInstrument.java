package com.consullo.frames.instrument;

import com.consullo.frames.collect.FrameCollector;
import com.consullo.frames.collect.FrameCollectorConfig;
import com.consullo.frames.collect.SurfaceFlingerFrameCollector;
import com.consullo.frames.model.SurfaceFlingerFrame;
import com.consullo.frames.remote.RemoteExecutionException;
import com.consullo.frames.remote.RemoteExecutor;
import java.time.Duration;
import java.util.List;

/**
 * Frames instrument over SurfaceFlinger latency dumps of one view.
 *
 * <p>Channels are the three latency fields without their {@code _time} suffix:
 * {@code desired_present}, {@code actual_present} and {@code frame_ready}.
 *
 * @since 1.0
 */
public final class SurfaceFlingerFramesInstrument extends FramesInstrument {

  private static final String TIME_SUFFIX = "_time";

  public SurfaceFlingerFramesInstrument(RemoteExecutor executor, String view) throws RemoteExecutionException {
    this(executor, view, DEFAULT_PERIOD, true);
  }

  public SurfaceFlingerFramesInstrument(RemoteExecutor executor, String view, Duration period, boolean keepRaw)
      throws RemoteExecutionException {
    super(executor, view, period, keepRaw);
  }

  @Override
  protected void initChannels() {
    for (String field : SurfaceFlingerFrame.FIELDS) {
      addChannel(field.substring(0, field.length() - TIME_SUFFIX.length()), InstrumentChannel.TIME_US);
    }
  }

  @Override
  protected FrameCollector newCollector(FrameCollectorConfig config, List<String> header) {
    return new SurfaceFlingerFrameCollector(executor, config, header);
  }
}
