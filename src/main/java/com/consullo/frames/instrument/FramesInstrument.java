package com.consullo.frames.instrument;

import com.consullo.frames.collect.CollectorState;
import com.consullo.frames.collect.FrameCollector;
import com.consullo.frames.collect.FrameCollectorConfig;
import com.consullo.frames.remote.RemoteExecutionException;
import com.consullo.frames.remote.RemoteExecutor;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Continuous instrument that records frame timings through a {@link FrameCollector}.
 *
 * <p>
 * Typical use:
 * <pre>
 * instrument.reset(List.of("Vsync", "FrameCompleted"));
 * instrument.start();
 * // ... exercise the application ...
 * instrument.stop();
 * FramesMeasurement m = instrument.getData(outfile);
 * </pre>
 * {@link #start()} resets on its own when needed, so each start begins a fresh
 * session with a new collector.
 * </p>
 */
public abstract class FramesInstrument {

  private static final Logger LOGGER = LoggerFactory.getLogger(FramesInstrument.class);

  public static final Duration DEFAULT_PERIOD = Duration.ofSeconds(2);

  protected final RemoteExecutor executor;
  private final String collectorTarget;
  private final Duration period;
  private final boolean keepRaw;

  private final Map<String, InstrumentChannel> channels = new LinkedHashMap<>();
  private List<InstrumentChannel> activeChannels = List.of();

  private FrameCollector collector;
  private boolean needReset = true;
  private Path rawFile;

  /**
   * @param executor command channel to the device
   * @param collectorTarget view name or package handed to the collector
   * @param period time between dumps
   * @param keepRaw keep the raw capture next to the exported CSV
   * @throws RemoteExecutionException if channel discovery needs the device and fails
   */
  protected FramesInstrument(RemoteExecutor executor, String collectorTarget, Duration period, boolean keepRaw)
      throws RemoteExecutionException {
    if (executor == null) {
      throw new IllegalArgumentException("executor must not be null.");
    }
    if (collectorTarget == null || collectorTarget.isBlank()) {
      throw new IllegalArgumentException("collectorTarget must not be blank.");
    }
    if (period == null || period.isNegative() || period.isZero()) {
      throw new IllegalArgumentException("period must be positive.");
    }
    this.executor = executor;
    this.collectorTarget = collectorTarget;
    this.period = period;
    this.keepRaw = keepRaw;
    initChannels();
    this.activeChannels = List.copyOf(channels.values());
  }

  /**
   * Registers the channels this instrument can record, in collector header order.
   *
   * @throws RemoteExecutionException if the device has to be queried and the query fails
   */
  protected abstract void initChannels() throws RemoteExecutionException;

  /**
   * Creates the collector for a new session.
   *
   * @param config target and period
   * @param header column names for the collector, one per channel
   * @return collector
   * @throws RemoteExecutionException if the collector needs the device and the query fails
   */
  protected abstract FrameCollector newCollector(FrameCollectorConfig config, List<String> header)
      throws RemoteExecutionException;

  protected void addChannel(String label, String kind) {
    channels.put(label, new InstrumentChannel(label, kind));
  }

  /**
   * Prepares a fresh session recording the given channels.
   *
   * @param channelLabels labels to record, or null for every channel
   * @throws RemoteExecutionException if creating the collector fails
   * @throws IOException if the previous session's raw file cannot be removed
   * @throws IllegalArgumentException if a label is not a channel of this instrument
   * @throws IllegalStateException if a session is running
   */
  public void reset(List<String> channelLabels) throws RemoteExecutionException, IOException {
    if (collector != null) {
      if (collector.state() == CollectorState.RUNNING) {
        throw new IllegalStateException("Attempting to reset " + getClass().getSimpleName() + " while running");
      }
      collector.reset();
    }

    if (channelLabels == null) {
      activeChannels = List.copyOf(channels.values());
    } else {
      List<InstrumentChannel> selected = new ArrayList<>(channelLabels.size());
      for (String label : channelLabels) {
        InstrumentChannel channel = channels.get(label);
        if (channel == null) {
          throw new IllegalArgumentException("Unknown channel \"" + label + "\"; must be in " + channels.keySet());
        }
        selected.add(channel);
      }
      activeChannels = List.copyOf(selected);
    }

    collector = newCollector(FrameCollectorConfig.of(collectorTarget, period), new ArrayList<>(channels.keySet()));
    needReset = false;
    rawFile = null;
    LOGGER.debug("{} reset with channels {}", getClass().getSimpleName(), activeLabels());
  }

  public void start() throws RemoteExecutionException, IOException {
    if (needReset) {
      reset(labels(activeChannels));
    }
    collector.start();
  }

  public void stop() throws RemoteExecutionException, InterruptedException {
    if (collector == null) {
      throw new IllegalStateException("Attempting to stop " + getClass().getSimpleName() + " before starting it");
    }
    needReset = true;
    collector.stop();
  }

  /**
   * Processes the session and exports the active channels as CSV.
   *
   * @param outfile CSV destination; with keepRaw the raw capture is kept as {@code <outfile>.raw}
   * @return exported measurement
   * @throws IOException if the raw capture or the CSV cannot be accessed
   * @throws IllegalStateException if no stopped session is available
   */
  public FramesMeasurement getData(Path outfile) throws IOException {
    if (collector == null) {
      throw new IllegalStateException("Attempting to get data before running " + getClass().getSimpleName());
    }
    rawFile = keepRaw ? outfile.resolveSibling(outfile.getFileName() + ".raw") : null;
    collector.processFrames(rawFile);
    collector.writeFrames(outfile, activeLabels());
    return new FramesMeasurement(outfile, activeChannels, sampleRateHz());
  }

  /**
   * Raw capture files kept by the last {@link #getData(Path)}.
   *
   * @return kept raw file, or an empty list
   */
  public List<Path> getRaw() {
    return rawFile != null ? List.of(rawFile) : List.of();
  }

  public double sampleRateHz() {
    return 1000.0 / period.toMillis();
  }

  public List<InstrumentChannel> channels() {
    return List.copyOf(channels.values());
  }

  public List<InstrumentChannel> activeChannels() {
    return activeChannels;
  }

  public FrameCollector collector() {
    return collector;
  }

  private List<String> activeLabels() {
    return labels(activeChannels);
  }

  private static List<String> labels(List<InstrumentChannel> list) {
    List<String> out = new ArrayList<>(list.size());
    for (InstrumentChannel c : list) {
      out.add(c.label());
    }
    return out;
  }
}
