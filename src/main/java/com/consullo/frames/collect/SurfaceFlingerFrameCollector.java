package com.consullo.frames.collect;

import com.consullo.frames.model.SurfaceFlingerFrame;
import com.consullo.frames.parse.DumpParser;
import com.consullo.frames.parse.SurfaceFlingerDumpParser;
import com.consullo.frames.remote.RemoteExecutionException;
import com.consullo.frames.remote.RemoteExecutor;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.util.List;

/**
 * Collects SurfaceFlinger latency dumps for one view.
 *
 * <p>Each tick lists the active views and, when the configured view is among them, appends its latency
 * dump. SurfaceFlinger keeps only the most recent frames per view, so successive dumps overlap; the
 * parser drops the repeats.
 *
 * @since 1.0
 */
public class SurfaceFlingerFrameCollector extends FrameCollector {

  static final String LIST_COMMAND = "dumpsys SurfaceFlinger --list";
  static final String LATENCY_COMMAND = "dumpsys SurfaceFlinger --latency \"%s\"";
  static final String CLEAR_COMMAND = "dumpsys SurfaceFlinger --latency-clear ";

  public SurfaceFlingerFrameCollector(RemoteExecutor executor, FrameCollectorConfig config) {
    this(executor, config, null);
  }

  /**
   * @param executor command channel to the device
   * @param config target view and sampling period
   * @param header column names for the three frame fields, or null for {@link SurfaceFlingerFrame#FIELDS}
   */
  public SurfaceFlingerFrameCollector(RemoteExecutor executor, FrameCollectorConfig config, List<String> header) {
    super(executor, config, header != null ? header : SurfaceFlingerFrame.FIELDS);
    if (header().size() != SurfaceFlingerFrame.FIELDS.size()) {
      throw new IllegalArgumentException("header must name exactly " + SurfaceFlingerFrame.FIELDS.size()
          + " columns: " + header());
    }
  }

  @Override
  protected void collectOnce(OutputStream sink) throws RemoteExecutionException, IOException {
    for (String view : listViews()) {
      if (view.equals(config.target())) {
        sink.write(latencies(view).getBytes(Charset.defaultCharset()));
      }
    }
  }

  @Override
  public void clear() throws RemoteExecutionException {
    executor.execute(CLEAR_COMMAND);
  }

  @Override
  protected DumpParser newParser() {
    return new SurfaceFlingerDumpParser();
  }

  /**
   * Lists the views SurfaceFlinger is currently compositing.
   *
   * @return view names, one per line of the listing
   * @throws RemoteExecutionException if the target cannot be queried
   */
  public List<String> listViews() throws RemoteExecutionException {
    String text = executor.execute(LIST_COMMAND);
    return List.of(text.replace("\r\n", "\n").replace('\r', '\n').split("\n"));
  }

  private String latencies(String view) throws RemoteExecutionException {
    return executor.execute(String.format(LATENCY_COMMAND, view));
  }
}
