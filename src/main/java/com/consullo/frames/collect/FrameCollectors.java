package com.consullo.frames.collect;

import com.consullo.frames.remote.PtyShellExecutor;
import com.consullo.frames.remote.RemoteExecutionException;
import com.consullo.frames.remote.RemoteExecutor;
import com.consullo.frames.remote.ShellExecutorConfig;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Factory for frame collectors talking to an adb-attached device, with sensible defaults.
 *
 * <p>
 * This class centralizes:
 * <ul>
 * <li>the adb command prefix used to reach a device</li>
 * <li>the per-command timeout</li>
 * <li>the default sampling period</li>
 * </ul>
 * </p>
 */
public final class FrameCollectors {

  public static final Duration DEFAULT_PERIOD = Duration.ofSeconds(2);
  public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(30);

  private FrameCollectors() {
  }

  /**
   * Create an executor that runs commands through {@code adb shell}.
   *
   * @param adbExecutable adb binary (e.g. "adb")
   * @param serial device serial, or null to let adb pick the only attached device
   * @param commandTimeout timeout of a single command, or null for {@link #DEFAULT_COMMAND_TIMEOUT}
   * @return executor
   */
  public static RemoteExecutor adbExecutor(String adbExecutable, String serial, Duration commandTimeout) {
    if (adbExecutable == null || adbExecutable.isBlank()) {
      throw new IllegalArgumentException("adbExecutable must not be blank.");
    }
    List<String> prefix = new ArrayList<>();
    prefix.add(adbExecutable);
    if (serial != null && !serial.isBlank()) {
      prefix.add("-s");
      prefix.add(serial);
    }
    prefix.add("shell");

    Path workDir = Path.of(".").toAbsolutePath().normalize();
    Duration timeout = commandTimeout != null ? commandTimeout : DEFAULT_COMMAND_TIMEOUT;
    return new PtyShellExecutor(new ShellExecutorConfig(List.copyOf(prefix), workDir, null, timeout));
  }

  /**
   * Create a collector of SurfaceFlinger latency dumps for a view.
   *
   * @param executor command channel
   * @param view view name as listed by {@code dumpsys SurfaceFlinger --list}
   * @param period sampling period, or null for {@link #DEFAULT_PERIOD}
   * @return collector
   */
  public static SurfaceFlingerFrameCollector surfaceFlinger(RemoteExecutor executor, String view, Duration period) {
    return new SurfaceFlingerFrameCollector(executor, FrameCollectorConfig.of(view, orDefault(period)));
  }

  /**
   * Create a collector of gfxinfo framestats dumps for a package. Queries the column header.
   *
   * @param executor command channel
   * @param packageName application package
   * @param period sampling period, or null for {@link #DEFAULT_PERIOD}
   * @return collector
   * @throws RemoteExecutionException if the column header cannot be read
   */
  public static GfxinfoFrameCollector gfxinfo(RemoteExecutor executor, String packageName, Duration period)
      throws RemoteExecutionException {
    return new GfxinfoFrameCollector(executor, FrameCollectorConfig.of(packageName, orDefault(period)));
  }

  private static Duration orDefault(Duration period) {
    return period != null ? period : DEFAULT_PERIOD;
  }
}
