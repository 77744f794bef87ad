package com.consullo.frames.demo;

import com.consullo.frames.collect.FrameCollectors;
import com.consullo.frames.instrument.FramesInstrument;
import com.consullo.frames.instrument.FramesMeasurement;
import com.consullo.frames.instrument.GfxinfoFramesInstrument;
import com.consullo.frames.instrument.SurfaceFlingerFramesInstrument;
import com.consullo.frames.remote.RemoteExecutor;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal demo that records frame data from an attached device and writes it as CSV.
 *
 * <p>
 * Usage: {@code FrameCaptureDemo <gfxinfo|surfaceflinger> <package-or-view> <seconds> <out.csv> [serial]}
 * </p>
 *
 * @since 1.0
 */
public final class FrameCaptureDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(FrameCaptureDemo.class);

  private FrameCaptureDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   * @throws Exception if capture fails
   */
  public static void main(final String[] args) throws Exception {
    if (args.length < 4) {
      System.err.println("usage: FrameCaptureDemo <gfxinfo|surfaceflinger> <package-or-view> <seconds> <out.csv> [serial]");
      System.exit(2);
    }
    final String mode = args[0];
    final String target = args[1];
    final long seconds = Long.parseLong(args[2]);
    final Path outfile = Path.of(args[3]).toAbsolutePath();
    final String serial = args.length > 4 ? args[4] : null;

    final RemoteExecutor adb = FrameCollectors.adbExecutor("adb", serial, null);
    final FramesInstrument instrument;
    if ("surfaceflinger".equals(mode)) {
      instrument = new SurfaceFlingerFramesInstrument(adb, target);
    } else if ("gfxinfo".equals(mode)) {
      instrument = new GfxinfoFramesInstrument(adb, target);
    } else {
      throw new IllegalArgumentException("Unknown mode: " + mode);
    }

    LOGGER.info("Recording {} frames of {} for {} s", mode, target, seconds);
    instrument.start();
    Thread.sleep(Duration.ofSeconds(seconds).toMillis());
    instrument.stop();

    final FramesMeasurement measurement = instrument.getData(outfile);
    LOGGER.info("Wrote {} frames to {} (raw: {})",
        instrument.collector().frames().size(), measurement.path(), instrument.getRaw());
  }
}
