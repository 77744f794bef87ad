package com.consullo.frames.collect;

import java.time.Duration;

/**
 * Frame collector configuration values.
 *
 * @param target what to sample: the SurfaceFlinger view name or the application package
 * @param period wait between the end of one sample and the start of the next
 * @param unresponsiveWarningThreshold unresponsive markers tolerated before the count is logged as a warning
 * @since 1.0
 */
public record FrameCollectorConfig(
    String target,
    Duration period,
    int unresponsiveWarningThreshold) {

  public static final int DEFAULT_UNRESPONSIVE_WARNING_THRESHOLD = 10;

  public static FrameCollectorConfig of(String target, Duration period) {
    return new FrameCollectorConfig(target, period, DEFAULT_UNRESPONSIVE_WARNING_THRESHOLD);
  }
}
