package com.consullo.frames.model;

import java.util.List;

/**
 * One frame from a SurfaceFlinger latency dump.
 *
 * <p>All three timestamps are in the ticks reported by SurfaceFlinger (nanoseconds on current devices).
 * {@link #frameReadyTime()} orders frames within a session.
 *
 * @param desiredPresentTime time the application wanted the frame presented
 * @param actualPresentTime time the frame was actually presented
 * @param frameReadyTime time the frame became ready for composition; {@code 0} marks an empty slot
 * @since 1.0
 */
public record SurfaceFlingerFrame(
    long desiredPresentTime,
    long actualPresentTime,
    long frameReadyTime) {

  /**
   * Column names in row order.
   */
  public static final List<String> FIELDS =
      List.of("desired_present_time", "actual_present_time", "frame_ready_time");

  /**
   * Returns the frame as a table row in {@link #FIELDS} order.
   *
   * @return row values
   */
  public long[] toRow() {
    return new long[] { desiredPresentTime, actualPresentTime, frameReadyTime };
  }

  /**
   * Latency from the desired present time to the time the frame was ready.
   *
   * @return ready minus desired
   * @throws ArithmeticException if the difference does not fit in a long
   */
  public long readyLatency() {
    return Math.subtractExact(frameReadyTime, desiredPresentTime);
  }
}
