package com.consullo.frames.instrument;

/**
 * One measured column of a frames instrument.
 *
 * @param label column name as it appears in the exported CSV
 * @param kind measurement kind, {@code time_us} for timestamps or {@code flags} for bit fields
 * @since 1.0
 */
public record InstrumentChannel(
    String label,
    String kind) {

  public static final String TIME_US = "time_us";
  public static final String FLAGS = "flags";
}
