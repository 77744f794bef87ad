package com.consullo.frames.instrument;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of {@link FramesInstrument#getData(Path)}.
 *
 * @param path exported CSV file
 * @param channels channels in CSV column order
 * @param sampleRateHz rate at which dumps were taken
 * @since 1.0
 */
public record FramesMeasurement(
    Path path,
    List<InstrumentChannel> channels,
    double sampleRateHz) {
}
