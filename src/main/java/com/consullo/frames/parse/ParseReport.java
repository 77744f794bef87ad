package com.consullo.frames.parse;

/**
 * Outcome of parsing one session's raw capture.
 *
 * @param acceptedFrames frames appended to the table
 * @param droppedFrames frame records rejected as empty, duplicate, out of order, implausible or malformed
 * @param unresponsiveCount number of "source unresponsive" markers seen in the capture
 * @since 1.0
 */
public record ParseReport(
    int acceptedFrames,
    int droppedFrames,
    int unresponsiveCount) {
}
