package com.consullo.frames.collect;

/**
 * Lifecycle of one {@link FrameCollector} session.
 *
 * <p>{@code IDLE -> RUNNING -> STOPPED -> PROCESSED -> IDLE}; the last step happens on
 * {@link FrameCollector#reset()}.
 *
 * @since 1.0
 */
public enum CollectorState {
  /** No session; raw file absent. */
  IDLE,
  /** Background loop active and appending to the raw file. */
  RUNNING,
  /** Loop joined, raw file closed and waiting to be processed. */
  STOPPED,
  /** Raw file parsed into the frame table and deleted. */
  PROCESSED
}
