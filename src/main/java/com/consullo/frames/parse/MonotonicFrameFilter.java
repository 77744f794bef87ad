package com.consullo.frames.parse;

import java.util.function.Predicate;
import java.util.function.ToLongFunction;

/**
 * Session-wide filter that only lets frames through in strictly increasing order.
 *
 * <p>
 * A frame passes when its ordering key is non-zero, greater than the key of
 * every frame accepted before it, and the source-specific validity check holds.
 * The watermark is only advanced by accepted frames, so a rejected frame never
 * hides a later one.
 * </p>
 *
 * @param <F> frame type
 */
public final class MonotonicFrameFilter<F> {

  /**
   * Why a frame was or was not accepted.
   */
  public enum Verdict {
    ACCEPTED,
    EMPTY,
    STALE,
    INVALID
  }

  private final ToLongFunction<F> orderKey;
  private final Predicate<F> validity;

  private long watermark = Long.MIN_VALUE;

  public MonotonicFrameFilter(ToLongFunction<F> orderKey, Predicate<F> validity) {
    if (orderKey == null || validity == null) {
      throw new IllegalArgumentException("orderKey/validity must not be null.");
    }
    this.orderKey = orderKey;
    this.validity = validity;
  }

  public Verdict offer(F frame) {
    long key = orderKey.applyAsLong(frame);
    if (key == 0L) {
      return Verdict.EMPTY;
    }
    if (key <= watermark) {
      return Verdict.STALE;
    }
    if (!validity.test(frame)) {
      return Verdict.INVALID;
    }
    watermark = key;
    return Verdict.ACCEPTED;
  }

  /**
   * Highest key accepted so far, or {@link Long#MIN_VALUE} when nothing has been accepted.
   *
   * @return watermark
   */
  public long watermark() {
    return watermark;
  }
}
