package com.consullo.frames.collect;

/**
 * Unexpected failure inside a collector's sampling loop, reported from {@link FrameCollector#stop()}.
 *
 * @since 1.0
 */
public class CollectorThreadException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String collectorName;

  public CollectorThreadException(String collectorName, Throwable cause) {
    super("Exception on collector thread " + collectorName + ": "
        + cause.getClass().getSimpleName() + "(" + cause.getMessage() + ")", cause);
    this.collectorName = collectorName;
  }

  public String collectorName() {
    return collectorName;
  }
}
