package com.scholary.voicenote.segmentation;

/**
 * A half-open time range {@code [start, end)} in seconds.
 *
 * <p>Segment boundaries use half-open ranges so that consecutive segments share a boundary point
 * without overlapping: {@code [0, 150)} and {@code [150, 300)} together cover {@code [0, 300)}.
 */
public record TimeRange(double start, double end) {

  public TimeRange {
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  public double duration() {
    return end - start;
  }
}
