package com.scholary.voicenote.segmentation;

import java.util.ArrayList;
import java.util.List;

/**
 * Plans fixed-length segment boundaries.
 *
 * <p>For a recording of {@code D} seconds and a maximum segment length {@code S}, segment {@code
 * i} covers {@code [i*S, min((i+1)*S, D))} for {@code i} in {@code 0..ceil(D/S)-1}. The ranges are
 * contiguous, never overlap, and cover {@code [0, D)} exactly; only the last one may be shorter
 * than {@code S}.
 */
public final class SegmentPlanner {

  private SegmentPlanner() {}

  /**
   * Plan segment ranges for a recording.
   *
   * @param totalSeconds duration of the recording
   * @param segmentSeconds maximum length of one segment, must be positive
   * @return the ranges in order; empty if the duration is zero, negative or not finite
   */
  public static List<TimeRange> plan(double totalSeconds, double segmentSeconds) {
    if (!(segmentSeconds > 0) || !Double.isFinite(segmentSeconds)) {
      throw new IllegalArgumentException("Segment length must be positive: " + segmentSeconds);
    }
    if (!Double.isFinite(totalSeconds) || totalSeconds <= 0) {
      return List.of();
    }

    int count = (int) Math.ceil(totalSeconds / segmentSeconds);
    List<TimeRange> ranges = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      double start = i * segmentSeconds;
      // Floating point division can overshoot by one; never emit an empty trailing range
      if (start >= totalSeconds) {
        break;
      }
      ranges.add(new TimeRange(start, Math.min((i + 1) * segmentSeconds, totalSeconds)));
    }
    return List.copyOf(ranges);
  }
}
