package com.scholary.voicenote.segmentation;

import java.nio.file.Path;

/**
 * One contiguous slice of a recording, re-encoded to its own file.
 *
 * <p>The index is 0-based and defines the merge order. Segment files are written once by the
 * segmenter, read by the transcription workers and deleted when the run ends.
 *
 * @param index ordinal of this segment in the recording
 * @param range the slice of the source recording this segment covers
 * @param path the re-encoded segment file
 * @param extractionMs time ffmpeg took to cut and re-encode this segment
 */
public record Segment(int index, TimeRange range, Path path, long extractionMs) {

  public Segment {
    if (index < 0) {
      throw new IllegalArgumentException("Segment index cannot be negative");
    }
    if (extractionMs < 0) {
      throw new IllegalArgumentException("Extraction time cannot be negative");
    }
  }

  public Segment(int index, TimeRange range, Path path) {
    this(index, range, path, 0);
  }

  public double start() {
    return range.start();
  }

  public double end() {
    return range.end();
  }

  public double duration() {
    return range.duration();
  }
}
