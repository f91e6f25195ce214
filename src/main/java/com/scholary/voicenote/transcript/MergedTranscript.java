package com.scholary.voicenote.transcript;

/**
 * The merged document of a run.
 *
 * @param text normalized text in segment order, with a sentinel in place of each failed segment
 * @param totalSegments number of outcomes merged
 * @param failedSegments number of outcomes replaced by the sentinel
 */
public record MergedTranscript(String text, int totalSegments, int failedSegments) {

  public MergedTranscript {
    if (text == null) {
      throw new IllegalArgumentException("Text is required");
    }
    if (failedSegments < 0 || failedSegments > totalSegments) {
      throw new IllegalArgumentException("Failed segments must be within [0, totalSegments]");
    }
  }

  /** True when there was at least one segment and none of them produced text. */
  public boolean allFailed() {
    return totalSegments > 0 && failedSegments == totalSegments;
  }
}
