package com.scholary.voicenote.transcription;

/**
 * Terminal result of transcribing one segment.
 *
 * <p>Text is present iff the status is {@link Status#OK}; an error message is present iff it is
 * {@link Status#FAILED}.
 *
 * @param segmentIndex index of the transcribed segment
 * @param status whether a transcript was obtained
 * @param text the transcript, {@code null} when failed
 * @param attempts number of ASR calls made for the segment
 * @param error message of the last failure, {@code null} when ok
 * @param elapsedMs wall-clock time spent on the segment, backoff included
 */
public record TranscriptionOutcome(
    int segmentIndex, Status status, String text, int attempts, String error, long elapsedMs) {

  public enum Status {
    OK,
    FAILED
  }

  public TranscriptionOutcome {
    if (segmentIndex < 0) {
      throw new IllegalArgumentException("Segment index cannot be negative");
    }
    if (status == null) {
      throw new IllegalArgumentException("Status is required");
    }
    if (attempts < 0) {
      throw new IllegalArgumentException("Attempts cannot be negative");
    }
    if (elapsedMs < 0) {
      throw new IllegalArgumentException("Elapsed time cannot be negative");
    }
    if (status == Status.OK && text == null) {
      throw new IllegalArgumentException("A successful outcome needs text");
    }
    if (status == Status.FAILED && text != null) {
      throw new IllegalArgumentException("A failed outcome cannot carry text");
    }
  }

  public static TranscriptionOutcome ok(int segmentIndex, String text, int attempts) {
    return new TranscriptionOutcome(segmentIndex, Status.OK, text, attempts, null, 0);
  }

  public static TranscriptionOutcome failed(int segmentIndex, int attempts, String error) {
    return new TranscriptionOutcome(segmentIndex, Status.FAILED, null, attempts, error, 0);
  }

  public TranscriptionOutcome withElapsedMs(long millis) {
    return new TranscriptionOutcome(segmentIndex, status, text, attempts, error, millis);
  }

  public boolean isOk() {
    return status == Status.OK;
  }

  public boolean isFailed() {
    return status == Status.FAILED;
  }
}
