package com.scholary.voicenote.pipeline;

import com.scholary.voicenote.note.VoiceNote;
import com.scholary.voicenote.transcription.TranscriptionOutcome;
import java.time.Instant;
import java.util.List;

/**
 * Result of processing one recording.
 *
 * @param runId id of the run, also the name of its scratch directory
 * @param recordingId the processed recording
 * @param status terminal status, DONE or FAILED
 * @param durationSeconds probed duration, {@code null} if probing failed
 * @param segmentCount number of segments created
 * @param outcomes per-segment outcomes in index order, empty if transcription never started
 * @param mergedText merged document, {@code null} if the run failed before merging
 * @param note the saved note, {@code null} unless DONE
 * @param failedStage stage that failed the run, {@code null} unless FAILED
 * @param errorMessage message of the failure, {@code null} unless FAILED
 * @param startedAt when the run started
 * @param finishedAt when the run reached its terminal status
 */
public record ProcessingRun(
    String runId,
    String recordingId,
    ProcessingStatus status,
    Double durationSeconds,
    int segmentCount,
    List<TranscriptionOutcome> outcomes,
    String mergedText,
    VoiceNote note,
    Stage failedStage,
    String errorMessage,
    Instant startedAt,
    Instant finishedAt) {

  public ProcessingRun {
    outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
  }

  public boolean isDone() {
    return status == ProcessingStatus.DONE;
  }

  public int failedSegments() {
    return (int) outcomes.stream().filter(TranscriptionOutcome::isFailed).count();
  }
}
