package com.scholary.voicenote.api;

import com.scholary.voicenote.pipeline.ProcessingStatus;
import com.scholary.voicenote.recording.VoiceRecording;
import java.time.Instant;

/**
 * Response for a recording query.
 *
 * <p>Only the status of a failed run is exposed; the failing stage and its message stay in the
 * logs.
 */
public record RecordingResponse(
    String id,
    String originalName,
    String mimeType,
    long sizeBytes,
    Double durationSeconds,
    ProcessingStatus status,
    String noteId,
    Instant createdAt,
    Instant updatedAt) {

  public static RecordingResponse from(VoiceRecording recording) {
    return new RecordingResponse(
        recording.id(),
        recording.originalName(),
        recording.mimeType(),
        recording.sizeBytes(),
        recording.durationSeconds(),
        recording.status(),
        recording.note() == null ? null : recording.note().id(),
        recording.createdAt(),
        recording.updatedAt());
  }
}
