package com.scholary.voicenote.recording;

import com.scholary.voicenote.note.VoiceNote;
import com.scholary.voicenote.pipeline.ProcessingStatus;
import java.nio.file.Path;
import java.time.Instant;

/**
 * An uploaded recording and its processing state.
 *
 * <p>Immutable: status, duration and note changes produce a new copy that has to be saved.
 *
 * @param id recording id
 * @param originalName file name sent by the client
 * @param mimeType validated MIME type of the upload
 * @param sizeBytes size of the stored file
 * @param audioPath where the upload is stored
 * @param durationSeconds probed duration, {@code null} until probed
 * @param status processing status
 * @param note the persisted note, {@code null} until the run is done
 * @param createdAt upload time
 * @param updatedAt time of the last change
 */
public record VoiceRecording(
    String id,
    String originalName,
    String mimeType,
    long sizeBytes,
    Path audioPath,
    Double durationSeconds,
    ProcessingStatus status,
    VoiceNote note,
    Instant createdAt,
    Instant updatedAt) {

  public static VoiceRecording uploaded(
      String id, String originalName, String mimeType, long sizeBytes, Path audioPath) {
    Instant now = Instant.now();
    return new VoiceRecording(
        id,
        originalName,
        mimeType,
        sizeBytes,
        audioPath,
        null,
        ProcessingStatus.UPLOADED,
        null,
        now,
        now);
  }

  /**
   * Copy with a new status.
   *
   * @throws IllegalStateException if the current status cannot move to {@code target}
   */
  public VoiceRecording withStatus(ProcessingStatus target) {
    return new VoiceRecording(
        id,
        originalName,
        mimeType,
        sizeBytes,
        audioPath,
        durationSeconds,
        status.transitionTo(target),
        note,
        createdAt,
        Instant.now());
  }

  public VoiceRecording withDuration(double seconds) {
    return new VoiceRecording(
        id,
        originalName,
        mimeType,
        sizeBytes,
        audioPath,
        seconds,
        status,
        note,
        createdAt,
        Instant.now());
  }

  public VoiceRecording withNote(VoiceNote voiceNote) {
    return new VoiceRecording(
        id,
        originalName,
        mimeType,
        sizeBytes,
        audioPath,
        durationSeconds,
        status,
        voiceNote,
        createdAt,
        Instant.now());
  }
}
