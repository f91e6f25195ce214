package com.scholary.voicenote.note;

import com.scholary.voicenote.recording.VoiceRecording;

/**
 * Durable storage for merged transcripts.
 *
 * <p>Implementations exist for the local filesystem and for S3-compatible object storage; the
 * backend is chosen by {@code storage.notes.backend}.
 */
public interface NoteStore {

  /**
   * Write the note of a recording.
   *
   * @param recording the recording the text belongs to
   * @param text the merged transcript
   * @return metadata of the written note
   * @throws com.scholary.voicenote.pipeline.PersistenceException if the note could not be written
   */
  VoiceNote save(VoiceRecording recording, String text);

  /**
   * Read back the content of a note.
   *
   * @param note metadata returned by {@link #save}
   * @return the note text
   * @throws com.scholary.voicenote.pipeline.PersistenceException if the note could not be read
   */
  String read(VoiceNote note);

  /** Note file name: the stem of the original upload name plus {@code _note.<format>}. */
  static String fileName(String originalName, String format) {
    String name = originalName == null || originalName.isBlank() ? "recording" : originalName;
    int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    name = name.substring(slash + 1);
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    if (stem.isBlank()) {
      stem = "recording";
    }
    return stem + "_note." + format;
  }
}
