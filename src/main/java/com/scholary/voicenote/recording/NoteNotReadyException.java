package com.scholary.voicenote.recording;

import com.scholary.voicenote.VoiceNoteException;
import com.scholary.voicenote.pipeline.ProcessingStatus;

/** The note of a recording was requested before processing finished successfully. */
public class NoteNotReadyException extends VoiceNoteException {

  private final ProcessingStatus status;

  public NoteNotReadyException(String id, ProcessingStatus status) {
    super("Note for recording " + id + " is not ready, status is " + status);
    this.status = status;
  }

  public ProcessingStatus status() {
    return status;
  }
}
