package com.scholary.voicenote.recording;

import com.scholary.voicenote.VoiceNoteException;

/** No recording exists for the given id. */
public class RecordingNotFoundException extends VoiceNoteException {

  public RecordingNotFoundException(String id) {
    super("Recording not found: " + id);
  }
}
