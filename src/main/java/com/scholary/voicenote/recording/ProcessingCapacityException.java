package com.scholary.voicenote.recording;

import com.scholary.voicenote.VoiceNoteException;

/** The pipeline executor cannot take another recording right now. */
public class ProcessingCapacityException extends VoiceNoteException {

  public ProcessingCapacityException(String message, Throwable cause) {
    super(message, cause);
  }
}
