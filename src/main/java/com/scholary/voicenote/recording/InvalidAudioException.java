package com.scholary.voicenote.recording;

import com.scholary.voicenote.VoiceNoteException;

/** An upload was rejected before it was stored. */
public class InvalidAudioException extends VoiceNoteException {

  /** Machine-readable reason, returned to the client as the {@code error} field. */
  public enum Code {
    MISSING_AUDIO,
    INVALID_MIME,
    TOO_LARGE
  }

  private final Code code;

  public InvalidAudioException(Code code, String message) {
    super(message);
    this.code = code;
  }

  public Code code() {
    return code;
  }
}
