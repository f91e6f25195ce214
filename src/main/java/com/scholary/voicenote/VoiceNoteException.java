package com.scholary.voicenote;

/**
 * Base exception for voice note processing errors.
 *
 * <p>Runtime exception, like the rest of the hierarchy: callers that can act on a failure catch the
 * specific subtype, everything else propagates to the orchestrator or the HTTP exception handler.
 */
public class VoiceNoteException extends RuntimeException {

  public VoiceNoteException(String message) {
    super(message);
  }

  public VoiceNoteException(String message, Throwable cause) {
    super(message, cause);
  }
}
