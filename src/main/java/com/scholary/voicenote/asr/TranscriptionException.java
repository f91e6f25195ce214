package com.scholary.voicenote.asr;

import com.scholary.voicenote.VoiceNoteException;

/**
 * Exception thrown when the ASR service fails to transcribe a segment.
 *
 * <p>Callers decide what to do based on the subtype: {@link TranscriptionTransientException} may
 * succeed on a later attempt, {@link TranscriptionPermanentException} will not.
 */
public abstract class TranscriptionException extends VoiceNoteException {

  protected TranscriptionException(String message) {
    super(message);
  }

  protected TranscriptionException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Whether repeating the same request could succeed. */
  public abstract boolean isRetryable();
}
