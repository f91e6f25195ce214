package com.scholary.voicenote.asr;

/**
 * Non-retryable ASR failure: rejected requests, bad credentials, unreadable input or a response we
 * cannot parse. Treated like retry exhaustion.
 */
public class TranscriptionPermanentException extends TranscriptionException {

  public TranscriptionPermanentException(String message) {
    super(message);
  }

  public TranscriptionPermanentException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
