package com.scholary.voicenote.asr;

/** Retryable ASR failure: network errors, timeouts, throttling and server-side errors. */
public class TranscriptionTransientException extends TranscriptionException {

  public TranscriptionTransientException(String message) {
    super(message);
  }

  public TranscriptionTransientException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
