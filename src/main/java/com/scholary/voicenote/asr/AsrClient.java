package com.scholary.voicenote.asr;

import com.scholary.voicenote.segmentation.Segment;

/**
 * Client for a remote speech recognition service.
 *
 * <p>This abstraction keeps the wire format out of the worker pool and lets tests substitute a
 * scripted client.
 */
public interface AsrClient {

  /**
   * Transcribe one segment.
   *
   * <p>Makes exactly one remote call; retrying is the caller's business.
   *
   * @param segment the segment whose audio file is sent
   * @param prompt guidance text passed to the service unchanged
   * @return the transcribed text, possibly empty
   * @throws TranscriptionTransientException if the call failed in a way that may succeed later
   * @throws TranscriptionPermanentException if the call can never succeed
   */
  String transcribe(Segment segment, String prompt);
}
