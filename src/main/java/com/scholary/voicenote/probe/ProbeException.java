package com.scholary.voicenote.probe;

import com.scholary.voicenote.pipeline.PipelineStageException;
import com.scholary.voicenote.pipeline.Stage;

/**
 * Thrown when the duration of a recording cannot be determined.
 *
 * <p>Covers a missing or broken ffprobe, unreadable or corrupt input and zero-length audio. Fatal
 * for the run: no segment is attempted once probing failed.
 */
public class ProbeException extends PipelineStageException {

  public ProbeException(String message) {
    super(Stage.PROBE, message);
  }

  public ProbeException(String message, Throwable cause) {
    super(Stage.PROBE, message, cause);
  }
}
