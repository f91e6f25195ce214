package com.scholary.voicenote.pipeline;

import com.scholary.voicenote.VoiceNoteException;

/**
 * A failure that aborts the whole run.
 *
 * <p>The orchestrator maps every subtype to {@link ProcessingStatus#FAILED} and logs the {@link
 * Stage} together with the message. Stage-fatal errors are never retried.
 */
public abstract class PipelineStageException extends VoiceNoteException {

  private final Stage stage;

  protected PipelineStageException(Stage stage, String message) {
    super(message);
    this.stage = stage;
  }

  protected PipelineStageException(Stage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }

  public Stage stage() {
    return stage;
  }
}
