package com.scholary.voicenote.pipeline;

/** Thrown when the final note or a run status could not be written durably. */
public class PersistenceException extends PipelineStageException {

  public PersistenceException(String message) {
    super(Stage.PERSISTENCE, message);
  }

  public PersistenceException(String message, Throwable cause) {
    super(Stage.PERSISTENCE, message, cause);
  }
}
