package com.scholary.voicenote.pipeline;

/** Raised when every segment of a run failed and the run is configured to fail in that case. */
public class AllSegmentsFailedException extends PipelineStageException {

  public AllSegmentsFailedException(int segments) {
    super(Stage.TRANSCRIPTION, "All " + segments + " segments failed to transcribe");
  }
}
