package com.scholary.voicenote.segmentation;

import com.scholary.voicenote.pipeline.PipelineStageException;
import com.scholary.voicenote.pipeline.Stage;

/**
 * Thrown when a recording could not be cut into segments.
 *
 * <p>Segmentation is all-or-nothing: by the time this is thrown, every segment file written for the
 * run has already been deleted.
 */
public class SegmentationException extends PipelineStageException {

  public SegmentationException(String message) {
    super(Stage.SEGMENTATION, message);
  }

  public SegmentationException(String message, Throwable cause) {
    super(Stage.SEGMENTATION, message, cause);
  }
}
