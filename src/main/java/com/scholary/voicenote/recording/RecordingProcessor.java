package com.scholary.voicenote.recording;

import com.scholary.voicenote.pipeline.ProcessingRun;
import com.scholary.voicenote.pipeline.VoiceProcessingPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/** Starts pipeline runs for stored recordings on the pipeline executor. */
@Component
public class RecordingProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordingProcessor.class);

  private final VoiceProcessingPipeline pipeline;

  public RecordingProcessor(VoiceProcessingPipeline pipeline) {
    this.pipeline = pipeline;
  }

  @Async("pipelineExecutor")
  public void processAsync(String recordingId) {
    try {
      ProcessingRun run = pipeline.process(recordingId);
      LOGGER.info("Recording {} finished with status {}", recordingId, run.status());
    } catch (RuntimeException e) {
      LOGGER.error("Processing failed for recording {}", recordingId, e);
    }
  }
}
