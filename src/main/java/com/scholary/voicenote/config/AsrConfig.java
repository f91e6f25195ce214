package com.scholary.voicenote.config;

import com.scholary.voicenote.asr.AsrProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the AsrProperties to be loaded from application.yml.
 *
 * <p>Startup fails unless {@code asr.call-timeout} is shorter than {@code pipeline.backoff-max}.
 */
@Configuration
@EnableConfigurationProperties(AsrProperties.class)
public class AsrConfig {

  public AsrConfig(AsrProperties asrProperties, PipelineProperties pipelineProperties) {
    verifyCallTimeout(asrProperties, pipelineProperties);
  }

  static void verifyCallTimeout(AsrProperties asr, PipelineProperties pipeline) {
    if (asr.callTimeout().compareTo(pipeline.backoffMax()) >= 0) {
      throw new IllegalStateException(
          String.format(
              "asr.call-timeout (%s) must be shorter than pipeline.backoff-max (%s)",
              asr.callTimeout(), pipeline.backoffMax()));
    }
  }
}
