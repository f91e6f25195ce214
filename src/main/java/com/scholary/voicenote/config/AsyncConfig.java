package com.scholary.voicenote.config;

import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Uploaded recordings are processed on a bounded pool so the upload request returns at once.
 * Each pipeline thread runs one recording at a time; the ASR calls of that recording use their
 * own worker pool.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "pipelineExecutor")
  public Executor pipelineExecutor(
      @Value("${pipeline.executor.threads}") int threads,
      @Value("${pipeline.executor.queue-size}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("pipeline-");
    executor.initialize();
    return executor;
  }
}
