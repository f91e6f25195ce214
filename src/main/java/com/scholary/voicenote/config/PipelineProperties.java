package com.scholary.voicenote.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the processing pipeline.
 *
 * <p>Passed explicitly into the segmenter, the worker pool and the orchestrator, so a test can
 * build a pipeline with its own values without touching the Spring context.
 *
 * @param segmentSeconds maximum length of one segment
 * @param maxConcurrency maximum number of ASR calls in flight for one run
 * @param maxAttempts total ASR attempts per segment, including the first one
 * @param backoffBase delay before the second attempt; doubled for every further attempt
 * @param backoffMax upper bound for a single backoff delay
 * @param scratchDir directory under which each run writes its segment files
 * @param failWhenAllSegmentsFailed whether a run whose segments all failed ends FAILED instead of
 *     saving an all-sentinel note
 * @param prompt guidance text passed unchanged to every ASR call
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @Positive int segmentSeconds,
    @Positive int maxConcurrency,
    @Positive int maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    @NotBlank String scratchDir,
    boolean failWhenAllSegmentsFailed,
    @NotBlank String prompt) {}
