package com.scholary.voicenote.segmentation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg/ffprobe invocations.
 *
 * <p>Segments are always re-encoded to {@code channels} channels at {@code sampleRate} Hz with
 * {@code codec}; the defaults (mono, 16 kHz, MP3) are what Whisper-style ASR services expect.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @Positive int sampleRate,
    @Positive int channels,
    @NotBlank String codec,
    @NotBlank String segmentExtension,
    @NotNull Duration probeTimeout,
    @NotNull Duration segmentTimeout) {}
