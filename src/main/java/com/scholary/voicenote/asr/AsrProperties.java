package com.scholary.voicenote.asr;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ASR client.
 *
 * <p>The service must speak the OpenAI audio transcription protocol; OpenAI itself and most
 * self-hosted Whisper servers do.
 *
 * @param baseUrl API root, e.g. {@code https://api.openai.com/v1}
 * @param apiKey bearer token; a blank key makes every call fail permanently
 * @param model model identifier, e.g. {@code whisper-1}
 * @param language ISO-639-1 language code of the recordings
 * @param connectTimeout TCP connect timeout
 * @param callTimeout upper bound for one transcription request, response included
 */
@ConfigurationProperties(prefix = "asr")
@Validated
public record AsrProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @NotBlank String language,
    @NotNull Duration connectTimeout,
    @NotNull Duration callTimeout) {}
