package com.scholary.voicenote.asr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of a successful transcription response ({@code response_format=json}).
 *
 * <pre>
 * {"text": "..."}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperTranscriptionResponse(String text) {}
