package com.scholary.voicenote.api;

import com.scholary.voicenote.pipeline.ProcessingStatus;

/** Response for an accepted upload. Poll {@code /api/voices/{id}} for progress. */
public record UploadResponse(String id, ProcessingStatus status) {}
