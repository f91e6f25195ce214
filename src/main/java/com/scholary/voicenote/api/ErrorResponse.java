package com.scholary.voicenote.api;

/** Error body: a machine-readable code and a human-readable message. */
public record ErrorResponse(String error, String message) {}
