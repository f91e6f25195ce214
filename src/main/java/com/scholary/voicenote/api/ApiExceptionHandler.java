package com.scholary.voicenote.api;

import com.scholary.voicenote.pipeline.PersistenceException;
import com.scholary.voicenote.recording.InvalidAudioException;
import com.scholary.voicenote.recording.NoteNotReadyException;
import com.scholary.voicenote.recording.ProcessingCapacityException;
import com.scholary.voicenote.recording.RecordingNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/** Maps exceptions that reach the HTTP layer to {@link ErrorResponse} bodies. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidAudioException.class)
  public ResponseEntity<ErrorResponse> invalidAudio(InvalidAudioException e) {
    LOGGER.warn("Rejected upload: {} {}", e.code(), e.getMessage());
    HttpStatus status =
        e.code() == InvalidAudioException.Code.TOO_LARGE
            ? HttpStatus.PAYLOAD_TOO_LARGE
            : HttpStatus.BAD_REQUEST;
    return ResponseEntity.status(status).body(new ErrorResponse(e.code().name(), e.getMessage()));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> uploadTooLarge(MaxUploadSizeExceededException e) {
    LOGGER.warn("Rejected upload: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(new ErrorResponse("TOO_LARGE", "File exceeds the maximum upload size"));
  }

  @ExceptionHandler(RecordingNotFoundException.class)
  public ResponseEntity<ErrorResponse> notFound(RecordingNotFoundException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ErrorResponse("NOT_FOUND", e.getMessage()));
  }

  @ExceptionHandler(NoteNotReadyException.class)
  public ResponseEntity<ErrorResponse> notReady(NoteNotReadyException e) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ErrorResponse("NOT_READY", e.getMessage()));
  }

  @ExceptionHandler(ProcessingCapacityException.class)
  public ResponseEntity<ErrorResponse> busy(ProcessingCapacityException e) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ErrorResponse("BUSY", e.getMessage()));
  }

  @ExceptionHandler(PersistenceException.class)
  public ResponseEntity<ErrorResponse> storageError(PersistenceException e) {
    LOGGER.error("Storage error", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse("STORAGE_ERROR", "Failed to read stored data"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ErrorResponse> unexpected(RuntimeException e) {
    LOGGER.error("Unexpected error", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorResponse("PROCESSING_ERROR", "An unexpected error occurred"));
  }
}
