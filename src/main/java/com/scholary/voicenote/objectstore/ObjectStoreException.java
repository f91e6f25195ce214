package com.scholary.voicenote.objectstore;

import com.scholary.voicenote.VoiceNoteException;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>The note store wraps it into a persistence failure; nothing retries at this level beyond
 * what the AWS SDK already does.
 */
public class ObjectStoreException extends VoiceNoteException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
