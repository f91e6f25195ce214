package com.scholary.voicenote.config;

import com.scholary.voicenote.note.FileSystemNoteStore;
import com.scholary.voicenote.note.NoteStore;
import com.scholary.voicenote.note.ObjectStoreNoteStore;
import com.scholary.voicenote.objectstore.ObjectStoreClient;
import com.scholary.voicenote.objectstore.ObjectStoreProperties;
import com.scholary.voicenote.objectstore.S3ObjectStoreClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for note storage.
 *
 * <p>{@code storage.notes.backend} selects the implementation. The S3 client and its properties
 * are only created for the object store backend.
 */
@Configuration
public class NoteStoreConfig {

  @Bean
  @ConditionalOnProperty(
      name = "storage.notes.backend",
      havingValue = "filesystem",
      matchIfMissing = true)
  public NoteStore fileSystemNoteStore(StorageProperties properties) {
    String directory = properties.notes().directory();
    if (directory == null || directory.isBlank()) {
      throw new IllegalStateException("storage.notes.directory is required for filesystem notes");
    }
    return new FileSystemNoteStore(directory, properties.notes().format());
  }

  /** Object store backend: notes go to an S3-compatible bucket. */
  @Configuration
  @ConditionalOnProperty(name = "storage.notes.backend", havingValue = "objectstore")
  @EnableConfigurationProperties(ObjectStoreProperties.class)
  static class ObjectStoreBackendConfig {

    @Bean(destroyMethod = "close")
    public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
      return new S3ObjectStoreClient(properties);
    }

    @Bean
    public NoteStore objectStoreNoteStore(
        ObjectStoreClient objectStoreClient,
        ObjectStoreProperties objectStoreProperties,
        StorageProperties storageProperties) {
      return new ObjectStoreNoteStore(
          objectStoreClient,
          objectStoreProperties.bucket(),
          storageProperties.notes().keyPrefix(),
          storageProperties.notes().format());
    }
  }
}
