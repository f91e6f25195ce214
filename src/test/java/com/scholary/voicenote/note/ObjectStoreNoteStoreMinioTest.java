package com.scholary.voicenote.note;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.voicenote.objectstore.ObjectStoreProperties;
import com.scholary.voicenote.objectstore.S3ObjectStoreClient;
import com.scholary.voicenote.pipeline.PersistenceException;
import com.scholary.voicenote.recording.VoiceRecording;
import java.net.URI;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.HttpWaitStrategy;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;

/**
 * Writes and reads notes through a real S3 API.
 *
 * <p>Uses Testcontainers to run MinIO; skipped when no Docker daemon is available.
 */
@Testcontainers(disabledWithoutDocker = true)
class ObjectStoreNoteStoreMinioTest {

  private static final String MINIO_ACCESS_KEY = "minioadmin";
  private static final String MINIO_SECRET_KEY = "minioadmin";
  private static final String TEST_BUCKET = "voice-notes";

  @Container
  static GenericContainer<?> minioContainer =
      new GenericContainer<>("minio/minio:latest")
          .withExposedPorts(9000)
          .withEnv("MINIO_ROOT_USER", MINIO_ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", MINIO_SECRET_KEY)
          .withCommand("server /data")
          .waitingFor(new HttpWaitStrategy().forPath("/minio/health/ready").forPort(9000));

  private static S3ObjectStoreClient objectStoreClient;

  @BeforeAll
  static void createBucket() {
    String endpoint =
        String.format("http://%s:%d", minioContainer.getHost(), minioContainer.getMappedPort(9000));

    try (S3Client s3Client =
        S3Client.builder()
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(MINIO_ACCESS_KEY, MINIO_SECRET_KEY)))
            .endpointOverride(URI.create(endpoint))
            .forcePathStyle(true)
            .build()) {
      s3Client.createBucket(CreateBucketRequest.builder().bucket(TEST_BUCKET).build());
    }

    objectStoreClient =
        new S3ObjectStoreClient(
            new ObjectStoreProperties(
                endpoint, MINIO_ACCESS_KEY, MINIO_SECRET_KEY, TEST_BUCKET, "us-east-1", true));
  }

  @AfterAll
  static void closeClient() {
    if (objectStoreClient != null) {
      objectStoreClient.close();
    }
  }

  @Test
  void saveAndRead_shouldRoundTripThroughBucket() {
    ObjectStoreNoteStore store =
        new ObjectStoreNoteStore(objectStoreClient, TEST_BUCKET, "notes/", "txt");
    VoiceRecording recording =
        VoiceRecording.uploaded(
            "rec-1", "lecture.m4a", "audio/m4a", 1024, Path.of("/uploads/rec-1.m4a"));

    VoiceNote note = store.save(recording, "سلام\n\n[SEGMENT FAILED]");

    assertThat(note.location()).isEqualTo("notes/rec-1/lecture_note.txt");
    assertThat(store.read(note)).isEqualTo("سلام\n\n[SEGMENT FAILED]");
  }

  @Test
  void read_shouldFailForUnknownKey() {
    ObjectStoreNoteStore store =
        new ObjectStoreNoteStore(objectStoreClient, TEST_BUCKET, "notes/", "txt");
    VoiceNote missing = new VoiceNote("n-1", "rec-2", "notes/rec-2/none.txt", "txt", 0, null);

    assertThatThrownBy(() -> store.read(missing)).isInstanceOf(PersistenceException.class);
  }
}
