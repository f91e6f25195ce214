package com.scholary.voicenote.recording;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for recordings.
 *
 * <p>Uses a Caffeine cache so old recordings are evicted and memory stays bounded. Entries expire
 * a fixed time after their last write; every status change is a write.
 */
@Repository
public class RecordingRepository {

  private final Cache<String, VoiceRecording> cache;

  public RecordingRepository(
      @Value("${recordings.max-size}") long maxSize,
      @Value("${recordings.expire-after-hours}") int expireAfterHours) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofHours(expireAfterHours))
            .build();
  }

  public VoiceRecording save(VoiceRecording recording) {
    cache.put(recording.id(), recording);
    return recording;
  }

  public Optional<VoiceRecording> findById(String id) {
    return Optional.ofNullable(cache.getIfPresent(id));
  }

  /**
   * Atomically replace a stored recording with a changed copy.
   *
   * <p>Concurrent updates of one id are serialized. If {@code change} throws, the stored recording
   * stays as it was and the exception propagates.
   *
   * @return the updated recording, empty if no recording has this id
   */
  public Optional<VoiceRecording> update(String id, UnaryOperator<VoiceRecording> change) {
    return Optional.ofNullable(
        cache.asMap().computeIfPresent(id, (key, current) -> change.apply(current)));
  }

  public void delete(String id) {
    cache.invalidate(id);
  }
}
