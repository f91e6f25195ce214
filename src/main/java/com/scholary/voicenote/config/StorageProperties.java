package com.scholary.voicenote.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for uploaded audio and generated notes.
 *
 * <p>These map to the "storage.*" keys in application.yml.
 *
 * @param uploadDir directory that receives uploaded recordings
 * @param maxUploadBytes largest accepted upload
 * @param notes where and how notes are written
 */
@ConfigurationProperties(prefix = "storage")
@Validated
public record StorageProperties(
    @NotBlank String uploadDir, @Positive long maxUploadBytes, @Valid @NotNull Notes notes) {

  /**
   * @param backend {@code filesystem} or {@code objectstore}
   * @param directory root directory of the filesystem backend
   * @param format note file extension, {@code txt} or {@code md}
   * @param keyPrefix key prefix used by the object store backend
   */
  public record Notes(
      @NotBlank @Pattern(regexp = "filesystem|objectstore") String backend,
      String directory,
      @NotBlank @Pattern(regexp = "txt|md") String format,
      String keyPrefix) {}
}
