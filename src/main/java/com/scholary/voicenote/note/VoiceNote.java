package com.scholary.voicenote.note;

import java.time.Instant;

/**
 * Metadata of a persisted note.
 *
 * @param id note id
 * @param recordingId the recording the note was transcribed from
 * @param location file path or object key, depending on the store
 * @param format file format, {@code txt} or {@code md}
 * @param sizeBytes size of the UTF-8 encoded content
 * @param createdAt when the note was written
 */
public record VoiceNote(
    String id,
    String recordingId,
    String location,
    String format,
    long sizeBytes,
    Instant createdAt) {}
