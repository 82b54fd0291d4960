package com.sashkomusic.coverartagent.domain.service;

import com.sashkomusic.coverartagent.config.CoverArtProperties;
import com.sashkomusic.coverartagent.domain.model.TrackMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads track tags straight from the audio file, for events that only carry a path.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TrackMetadataReader {

    private final CoverArtProperties properties;

    public TrackMetadata read(String relativePath) {
        Path audioFile = Paths.get(properties.getMusicRoot()).resolve(relativePath);

        if (!Files.isRegularFile(audioFile)) {
            log.warn("Audio file not found: {}", audioFile);
            return TrackMetadata.pathOnly(relativePath);
        }

        try {
            AudioFile audio = AudioFileIO.read(audioFile.toFile());
            Tag tag = audio.getTag();
            AudioHeader header = audio.getAudioHeader();
            Long duration = header != null ? (long) header.getTrackLength() : null;

            if (tag == null) {
                log.debug("No tags found in file: {}", audioFile);
                return new TrackMetadata(null, null, null, null, null, null, duration, null, relativePath);
            }

            TrackMetadata metadata = new TrackMetadata(
                    firstValue(tag, FieldKey.ARTIST),
                    firstValue(tag, FieldKey.ALBUM_ARTIST),
                    firstValue(tag, FieldKey.ALBUM),
                    firstValue(tag, FieldKey.TITLE),
                    firstValue(tag, FieldKey.TRACK),
                    firstValue(tag, FieldKey.YEAR),
                    duration,
                    firstValue(tag, FieldKey.MUSICBRAINZ_RELEASEID),
                    relativePath
            );

            log.debug("Read tags from {}: artist='{}', album='{}'", audioFile.getFileName(), metadata.artist(), metadata.album());
            return metadata;

        } catch (Exception e) {
            log.error("Failed to read tags from {}: {}", audioFile, e.getMessage());
            return TrackMetadata.pathOnly(relativePath);
        }
    }

    private String firstValue(Tag tag, FieldKey fieldKey) {
        try {
            String value = tag.getFirst(fieldKey);
            return value != null && !value.isEmpty() ? value : null;
        } catch (Exception e) {
            log.trace("Failed to read {}: {}", fieldKey, e.getMessage());
            return null;
        }
    }
}
