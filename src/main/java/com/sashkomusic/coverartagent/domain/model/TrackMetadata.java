package com.sashkomusic.coverartagent.domain.model;

import org.springframework.util.StringUtils;

/**
 * Tags of the track the player is currently on. Any field may be null.
 *
 * @param relativePath path of the audio file relative to the music root
 */
public record TrackMetadata(
        String artist,
        String albumArtist,
        String album,
        String title,
        String trackNumber,
        String date,
        Long durationSeconds,
        String musicBrainzReleaseId,
        String relativePath
) {

    public static TrackMetadata pathOnly(String relativePath) {
        return new TrackMetadata(null, null, null, null, null, null, null, null, relativePath);
    }

    public boolean hasReleaseId() {
        return StringUtils.hasText(musicBrainzReleaseId);
    }

    public boolean hasArtistAndAlbum() {
        return (StringUtils.hasText(albumArtist) || StringUtils.hasText(artist)) && StringUtils.hasText(album);
    }
}
