package com.sashkomusic.coverartagent.domain.model;

import org.springframework.util.StringUtils;

import java.util.Optional;

public record CacheKey(
        String artist,
        String album
) {

    /**
     * Album artist wins over track artist so compilations share one key.
     */
    public static Optional<CacheKey> from(TrackMetadata metadata) {
        String artist = StringUtils.hasText(metadata.albumArtist())
                ? metadata.albumArtist()
                : metadata.artist();

        if (!StringUtils.hasText(artist) || !StringUtils.hasText(metadata.album())) {
            return Optional.empty();
        }

        return Optional.of(new CacheKey(artist, metadata.album()));
    }
}
