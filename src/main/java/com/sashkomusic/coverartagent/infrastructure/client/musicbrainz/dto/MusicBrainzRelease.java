package com.sashkomusic.coverartagent.infrastructure.client.musicbrainz.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Subset of {@code /release/{id}?inc=release-groups}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MusicBrainzRelease(
        @JsonProperty("id")
        String id,

        @JsonProperty("release-group")
        MusicBrainzReleaseGroup releaseGroup,

        @JsonProperty("cover-art-archive")
        CoverArtArchiveStatus coverArtArchive
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CoverArtArchiveStatus(
            @JsonProperty("front")
            Boolean front
    ) {}

    public boolean isComplete() {
        return id != null && !id.isBlank()
                && releaseGroup != null && releaseGroup.isComplete()
                && coverArtArchive != null && coverArtArchive.front() != null;
    }
}
