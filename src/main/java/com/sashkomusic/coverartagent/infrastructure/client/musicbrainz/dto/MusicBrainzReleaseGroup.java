package com.sashkomusic.coverartagent.infrastructure.client.musicbrainz.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MusicBrainzReleaseGroup(
        @JsonProperty("id")
        String id
) {
    public boolean isComplete() {
        return id != null && !id.isBlank();
    }
}
