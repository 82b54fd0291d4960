package com.sashkomusic.coverartagent.infrastructure.client.musicbrainz.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReleaseGroupSearchResult(
        @JsonProperty("release-groups")
        List<MusicBrainzReleaseGroup> releaseGroups
) {
}
