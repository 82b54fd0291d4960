package com.sashkomusic.coverartagent.messaging.producer.dto;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("cover_art_resolved")
public record CoverArtResolvedDto(
        String requestId,
        String path,
        String artist,
        String album,
        String coverUrl,
        boolean found,
        String error
) {
}
