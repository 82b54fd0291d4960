package com.sashkomusic.coverartagent.messaging.consumer.dto;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sashkomusic.coverartagent.domain.model.TrackMetadata;

@JsonTypeName("now_playing")
public record NowPlayingEventDto(
        String requestId,
        String path,
        String artist,
        String albumArtist,
        String album,
        String title,
        String trackNumber,
        String date,
        Long durationSeconds,
        String musicBrainzReleaseId
) {
    public TrackMetadata toTrackMetadata() {
        return new TrackMetadata(
                artist,
                albumArtist,
                album,
                title,
                trackNumber,
                date,
                durationSeconds,
                musicBrainzReleaseId,
                path
        );
    }
}
