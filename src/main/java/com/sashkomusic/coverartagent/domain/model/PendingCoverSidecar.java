package com.sashkomusic.coverartagent.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * DTO for the {@code <key>.json} file next to an extracted cover in the pending queue.
 * Triage tooling reads these, so field names are part of the on-disk contract.
 */
public record PendingCoverSidecar(
        @JsonProperty("reason")
        PendingReason reason,

        @JsonProperty("mbid")
        String mbid,

        @JsonProperty("artist")
        String artist,

        @JsonProperty("album")
        String album,

        @JsonProperty("title")
        String title,

        @JsonProperty("trackno")
        String trackNumber,

        @JsonProperty("date")
        String date,

        @JsonProperty("duration_secs")
        long durationSeconds,

        @JsonProperty("source_path")
        String sourcePath,

        @JsonProperty("added_at")
        OffsetDateTime addedAt
) {
    public static PendingCoverSidecar from(TrackMetadata metadata, String mbid, PendingReason reason, String sourcePath) {
        return new PendingCoverSidecar(
                reason,
                mbid,
                orEmpty(metadata.artist()),
                orEmpty(metadata.album()),
                orEmpty(metadata.title()),
                orEmpty(metadata.trackNumber()),
                orEmpty(metadata.date()),
                metadata.durationSeconds() != null ? Math.max(0L, metadata.durationSeconds()) : 0L,
                sourcePath,
                OffsetDateTime.now(ZoneOffset.UTC)
        );
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
