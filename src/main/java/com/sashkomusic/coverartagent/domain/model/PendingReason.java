package com.sashkomusic.coverartagent.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PendingReason {
    /** A MusicBrainz record was found but the archive has no front cover for it. */
    MISSING_CAA("missing_caa"),
    /** MusicBrainz had nothing for the track. */
    NO_MB_MATCH("no_mb_match");

    private final String code;

    PendingReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
