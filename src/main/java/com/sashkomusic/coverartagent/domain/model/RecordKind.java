package com.sashkomusic.coverartagent.domain.model;

public enum RecordKind {
    RELEASE("release"),
    RELEASE_GROUP("release-group");

    private final String pathSegment;

    RecordKind(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    public String pathSegment() {
        return pathSegment;
    }

    @Override
    public String toString() {
        return pathSegment;
    }
}
