package com.sashkomusic.coverartagent.domain.model;

public record ResolvedRecord(
        String id,
        RecordKind kind
) {
}
