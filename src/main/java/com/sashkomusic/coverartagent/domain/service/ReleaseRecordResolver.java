package com.sashkomusic.coverartagent.domain.service;

import com.sashkomusic.coverartagent.domain.model.CacheKey;
import com.sashkomusic.coverartagent.domain.model.RecordKind;
import com.sashkomusic.coverartagent.domain.model.ResolvedRecord;
import com.sashkomusic.coverartagent.domain.model.TrackMetadata;
import com.sashkomusic.coverartagent.infrastructure.client.musicbrainz.MusicBrainzClient;
import com.sashkomusic.coverartagent.infrastructure.client.musicbrainz.dto.MusicBrainzRelease;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReleaseRecordResolver {

    private final MusicBrainzClient musicBrainzClient;

    /**
     * Uses the track's MusicBrainz release id when tagged, otherwise searches by artist and album.
     * A release without a front cover falls back to its release group, which may still have art.
     */
    public Optional<ResolvedRecord> resolve(TrackMetadata metadata, CacheKey key) {
        if (metadata.hasReleaseId()) {
            String releaseId = metadata.musicBrainzReleaseId();
            return musicBrainzClient.lookupRelease(releaseId)
                    .map(this::toRecord);
        }

        Optional<ResolvedRecord> found = musicBrainzClient.searchReleaseGroupId(key.artist(), key.album())
                .map(id -> new ResolvedRecord(id, RecordKind.RELEASE_GROUP));

        if (found.isEmpty()) {
            log.info("No MusicBrainz release group for artist='{}', album='{}'", key.artist(), key.album());
        }
        return found;
    }

    private ResolvedRecord toRecord(MusicBrainzRelease release) {
        if (Boolean.TRUE.equals(release.coverArtArchive().front())) {
            return new ResolvedRecord(release.id(), RecordKind.RELEASE);
        }
        log.debug("Release {} has no front cover, using release group {}", release.id(), release.releaseGroup().id());
        return new ResolvedRecord(release.releaseGroup().id(), RecordKind.RELEASE_GROUP);
    }
}
