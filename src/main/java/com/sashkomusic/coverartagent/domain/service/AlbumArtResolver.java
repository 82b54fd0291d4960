package com.sashkomusic.coverartagent.domain.service;

import com.sashkomusic.coverartagent.domain.exception.MalformedLookupResponseException;
import com.sashkomusic.coverartagent.domain.model.CacheKey;
import com.sashkomusic.coverartagent.domain.model.PendingReason;
import com.sashkomusic.coverartagent.domain.model.ResolvedRecord;
import com.sashkomusic.coverartagent.domain.model.TrackMetadata;
import com.sashkomusic.coverartagent.domain.service.pending.PendingCoverQueue;
import com.sashkomusic.coverartagent.infrastructure.client.coverartarchive.CoverArtArchiveClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Finds the Cover Art Archive front thumbnail for a track.
 * Tracks whose cover cannot be confirmed are handed to {@link PendingCoverQueue}.
 */
@Slf4j
@Service
public class AlbumArtResolver {

    private final ResolutionCache cache;
    private final ReleaseRecordResolver recordResolver;
    private final CoverArtArchiveClient archiveClient;
    private final PendingCoverQueue pendingQueue;
    private final TaskExecutor pendingQueueExecutor;

    private static final int LOCK_STRIPES = 64;

    // Fixed stripes so the lock set stays bounded; equal keys always share a stripe
    private final ReentrantLock[] keyLocks = new ReentrantLock[LOCK_STRIPES];

    public AlbumArtResolver(ResolutionCache cache,
                            ReleaseRecordResolver recordResolver,
                            CoverArtArchiveClient archiveClient,
                            PendingCoverQueue pendingQueue,
                            @Qualifier("pendingQueueExecutor") TaskExecutor pendingQueueExecutor) {
        this.cache = cache;
        this.recordResolver = recordResolver;
        this.archiveClient = archiveClient;
        this.pendingQueue = pendingQueue;
        this.pendingQueueExecutor = pendingQueueExecutor;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            keyLocks[i] = new ReentrantLock();
        }
    }

    /**
     * @return the confirmed cover URL, or empty when the track has no artist/album tags
     *         or no cover could be confirmed
     * @throws MalformedLookupResponseException if the MusicBrainz search answered with an unexpected body
     */
    public Optional<String> resolveArtUrl(TrackMetadata metadata) {
        Optional<CacheKey> maybeKey = CacheKey.from(metadata);
        if (maybeKey.isEmpty()) {
            log.debug("Track {} has no artist/album tags, skipping cover lookup", metadata.relativePath());
            return Optional.empty();
        }

        CacheKey key = maybeKey.get();
        ReentrantLock lock = lockFor(key);

        lock.lock();
        try {
            return resolveLocked(metadata, key);
        } finally {
            lock.unlock();
        }
    }

    private Optional<String> resolveLocked(TrackMetadata metadata, CacheKey key) {
        Optional<ResolvedRecord> cached = cache.lookup(key);

        ResolvedRecord record;
        if (cached.isPresent()) {
            record = cached.get();
            log.debug("Cache hit for {}: {} {}", key, record.kind(), record.id());
        } else {
            Optional<ResolvedRecord> resolved = recordResolver.resolve(metadata, key);
            if (resolved.isEmpty()) {
                queue(metadata, null, PendingReason.NO_MB_MATCH);
                return Optional.empty();
            }
            record = resolved.get();
            // cached even when the probe below finds no cover
            cache.store(key, record);
        }

        if (archiveClient.frontCoverExists(record)) {
            String url = archiveClient.frontCoverUrl(record);
            log.info("Cover found for '{}' / '{}': {}", key.artist(), key.album(), url);
            return Optional.of(url);
        }

        // Keyed by the track's own release id, not record.id(), which may come from a search hit
        String mbid = metadata.hasReleaseId() ? metadata.musicBrainzReleaseId() : null;
        queue(metadata, mbid, PendingReason.MISSING_CAA);
        return Optional.empty();
    }

    ReentrantLock lockFor(CacheKey key) {
        return keyLocks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }

    private void queue(TrackMetadata metadata, String mbid, PendingReason reason) {
        try {
            pendingQueueExecutor.execute(() -> {
                try {
                    pendingQueue.enqueue(metadata, mbid, reason);
                } catch (Exception e) {
                    log.error("Failed to queue pending cover for {}: {}", metadata.relativePath(), e.getMessage(), e);
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("Pending cover queue rejected {} ({}): {}", metadata.relativePath(), reason.code(), e.getMessage());
        }
    }
}
