package com.sashkomusic.coverartagent.domain.service;

import com.sashkomusic.coverartagent.domain.exception.MalformedLookupResponseException;
import com.sashkomusic.coverartagent.domain.model.CacheKey;
import com.sashkomusic.coverartagent.domain.model.PendingReason;
import com.sashkomusic.coverartagent.domain.model.RecordKind;
import com.sashkomusic.coverartagent.domain.model.ResolvedRecord;
import com.sashkomusic.coverartagent.domain.model.TrackMetadata;
import com.sashkomusic.coverartagent.domain.service.pending.PendingCoverQueue;
import com.sashkomusic.coverartagent.infrastructure.client.coverartarchive.CoverArtArchiveClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlbumArtResolverTest {

    private static final CacheKey KEY = new CacheKey("Burial", "Untrue");
    private static final ResolvedRecord GROUP = new ResolvedRecord("rg-1", RecordKind.RELEASE_GROUP);
    private static final String GROUP_URL = "https://coverartarchive.org/release-group/rg-1/front-250";

    @Mock
    private ReleaseRecordResolver recordResolver;

    @Mock
    private CoverArtArchiveClient archiveClient;

    @Mock
    private PendingCoverQueue pendingQueue;

    private ResolutionCache cache;
    private AlbumArtResolver resolver;

    @BeforeEach
    void setUp() {
        cache = new ResolutionCache();
        resolver = new AlbumArtResolver(cache, recordResolver, archiveClient, pendingQueue, new SyncTaskExecutor());
    }

    @Test
    void missingTagsShortCircuit() {
        TrackMetadata noArtist = new TrackMetadata(null, null, "Untrue", "Archangel", "2", "2007", 239L, null, "a.mp3");
        TrackMetadata noAlbum = new TrackMetadata("Burial", "Burial", null, "Archangel", "2", "2007", 239L, "rel-1", "a.mp3");

        assertThat(resolver.resolveArtUrl(noArtist)).isEmpty();
        assertThat(resolver.resolveArtUrl(noAlbum)).isEmpty();

        verifyNoInteractions(recordResolver, archiveClient, pendingQueue);
        assertThat(cache.size()).isZero();
    }

    @Test
    void resolvedAndConfirmedReturnsUrl() {
        TrackMetadata track = track(null);
        when(recordResolver.resolve(track, KEY)).thenReturn(Optional.of(GROUP));
        when(archiveClient.frontCoverExists(GROUP)).thenReturn(true);
        when(archiveClient.frontCoverUrl(GROUP)).thenReturn(GROUP_URL);

        assertThat(resolver.resolveArtUrl(track)).contains(GROUP_URL);
        assertThat(cache.lookup(KEY)).contains(GROUP);
        verifyNoInteractions(pendingQueue);
    }

    @Test
    void secondCallForSameAlbumOnlyProbes() {
        TrackMetadata first = track(null);
        TrackMetadata second = new TrackMetadata("Burial", null, "Untrue", "Ghost Hardware", "3", "2007", 290L, null, "b.mp3");
        when(recordResolver.resolve(first, KEY)).thenReturn(Optional.of(GROUP));
        when(archiveClient.frontCoverExists(GROUP)).thenReturn(true);
        when(archiveClient.frontCoverUrl(GROUP)).thenReturn(GROUP_URL);

        resolver.resolveArtUrl(first);
        assertThat(resolver.resolveArtUrl(second)).contains(GROUP_URL);

        verify(recordResolver, times(1)).resolve(any(), any());
        verify(archiveClient, times(2)).frontCoverExists(GROUP);
    }

    @Test
    void noRecordQueuesWithoutMbid() {
        TrackMetadata track = track("rel-404");
        when(recordResolver.resolve(track, KEY)).thenReturn(Optional.empty());

        assertThat(resolver.resolveArtUrl(track)).isEmpty();

        verify(pendingQueue).enqueue(eq(track), isNull(), eq(PendingReason.NO_MB_MATCH));
        verifyNoInteractions(archiveClient);
        assertThat(cache.lookup(KEY)).isEmpty();
    }

    @Test
    void missingCoverStillCachesAndQueuesWithTrackReleaseId() {
        TrackMetadata track = track("rel-1");
        when(recordResolver.resolve(track, KEY)).thenReturn(Optional.of(GROUP));
        when(archiveClient.frontCoverExists(GROUP)).thenReturn(false);

        assertThat(resolver.resolveArtUrl(track)).isEmpty();

        assertThat(cache.lookup(KEY)).contains(GROUP);
        verify(pendingQueue).enqueue(track, "rel-1", PendingReason.MISSING_CAA);
        verify(archiveClient, never()).frontCoverUrl(any());
    }

    @Test
    void missingCoverFromSearchQueuesWithoutMbid() {
        TrackMetadata track = track(null);
        when(recordResolver.resolve(track, KEY)).thenReturn(Optional.of(GROUP));
        when(archiveClient.frontCoverExists(GROUP)).thenReturn(false);

        resolver.resolveArtUrl(track);

        verify(pendingQueue).enqueue(eq(track), isNull(), eq(PendingReason.MISSING_CAA));
    }

    @Test
    void cacheHitWithMissingCoverQueuesAgain() {
        cache.store(KEY, GROUP);
        TrackMetadata track = track(null);
        when(archiveClient.frontCoverExists(GROUP)).thenReturn(false);

        assertThat(resolver.resolveArtUrl(track)).isEmpty();

        verifyNoInteractions(recordResolver);
        verify(pendingQueue).enqueue(eq(track), isNull(), eq(PendingReason.MISSING_CAA));
    }

    @Test
    void malformedSearchPropagatesWithoutSideEffects() {
        TrackMetadata track = track(null);
        when(recordResolver.resolve(track, KEY)).thenThrow(new MalformedLookupResponseException("changed"));

        assertThatThrownBy(() -> resolver.resolveArtUrl(track))
                .isInstanceOf(MalformedLookupResponseException.class);

        assertThat(cache.size()).isZero();
        verifyNoInteractions(archiveClient, pendingQueue);
    }

    @Test
    void queueFailureDoesNotAffectResult() {
        TrackMetadata track = track(null);
        when(recordResolver.resolve(track, KEY)).thenReturn(Optional.empty());
        doThrow(new IllegalStateException("disk full")).when(pendingQueue).enqueue(any(), any(), any());

        assertThat(resolver.resolveArtUrl(track)).isEmpty();
    }

    @Test
    void sameAlbumResolutionsAreSerialized() throws Exception {
        TrackMetadata first = track(null);
        TrackMetadata second = new TrackMetadata("Burial", null, "Untrue", "Ghost Hardware", "3", "2007", 290L, null, "b.mp3");
        CountDownLatch resolving = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(recordResolver.resolve(any(), eq(KEY))).thenAnswer(invocation -> {
            resolving.countDown();
            release.await(5, TimeUnit.SECONDS);
            return Optional.of(GROUP);
        });
        when(archiveClient.frontCoverExists(GROUP)).thenReturn(true);
        when(archiveClient.frontCoverUrl(GROUP)).thenReturn(GROUP_URL);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Optional<String>> firstResult = executor.submit(() -> resolver.resolveArtUrl(first));
            assertThat(resolving.await(5, TimeUnit.SECONDS)).isTrue();

            Future<Optional<String>> secondResult = executor.submit(() -> resolver.resolveArtUrl(second));
            awaitQueuedOnLock(KEY);
            assertThat(secondResult.isDone()).isFalse();

            release.countDown();

            assertThat(firstResult.get(5, TimeUnit.SECONDS)).contains(GROUP_URL);
            assertThat(secondResult.get(5, TimeUnit.SECONDS)).contains(GROUP_URL);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        verify(recordResolver, times(1)).resolve(any(), any());
        verify(archiveClient, times(2)).frontCoverExists(GROUP);
    }

    @Test
    void equalKeysShareOneLock() {
        assertThat(resolver.lockFor(new CacheKey("Burial", "Untrue")))
                .isSameAs(resolver.lockFor(new CacheKey("Burial", "Untrue")));
    }

    private void awaitQueuedOnLock(CacheKey key) throws InterruptedException {
        ReentrantLock lock = resolver.lockFor(key);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!lock.hasQueuedThreads()) {
            assertThat(System.nanoTime()).isLessThan(deadline);
            Thread.sleep(10);
        }
    }

    private static TrackMetadata track(String releaseId) {
        return new TrackMetadata("Burial", null, "Untrue", "Archangel", "2", "2007", 239L, releaseId, "burial/untrue/02.mp3");
    }
}
