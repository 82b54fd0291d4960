package com.sashkomusic.coverartagent.domain.service.pending;

import com.sashkomusic.coverartagent.config.CoverArtProperties;
import com.sashkomusic.coverartagent.domain.model.PendingCoverSidecar;
import com.sashkomusic.coverartagent.domain.model.PendingReason;
import com.sashkomusic.coverartagent.domain.model.TrackMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Directory of tracks whose cover could not be confirmed. Each entry is a
 * {@code <key>.jpg} with the embedded art (when ffmpeg found any) and a
 * {@code <key>.json} sidecar. Entries are never removed here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PendingCoverQueue {

    static final String NO_MBID_PREFIX = "nombid_";
    private static final String IMAGE_EXTENSION = ".jpg";
    private static final String SIDECAR_EXTENSION = ".json";

    private final CoverArtProperties properties;
    private final EmbeddedArtExtractor artExtractor;
    private final PendingSidecarWriter sidecarWriter;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * @param mbid release id to key the entry by, or null to key by artist and title
     * @return true if a new entry was written, false if it already existed or queuing was abandoned
     */
    public boolean enqueue(TrackMetadata metadata, String mbid, PendingReason reason) {
        Path queueDir = Paths.get(properties.getPendingQueueDir());
        try {
            Files.createDirectories(queueDir);
        } catch (IOException e) {
            log.error("Failed to create pending cover queue dir {}: {}", queueDir, e.getMessage());
            return false;
        }

        String key = queueKey(metadata, mbid);
        Path imageFile = queueDir.resolve(key + IMAGE_EXTENSION);
        Path sidecarFile = queueDir.resolve(key + SIDECAR_EXTENSION);

        if (!inFlight.add(key)) {
            log.debug("Pending entry {} is already being written", key);
            return false;
        }

        try {
            if (Files.exists(imageFile) || Files.exists(sidecarFile)) {
                log.debug("Pending entry {} already queued, skipping", key);
                return false;
            }

            Path audioPath = resolveAudioPath(metadata);
            if (audioPath != null) {
                artExtractor.extract(audioPath, imageFile);
            } else {
                log.debug("No source path for pending entry {}, skipping art extraction", key);
            }

            String sourcePath = audioPath != null ? audioPath.toString() : "";
            sidecarWriter.write(sidecarFile, PendingCoverSidecar.from(metadata, mbid, reason, sourcePath));

            log.info("Queued track for cover review: key={}, reason={}", key, reason.code());
            return true;
        } finally {
            inFlight.remove(key);
        }
    }

    public List<String> listPending() {
        Path queueDir = Paths.get(properties.getPendingQueueDir());
        if (!Files.isDirectory(queueDir)) {
            return List.of();
        }

        try (Stream<Path> files = Files.list(queueDir)) {
            return files
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(SIDECAR_EXTENSION))
                    .map(name -> name.substring(0, name.length() - SIDECAR_EXTENSION.length()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Failed to list pending cover queue {}: {}", queueDir, e.getMessage());
            return List.of();
        }
    }

    static String queueKey(TrackMetadata metadata, String mbid) {
        if (mbid != null) {
            return mbid;
        }
        return NO_MBID_PREFIX
                + FilenameSanitizer.sanitize(metadata.artist())
                + "_"
                + FilenameSanitizer.sanitize(metadata.title());
    }

    private Path resolveAudioPath(TrackMetadata metadata) {
        if (!StringUtils.hasText(metadata.relativePath())) {
            return null;
        }
        return Paths.get(properties.getMusicRoot()).resolve(metadata.relativePath()).toAbsolutePath();
    }
}
