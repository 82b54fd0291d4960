package com.sashkomusic.coverartagent.domain.service.pending;

import com.sashkomusic.coverartagent.config.CoverArtProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Pulls the attached picture stream out of an audio file with ffmpeg, without re-encoding.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddedArtExtractor {

    private static final long KILL_WAIT_SECONDS = 5;

    private final CoverArtProperties properties;

    /**
     * Best effort: returns false and removes any partial output when ffmpeg fails,
     * times out or leaves no file behind.
     */
    public boolean extract(Path audioFile, Path target) {
        CoverArtProperties.Ffmpeg ffmpeg = properties.getFfmpeg();
        List<String> command = List.of(
                ffmpeg.getBinary(),
                "-nostdin",
                "-y",
                "-i", audioFile.toString(),
                "-an",
                "-vcodec", "copy",
                target.toString()
        );

        boolean success = false;
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);

            Process process = pb.start();
            Duration timeout = ffmpeg.getTimeout();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                if (!process.destroyForcibly().waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("ffmpeg did not exit after kill for {}", audioFile);
                }
                log.warn("ffmpeg timed out after {} extracting art from {}", timeout, audioFile);
            } else if (process.exitValue() != 0) {
                log.debug("ffmpeg exited with code {} for {}", process.exitValue(), audioFile);
            } else {
                success = Files.exists(target);
            }
        } catch (IOException e) {
            log.warn("Could not run ffmpeg for {}: {}", audioFile, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while extracting art from {}", audioFile);
        }

        if (!success) {
            deletePartial(target);
        } else {
            log.info("Extracted embedded art: {}", target);
        }
        return success;
    }

    private void deletePartial(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.warn("Failed to remove partial art file {}: {}", target, e.getMessage());
        }
    }
}
