package com.sashkomusic.coverartagent.domain.service.pending;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sashkomusic.coverartagent.domain.model.PendingCoverSidecar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Service
@Slf4j
public class PendingSidecarWriter {

    private final ObjectMapper objectMapper;

    public PendingSidecarWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Writes via a temp file so triage tooling never sees a half-written sidecar.
     *
     * @return false if the sidecar could not be written; the failure is only logged
     */
    public boolean write(Path sidecarFile, PendingCoverSidecar sidecar) {
        Path tempFile = sidecarFile.resolveSibling(sidecarFile.getFileName() + ".tmp");

        try {
            objectMapper.writeValue(tempFile.toFile(), sidecar);
            Files.move(tempFile, sidecarFile, StandardCopyOption.ATOMIC_MOVE);

            log.info("Wrote pending cover sidecar: {} (reason={})", sidecarFile, sidecar.reason().code());
            return true;

        } catch (IOException e) {
            log.error("Failed to write pending cover sidecar: {}", sidecarFile, e);
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupError) {
                log.warn("Failed to cleanup temp file: {}", tempFile, cleanupError);
            }
            return false;
        }
    }
}
