package com.security.anomaly.risk.model;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.util.Optional;

/**
 * Holds the last loaded artifact and reloads it only when the file's modification time
 * changes. Refreshed by the scheduling thread; read by the REST API.
 */
@Slf4j
@Component
public class ModelArtifactCache {

    private final ModelArtifactLoader loader;
    private final Path path;

    private volatile Snapshot snapshot;

    public ModelArtifactCache(ModelArtifactLoader loader,
                              @Value("${anomaly.risk.model.path:/models/ip_risk_model.json}") String path) {
        this.loader = loader;
        this.path = Paths.get(path);
    }

    /**
     * @return the current artifact, or empty when the file is missing or failed to load
     */
    public Optional<ModelArtifact> refreshIfChanged() {
        FileTime modified;
        try {
            modified = Files.getLastModifiedTime(path);
        } catch (NoSuchFileException e) {
            if (snapshot != null) {
                log.warn("Model artifact removed: {}", path);
            }
            snapshot = null;
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Cannot stat model artifact {}: {}", path, e.getMessage());
            snapshot = null;
            return Optional.empty();
        }

        Snapshot current = snapshot;
        if (current != null && current.modified.equals(modified)) {
            return Optional.of(current.artifact);
        }
        try {
            ModelArtifact artifact = loader.load(path);
            snapshot = new Snapshot(modified, artifact);
            return Optional.of(artifact);
        } catch (ArtifactUnavailableException e) {
            log.warn("Model artifact unavailable: {}", e.getMessage());
            snapshot = null;
            return Optional.empty();
        }
    }

    /** Last successfully loaded artifact, without touching the file system. */
    public Optional<ModelArtifact> current() {
        Snapshot current = snapshot;
        return current == null ? Optional.empty() : Optional.of(current.artifact);
    }

    public Path getPath() {
        return path;
    }

    private static final class Snapshot {
        private final FileTime modified;
        private final ModelArtifact artifact;

        private Snapshot(FileTime modified, ModelArtifact artifact) {
            this.modified = modified;
            this.artifact = artifact;
        }
    }
}
