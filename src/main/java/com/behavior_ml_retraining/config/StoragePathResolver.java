package com.behavior_ml_retraining.config;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves the on-disk layout used by the artifact and metric stores.
 */
@Component
@RequiredArgsConstructor
public class StoragePathResolver {

    @Value("${retraining.storage.root:retraining-data}")
    private String storageRoot;

    @Value("${retraining.storage.models-dir:models}")
    private String modelsDir;

    @Value("${retraining.storage.backups-dir:model_backups}")
    private String backupsDir;

    @Value("${retraining.storage.history-file:performance_history.json}")
    private String historyFile;

    public Path getStorageRoot() {
        Path configured = (storageRoot != null && !storageRoot.isBlank())
                ? Paths.get(storageRoot)
                : Paths.get("retraining-data");

        Path resolved = configured.isAbsolute()
                ? configured
                : configured.toAbsolutePath();

        try {
            Files.createDirectories(resolved);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to create storage directory at " + resolved, e);
        }

        return resolved;
    }

    public Path getModelsDir() {
        return getStorageRoot().resolve(modelsDir);
    }

    public Path getBackupsDir() {
        return getStorageRoot().resolve(backupsDir);
    }

    public Path getHistoryFile() {
        return getStorageRoot().resolve(historyFile);
    }
}
