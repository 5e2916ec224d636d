package com.behavior_ml_retraining.service;

import com.behavior_ml_retraining.config.StoragePathResolver;
import com.behavior_ml_retraining.dto.model.BackupSnapshot;
import com.behavior_ml_retraining.dto.model.ModelArtifactSet;
import com.behavior_ml_retraining.exception.ArtifactStoreException;
import com.behavior_ml_retraining.util.FileUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import weka.classifiers.Classifier;
import weka.core.SerializationHelper;
import weka.filters.unsupervised.attribute.Standardize;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Durable home of the production model artifacts.
 *
 * <pre>
 * models/
 *   CURRENT                      id of the active release
 *   releases/release_.../        churn_model.model, spending_model.model, scaler.model
 * model_backups/
 *   models_yyyyMMdd_HHmmss_SSS/  full copy of a release
 * </pre>
 *
 * A release directory is written completely under a staging name before it is renamed into place,
 * and production only changes when {@code CURRENT} is atomically replaced, so the three files
 * always switch together.
 */
@Service
@Slf4j
public class ArtifactStore {

    public static final String CLASSIFIER_FILE = "churn_model.model";
    public static final String REGRESSOR_FILE = "spending_model.model";
    public static final String SCALER_FILE = "scaler.model";
    public static final List<String> ARTIFACT_FILES = List.of(CLASSIFIER_FILE, REGRESSOR_FILE, SCALER_FILE);

    static final String CURRENT_POINTER = "CURRENT";
    static final String RELEASES_DIR = "releases";
    static final String RELEASE_PREFIX = "release";
    static final String BACKUP_PREFIX = "models";
    static final String STAGING_PREFIX = ".staging-";
    static final int RETAINED_RELEASES = 2;

    private final Path modelsDir;
    private final Path releasesDir;
    private final Path backupsDir;
    private final Clock clock;

    private final AtomicReference<ModelArtifactSet> production = new AtomicReference<>();
    private final Object writeLock = new Object();

    @Autowired
    public ArtifactStore(StoragePathResolver pathResolver, Clock clock) {
        this(pathResolver.getModelsDir(), pathResolver.getBackupsDir(), clock);
    }

    public ArtifactStore(Path modelsDir, Path backupsDir, Clock clock) {
        this.modelsDir = modelsDir;
        this.releasesDir = modelsDir.resolve(RELEASES_DIR);
        this.backupsDir = backupsDir;
        this.clock = clock;
        try {
            Files.createDirectories(releasesDir);
            Files.createDirectories(backupsDir);
        } catch (IOException e) {
            throw new ArtifactStoreException("Unable to create model directories under " + modelsDir, e);
        }
        sweepStaging(releasesDir);
        sweepStaging(backupsDir);
    }

    /**
     * Current production set, served from memory once loaded. Empty when nothing was ever deployed.
     */
    public Optional<ModelArtifactSet> loadProduction() {
        ModelArtifactSet cached = production.get();
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<String> releaseId = currentReleaseId();
        if (releaseId.isEmpty()) {
            return Optional.empty();
        }
        ModelArtifactSet loaded = readArtifacts(releasesDir.resolve(releaseId.get())).withReleaseId(releaseId.get());
        production.compareAndSet(null, loaded);
        log.info("📦 Loaded production models from release {}", releaseId.get());
        return Optional.of(production.get());
    }

    /**
     * Promotes {@code candidate} to production. Either all three artifacts become visible or none do.
     */
    public ModelArtifactSet swapProduction(ModelArtifactSet candidate) {
        synchronized (writeLock) {
            String releaseId = publishRelease(staging -> writeArtifacts(staging, candidate));
            ModelArtifactSet deployed = candidate.withReleaseId(releaseId);
            production.set(deployed);
            log.info("🚀 Deployed new production models [release={}]", releaseId);
            pruneReleases();
            return deployed;
        }
    }

    /**
     * Copies the active release into a new timestamped snapshot. Empty when no release is deployed.
     */
    public Optional<BackupSnapshot> backup() {
        synchronized (writeLock) {
            Optional<String> releaseId = currentReleaseId();
            if (releaseId.isEmpty()) {
                log.info("📭 No production models deployed yet, nothing to back up");
                return Optional.empty();
            }
            Path source = releasesDir.resolve(releaseId.get());
            Instant now = clock.instant();
            Path target = FileUtil.uniqueChild(backupsDir, FileUtil.timestampedName(BACKUP_PREFIX, now));
            Path staging = backupsDir.resolve(STAGING_PREFIX + target.getFileName());
            try {
                FileUtil.copyDirectory(source, staging);
                requireComplete(staging);
                FileUtil.moveAtomically(staging, target);
            } catch (IOException | ArtifactStoreException e) {
                cleanUp(staging);
                throw new ArtifactStoreException("Failed to back up release " + releaseId.get(), e);
            }
            log.info("🗄️ Models backed up to {}", target);
            return Optional.of(new BackupSnapshot(target.getFileName().toString(), now, target));
        }
    }

    /**
     * Republishes the newest complete backup as production.
     *
     * @return false when there is no backup to restore from
     */
    public boolean restoreLatestBackup() {
        synchronized (writeLock) {
            List<BackupSnapshot> backups = listBackups();
            if (backups.isEmpty()) {
                log.error("❌ No backup models found for revert, production stays on its current release");
                return false;
            }
            BackupSnapshot latest = backups.get(backups.size() - 1);
            ModelArtifactSet restored = readArtifacts(latest.path());

            String releaseId = publishRelease(staging -> FileUtil.copyDirectory(latest.path(), staging));
            production.set(restored.withReleaseId(releaseId));
            log.info("↩️ Reverted to backup models from {} [release={}]", latest.id(), releaseId);
            pruneReleases();
            return true;
        }
    }

    /**
     * Complete backups, oldest first.
     */
    public List<BackupSnapshot> listBackups() {
        List<BackupSnapshot> snapshots = new ArrayList<>();
        try (Stream<Path> dirs = Files.list(backupsDir)) {
            List<Path> sorted = dirs
                    .filter(Files::isDirectory)
                    .filter(p -> p.getFileName().toString().startsWith(BACKUP_PREFIX + "_"))
                    .filter(ArtifactStore::isComplete)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
            for (Path dir : sorted) {
                snapshots.add(new BackupSnapshot(dir.getFileName().toString(),
                        Files.getLastModifiedTime(dir).toInstant(), dir));
            }
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to list backups in " + backupsDir, e);
        }
        return snapshots;
    }

    public Optional<String> currentReleaseId() {
        Path pointer = modelsDir.resolve(CURRENT_POINTER);
        if (!Files.exists(pointer)) {
            return Optional.empty();
        }
        try {
            String id = Files.readString(pointer, StandardCharsets.UTF_8).trim();
            return id.isEmpty() ? Optional.empty() : Optional.of(id);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read production pointer " + pointer, e);
        }
    }

    public Optional<Path> currentReleaseDir() {
        return currentReleaseId().map(releasesDir::resolve);
    }

    private String publishRelease(StagingWriter writer) {
        Path target = FileUtil.uniqueChild(releasesDir, FileUtil.timestampedName(RELEASE_PREFIX, clock.instant()));
        Path staging = releasesDir.resolve(STAGING_PREFIX + target.getFileName());
        try {
            Files.createDirectories(staging);
            writer.write(staging);
            requireComplete(staging);
            FileUtil.moveAtomically(staging, target);
            FileUtil.writeStringAtomically(modelsDir.resolve(CURRENT_POINTER), target.getFileName().toString());
        } catch (Exception e) {
            cleanUp(staging);
            throw new ArtifactStoreException("Failed to publish release " + target.getFileName(), e);
        }
        return target.getFileName().toString();
    }

    private void writeArtifacts(Path dir, ModelArtifactSet artifacts) throws Exception {
        if (artifacts.classifier() == null || artifacts.regressor() == null || artifacts.featureScaler() == null) {
            throw new IllegalArgumentException("Candidate artifact set is incomplete");
        }
        SerializationHelper.write(dir.resolve(CLASSIFIER_FILE).toString(), artifacts.classifier());
        SerializationHelper.write(dir.resolve(REGRESSOR_FILE).toString(), artifacts.regressor());
        SerializationHelper.write(dir.resolve(SCALER_FILE).toString(), artifacts.featureScaler());
    }

    private ModelArtifactSet readArtifacts(Path dir) {
        try {
            requireComplete(dir);
            Classifier classifier = (Classifier) SerializationHelper.read(dir.resolve(CLASSIFIER_FILE).toString());
            Classifier regressor = (Classifier) SerializationHelper.read(dir.resolve(REGRESSOR_FILE).toString());
            Standardize scaler = (Standardize) SerializationHelper.read(dir.resolve(SCALER_FILE).toString());
            return new ModelArtifactSet(null, classifier, regressor, scaler);
        } catch (ArtifactStoreException e) {
            throw e;
        } catch (Exception e) {
            throw new ArtifactStoreException("Failed to read model artifacts from " + dir, e);
        }
    }

    private void pruneReleases() {
        Optional<String> current = currentReleaseId();
        try (Stream<Path> dirs = Files.list(releasesDir)) {
            List<Path> releases = dirs
                    .filter(Files::isDirectory)
                    .filter(p -> p.getFileName().toString().startsWith(RELEASE_PREFIX + "_"))
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .toList();
            int kept = 0;
            for (Path release : releases) {
                boolean isCurrent = current.isPresent() && current.get().equals(release.getFileName().toString());
                if (isCurrent || kept < RETAINED_RELEASES - 1) {
                    if (!isCurrent) {
                        kept++;
                    }
                    continue;
                }
                FileUtil.deleteRecursively(release);
                log.debug("🧹 Pruned superseded release {}", release.getFileName());
            }
        } catch (IOException e) {
            log.warn("⚠️ Failed to prune old releases in {}: {}", releasesDir, e.getMessage());
        }
    }

    /**
     * Removes staging directories left behind by a write that never reached its rename.
     */
    private static void sweepStaging(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            List<Path> stale = entries
                    .filter(p -> p.getFileName().toString().startsWith(STAGING_PREFIX))
                    .toList();
            for (Path staging : stale) {
                log.info("🧹 Removing stale staging directory {}", staging);
                cleanUp(staging);
            }
        } catch (IOException e) {
            log.warn("⚠️ Failed to scan {} for stale staging directories: {}", dir, e.getMessage());
        }
    }

    private static void requireComplete(Path dir) {
        if (!isComplete(dir)) {
            throw new ArtifactStoreException("Incomplete model artifact set in " + dir);
        }
    }

    private static boolean isComplete(Path dir) {
        return ARTIFACT_FILES.stream().allMatch(name -> Files.isRegularFile(dir.resolve(name)));
    }

    private static void cleanUp(Path staging) {
        try {
            FileUtil.deleteRecursively(staging);
        } catch (IOException e) {
            log.warn("⚠️ Could not remove staging directory {}: {}", staging, e.getMessage());
        }
    }

    @FunctionalInterface
    private interface StagingWriter {
        void write(Path staging) throws Exception;
    }
}
