package com.behavior_ml_retraining.unit_tests.service;

import com.behavior_ml_retraining.dto.model.BackupSnapshot;
import com.behavior_ml_retraining.dto.model.ModelArtifactSet;
import com.behavior_ml_retraining.exception.ArtifactStoreException;
import com.behavior_ml_retraining.service.ArtifactStore;
import com.behavior_ml_retraining.service.ModelTrainer;
import com.behavior_ml_retraining.util.BehaviorFixtures;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import weka.classifiers.trees.RandomForest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class ArtifactStoreTest {

    private static ModelArtifactSet trained;
    private static ModelArtifactSet retrained;

    @TempDir
    Path tempDir;

    private ArtifactStore artifactStore;

    @BeforeAll
    static void trainModels() {
        ModelTrainer trainer = new ModelTrainer(5, 42);
        trained = trainer.train(BehaviorFixtures.table(80)).candidate();
        retrained = new ModelTrainer(5, 7).train(BehaviorFixtures.table(120)).candidate();
    }

    @BeforeEach
    void setUp() {
        artifactStore = newStore(Clock.fixed(Instant.parse("2026-10-17T10:15:00Z"), ZoneOffset.UTC));
    }

    private ArtifactStore newStore(Clock clock) {
        return new ArtifactStore(tempDir.resolve("models"), tempDir.resolve("model_backups"), clock);
    }

    @Test
    void shouldReturnEmpty_WhenNothingDeployed() {
        assertThat(artifactStore.loadProduction()).isEmpty();
        assertThat(artifactStore.currentReleaseId()).isEmpty();
        assertThat(artifactStore.listBackups()).isEmpty();
    }

    @Test
    void shouldWriteAllThreeArtifacts_WhenSwapped() {
        ModelArtifactSet deployed = artifactStore.swapProduction(trained);

        Path releaseDir = artifactStore.currentReleaseDir().orElseThrow();
        assertThat(deployed.releaseId()).isEqualTo(releaseDir.getFileName().toString());
        for (String file : ArtifactStore.ARTIFACT_FILES) {
            assertThat(releaseDir.resolve(file)).isRegularFile();
        }
        assertThat(artifactStore.loadProduction()).containsSame(deployed);
    }

    @Test
    void shouldLoadProductionFromDisk_WhenStoreIsReopened() {
        ModelArtifactSet deployed = artifactStore.swapProduction(trained);

        ArtifactStore reopened = newStore(Clock.systemUTC());
        Optional<ModelArtifactSet> loaded = reopened.loadProduction();

        assertThat(loaded).isPresent();
        assertThat(loaded.get().releaseId()).isEqualTo(deployed.releaseId());
        assertThat(loaded.get().classifier()).isInstanceOf(RandomForest.class);
        assertThat(loaded.get().featureScaler()).isNotNull();
    }

    @Test
    void shouldKeepPreviousRelease_WhenCandidateCannotBeWritten() {
        ModelArtifactSet deployed = artifactStore.swapProduction(trained);
        ModelArtifactSet broken = new ModelArtifactSet(null, null, null, null);

        assertThatThrownBy(() -> artifactStore.swapProduction(broken))
                .isInstanceOf(ArtifactStoreException.class);

        assertThat(artifactStore.currentReleaseId()).contains(deployed.releaseId());
        assertThat(artifactStore.loadProduction()).containsSame(deployed);
        assertThat(newStore(Clock.systemUTC()).loadProduction()).isPresent();
    }

    @Test
    void shouldRemoveLeftoverStagingDirectories_WhenStoreIsReopened() throws IOException {
        // Arrange
        ModelArtifactSet deployed = artifactStore.swapProduction(trained);
        Path releaseStaging = tempDir.resolve("models/releases/.staging-release_20261017_101500_999");
        Path backupStaging = tempDir.resolve("model_backups/.staging-models_20261017_101500_999");
        Files.createDirectories(releaseStaging);
        Files.writeString(releaseStaging.resolve(ArtifactStore.CLASSIFIER_FILE), "partial");
        Files.createDirectories(backupStaging);

        // Act
        ArtifactStore reopened = newStore(Clock.systemUTC());

        // Assert
        assertThat(releaseStaging).doesNotExist();
        assertThat(backupStaging).doesNotExist();
        assertThat(reopened.currentReleaseId()).contains(deployed.releaseId());
        assertThat(reopened.loadProduction()).isPresent();
    }

    @Nested
    class Backups {

        @Test
        void shouldSkipBackup_WhenNothingDeployed() {
            assertThat(artifactStore.backup()).isEmpty();
            assertThat(artifactStore.listBackups()).isEmpty();
        }

        @Test
        void shouldReturnFalse_WhenRestoringWithoutBackups() {
            ModelArtifactSet deployed = artifactStore.swapProduction(trained);

            assertThat(artifactStore.restoreLatestBackup()).isFalse();
            assertThat(artifactStore.currentReleaseId()).contains(deployed.releaseId());
        }

        @Test
        void shouldReproduceProductionBytes_WhenBackupIsRestored() throws IOException {
            // Arrange
            artifactStore.swapProduction(trained);
            Map<String, byte[]> before = readArtifacts(artifactStore.currentReleaseDir().orElseThrow());

            // Act
            BackupSnapshot snapshot = artifactStore.backup().orElseThrow();
            boolean restored = artifactStore.restoreLatestBackup();

            // Assert
            assertThat(restored).isTrue();
            assertThat(snapshot.id()).startsWith("models_20261017_101500_000");
            Map<String, byte[]> after = readArtifacts(artifactStore.currentReleaseDir().orElseThrow());
            for (String file : ArtifactStore.ARTIFACT_FILES) {
                assertThat(after.get(file)).isEqualTo(before.get(file));
            }
        }

        @Test
        void shouldRestoreNewestBackup_WhenSeveralExist() throws IOException {
            // Arrange
            artifactStore.swapProduction(trained);
            artifactStore.backup();
            artifactStore.swapProduction(retrained);
            Map<String, byte[]> retrainedBytes = readArtifacts(artifactStore.currentReleaseDir().orElseThrow());
            artifactStore.backup();
            artifactStore.swapProduction(trained);

            // Act
            boolean restored = artifactStore.restoreLatestBackup();

            // Assert
            assertThat(restored).isTrue();
            List<BackupSnapshot> backups = artifactStore.listBackups();
            assertThat(backups).hasSize(2);
            assertThat(backups).extracting(BackupSnapshot::id).isSorted();
            Map<String, byte[]> current = readArtifacts(artifactStore.currentReleaseDir().orElseThrow());
            for (String file : ArtifactStore.ARTIFACT_FILES) {
                assertThat(current.get(file)).isEqualTo(retrainedBytes.get(file));
            }
        }

        @Test
        void shouldIgnoreIncompleteBackupDirectories() throws IOException {
            artifactStore.swapProduction(trained);
            artifactStore.backup();
            Path partial = tempDir.resolve("model_backups").resolve("models_29991231_235959_999");
            Files.createDirectories(partial);
            Files.writeString(partial.resolve(ArtifactStore.CLASSIFIER_FILE), "half written");

            assertThat(artifactStore.listBackups()).hasSize(1);
            assertThat(artifactStore.restoreLatestBackup()).isTrue();
        }
    }

    private static Map<String, byte[]> readArtifacts(Path dir) throws IOException {
        Map<String, byte[]> bytes = new HashMap<>();
        for (String file : ArtifactStore.ARTIFACT_FILES) {
            bytes.put(file, Files.readAllBytes(dir.resolve(file)));
        }
        return bytes;
    }
}
