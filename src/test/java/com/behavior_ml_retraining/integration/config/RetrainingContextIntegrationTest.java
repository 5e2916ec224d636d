package com.behavior_ml_retraining.integration.config;

import com.behavior_ml_retraining.config.RetrainingConfig;
import com.behavior_ml_retraining.config.StoragePathResolver;
import com.behavior_ml_retraining.service.ArtifactStore;
import com.behavior_ml_retraining.service.MetricStore;
import com.behavior_ml_retraining.service.orchestrator.RetrainingOrchestrator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

/**
 * Boots the full application on the H2 test profile and checks the wiring of the retraining beans.
 */
@SpringBootTest(properties = {
        "retraining.auto-start=true",
        "retraining.poll-interval=PT1H",
        "retraining.min-new-samples=250",
        "retraining.performance-threshold=0.02",
        "retraining.drift.window=P3D",
        "retraining.drift.history-window=8"
})
@DirtiesContext
class RetrainingContextIntegrationTest {

    @TempDir
    static Path storageRoot;

    @DynamicPropertySource
    static void storageProperties(DynamicPropertyRegistry registry) {
        registry.add("retraining.storage.root", () -> storageRoot.toString());
    }

    @Autowired
    private RetrainingConfig retrainingConfig;

    @Autowired
    private Clock clock;

    @Autowired
    private StoragePathResolver pathResolver;

    @Autowired
    private ArtifactStore artifactStore;

    @Autowired
    private MetricStore metricStore;

    @Autowired
    private RetrainingOrchestrator retrainingOrchestrator;

    @Test
    void shouldBindRetrainingPolicy_FromProperties() {
        assertThat(retrainingConfig.minNewSamples()).isEqualTo(250);
        assertThat(retrainingConfig.performanceThreshold()).isEqualTo(0.02);
        assertThat(retrainingConfig.pollInterval()).isEqualTo(Duration.ofHours(1));
        assertThat(retrainingConfig.driftWindow()).isEqualTo(Duration.ofDays(3));
        assertThat(retrainingConfig.driftHistoryWindow()).isEqualTo(8);
        assertThat(retrainingConfig.cycleTimeout()).isEqualTo(Duration.ZERO);
        assertThat(retrainingConfig.autoStart()).isTrue();

        // untouched keys keep their defaults
        assertThat(retrainingConfig.retrainIntervalHours()).isEqualTo(24);
        assertThat(retrainingConfig.errorBackoff()).isEqualTo(Duration.ofMinutes(5));
        assertThat(retrainingConfig.validationFraction()).isEqualTo(0.2);
        assertThat(retrainingConfig.errorMetricMargin()).isEqualTo(100.0);
        assertThat(retrainingConfig.backupEnabled()).isTrue();
    }

    @Test
    void shouldProvideUtcClock() {
        assertThat(clock.getZone()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void shouldCreateStoresUnderConfiguredRoot() {
        assertThat(pathResolver.getStorageRoot()).isEqualTo(storageRoot.toAbsolutePath());
        assertThat(pathResolver.getModelsDir().resolve("releases")).isDirectory();
        assertThat(pathResolver.getBackupsDir()).isDirectory();
        assertThat(artifactStore.loadProduction()).isEmpty();
        assertThat(metricStore.isEmpty()).isTrue();
    }

    @Test
    void shouldStartMonitor_WhenAutoStartIsEnabled() {
        assertThat(retrainingOrchestrator.isRunning()).isTrue();
        assertThat(retrainingOrchestrator.getStatus().running()).isTrue();
        assertThat(retrainingOrchestrator.getStatus().minSamplesNeeded()).isEqualTo(250);
    }
}
