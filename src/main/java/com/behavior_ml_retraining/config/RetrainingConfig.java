package com.behavior_ml_retraining.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import org.hibernate.validator.constraints.time.DurationMin;

import java.time.Duration;

/**
 * Immutable retraining policy. Built once at startup by {@link RetrainingConfiguration},
 * which rejects it when a constraint below is violated.
 *
 * @param minNewSamples        behavior samples recorded since the last retrain needed to trigger a cycle
 * @param retrainIntervalHours minimum hours between two retrains (time gate)
 * @param performanceThreshold accuracy delta counted as meaningful, both for drift and for deployment
 * @param backupEnabled        snapshot production before each cycle and restore it on rejection
 * @param cycleTimeout         upper bound for training plus validation, {@link Duration#ZERO} disables it
 */
@Builder(toBuilder = true)
public record RetrainingConfig(
        @PositiveOrZero int minNewSamples,
        @PositiveOrZero int retrainIntervalHours,
        @DecimalMin("0.0") @DecimalMax("1.0") double performanceThreshold,
        boolean backupEnabled,
        @NotNull @DurationMin(millis = 1) Duration pollInterval,
        Duration errorBackoff,
        Duration stopTimeout,
        Duration cycleTimeout,
        @Positive int minTrainingRecords,
        @Positive int minPreparedRows,
        @Positive int trainingExtractLimit,
        @PositiveOrZero double errorMetricMargin,
        @DecimalMin(value = "0.0", inclusive = false) @DecimalMax(value = "1.0", inclusive = false) double validationFraction,
        long validationSeed,
        Duration driftWindow,
        @Positive int driftWindowLimit,
        @Positive int driftMinSamples,
        @Positive int driftHistoryWindow,
        boolean autoStart
) {

    public RetrainingConfig {
        errorBackoff = errorBackoff == null ? pollInterval : errorBackoff;
        stopTimeout = stopTimeout == null ? Duration.ofSeconds(5) : stopTimeout;
        cycleTimeout = cycleTimeout == null ? Duration.ZERO : cycleTimeout;
        driftWindow = driftWindow == null ? Duration.ofDays(7) : driftWindow;
    }

    /**
     * Builder pre-filled with the production defaults.
     */
    public static RetrainingConfigBuilder defaults() {
        return RetrainingConfig.builder()
                .minNewSamples(100)
                .retrainIntervalHours(24)
                .performanceThreshold(0.05)
                .backupEnabled(true)
                .pollInterval(Duration.ofHours(1))
                .errorBackoff(Duration.ofMinutes(5))
                .stopTimeout(Duration.ofSeconds(5))
                .cycleTimeout(Duration.ofMinutes(30))
                .minTrainingRecords(100)
                .minPreparedRows(50)
                .trainingExtractLimit(10_000)
                .errorMetricMargin(100.0)
                .validationFraction(0.2)
                .validationSeed(42L)
                .driftWindow(Duration.ofDays(7))
                .driftWindowLimit(1000)
                .driftMinSamples(50)
                .driftHistoryWindow(5)
                .autoStart(false);
    }

    public boolean hasCycleTimeout() {
        return !cycleTimeout.isZero() && !cycleTimeout.isNegative();
    }
}
