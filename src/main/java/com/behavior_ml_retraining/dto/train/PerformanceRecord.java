package com.behavior_ml_retraining.dto.train;

import java.time.Instant;

public record PerformanceRecord(
        double accuracy,
        double errorMetric,
        Instant timestamp,
        int samplesUsed
) {

    public static final double BASELINE_ACCURACY = 0.5;
    public static final double BASELINE_ERROR_METRIC = 1000.0;

    /**
     * Reference used when no model has been deployed yet.
     */
    public static PerformanceRecord baseline(Instant now) {
        return new PerformanceRecord(BASELINE_ACCURACY, BASELINE_ERROR_METRIC, now, 0);
    }

    public static PerformanceRecord of(EvaluationMetrics metrics, Instant timestamp) {
        return new PerformanceRecord(metrics.accuracy(), metrics.errorMetric(), timestamp, metrics.samplesUsed());
    }
}
