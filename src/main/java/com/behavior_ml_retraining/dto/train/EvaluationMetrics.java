package com.behavior_ml_retraining.dto.train;

/**
 * Scores of an artifact set on a feature table: classifier accuracy in [0, 1],
 * regressor mean squared error and the number of rows scored.
 */
public record EvaluationMetrics(double accuracy, double errorMetric, int samplesUsed) {

    public boolean isValid() {
        return !Double.isNaN(accuracy)
                && accuracy >= 0.0 && accuracy <= 1.0
                && Double.isFinite(errorMetric)
                && errorMetric >= 0.0
                && samplesUsed > 0;
    }
}
