package com.behavior_ml_retraining.dto.retraining;

import com.behavior_ml_retraining.dto.train.EvaluationMetrics;
import com.behavior_ml_retraining.enumeration.CycleTriggerEnum;
import com.behavior_ml_retraining.enumeration.RetrainingOutcomeEnum;

import java.time.Instant;

public record CycleResult(
        CycleTriggerEnum trigger,
        RetrainingOutcomeEnum outcome,
        EvaluationMetrics metrics,
        String message,
        Instant finishedAt
) {

    public boolean succeeded() {
        return outcome == RetrainingOutcomeEnum.DEPLOYED;
    }
}
