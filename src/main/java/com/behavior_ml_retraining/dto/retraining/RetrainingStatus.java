package com.behavior_ml_retraining.dto.retraining;

import com.behavior_ml_retraining.enumeration.RetrainingOutcomeEnum;
import lombok.Builder;

import java.time.Instant;

@Builder
public record RetrainingStatus(
        boolean running,
        Instant lastRetrainTime,
        long newSampleCount,
        int minSamplesNeeded,
        int historyLength,
        int nextCheckHours,
        boolean cycleInProgress,
        RetrainingOutcomeEnum lastOutcome
) {}
