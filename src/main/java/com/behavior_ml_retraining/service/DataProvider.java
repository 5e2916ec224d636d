package com.behavior_ml_retraining.service;

import com.behavior_ml_retraining.dto.behavior.BehaviorRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Boundary to the behavioral event store the models learn from.
 */
public interface DataProvider {

    /**
     * Number of behavior samples recorded strictly after {@code since}.
     */
    long countNewSamplesSince(Instant since);

    /**
     * Most recent behavior records, newest first, each carrying the user's cumulative activity.
     */
    List<BehaviorRecord> loadTrainingExtract(int limit);

    /**
     * Recent labeled window used to score the production models for drift, newest first.
     */
    List<BehaviorRecord> loadValidationWindow(Instant since, int limit);

    /**
     * Latest cumulative activity of one user, empty when the user has no recorded behavior.
     */
    Optional<BehaviorRecord> loadUserProfile(long userId);
}
