package com.behavior_ml_retraining.service;

import com.behavior_ml_retraining.dto.behavior.BehaviorRecord;
import com.behavior_ml_retraining.dto.feature.FeatureRow;
import com.behavior_ml_retraining.dto.model.BehaviorPrediction;
import com.behavior_ml_retraining.dto.model.ModelArtifactSet;
import com.behavior_ml_retraining.exception.ModelNotAvailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Serving path. Reads only the cached production set, so it never waits on a running retraining cycle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BehaviorPredictionService {

    private final ArtifactStore artifactStore;
    private final DataProvider dataProvider;
    private final FeaturePreparer featurePreparer;
    private final ModelTrainer modelTrainer;

    public BehaviorPrediction predict(long userId) {
        ModelArtifactSet production = artifactStore.loadProduction()
                .orElseThrow(() -> new ModelNotAvailableException("No production models deployed yet"));

        BehaviorRecord profile = dataProvider.loadUserProfile(userId)
                .orElseGet(() -> {
                    log.debug("👤 No behavior recorded for user {}, predicting from an empty profile", userId);
                    return BehaviorRecord.builder().userId(userId).build();
                });

        FeatureRow row = featurePreparer.toRow(profile);
        BehaviorPrediction prediction = modelTrainer.predict(production, userId, row);
        log.debug("🔮 Prediction for user {} [release={}]: churn={}, spending={}", userId,
                production.releaseId(), prediction.churnProbability(), prediction.predictedSpending());
        return prediction;
    }
}
