package com.behavior_ml_retraining.unit_tests.service;

import com.behavior_ml_retraining.dto.feature.FeatureRow;
import com.behavior_ml_retraining.dto.feature.FeatureTable;
import com.behavior_ml_retraining.dto.model.BehaviorPrediction;
import com.behavior_ml_retraining.dto.train.EvaluationMetrics;
import com.behavior_ml_retraining.dto.train.TrainingResult;
import com.behavior_ml_retraining.exception.ModelTrainingException;
import com.behavior_ml_retraining.service.ModelTrainer;
import com.behavior_ml_retraining.util.BehaviorFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ModelTrainerTest {

    private final ModelTrainer modelTrainer = new ModelTrainer(10, 42);

    @Test
    void shouldTrainCandidate_WithValidSelfMetrics() {
        TrainingResult result = modelTrainer.train(BehaviorFixtures.table(100));

        assertThat(result.candidate().classifier()).isNotNull();
        assertThat(result.candidate().regressor()).isNotNull();
        assertThat(result.candidate().featureScaler()).isNotNull();
        assertThat(result.candidate().releaseId()).isNull();
        assertThat(result.trainMetrics().isValid()).isTrue();
        assertThat(result.trainMetrics().samplesUsed()).isEqualTo(30);
    }

    @Test
    void shouldEvaluateOnHoldout_WithAccuracyInRange() {
        FeatureTable.Split split = BehaviorFixtures.table(150).split(0.2, 42L);
        TrainingResult result = modelTrainer.train(split.training());

        EvaluationMetrics metrics = modelTrainer.evaluate(result.candidate(), split.holdout());

        assertThat(metrics.accuracy()).isBetween(0.0, 1.0);
        assertThat(metrics.errorMetric()).isGreaterThanOrEqualTo(0.0);
        assertThat(metrics.samplesUsed()).isEqualTo(split.holdout().size());
        // purchase count alone separates churners in the fixture data
        assertThat(metrics.accuracy()).isGreaterThan(0.8);
    }

    @Test
    void shouldPredictChurnAndSpending_ForSingleRow() {
        TrainingResult result = modelTrainer.train(BehaviorFixtures.table(120));
        FeatureRow buyer = new FeatureRow(380, 4, 5, 6, 380, false, 400);

        BehaviorPrediction prediction = modelTrainer.predict(result.candidate(), 9L, buyer);

        assertThat(prediction.userId()).isEqualTo(9L);
        assertThat(prediction.churnProbability()).isBetween(0.0, 1.0);
        assertThat(prediction.predictedSpending()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    void shouldThrow_WhenTableTooSmall() {
        assertThatThrownBy(() -> modelTrainer.train(BehaviorFixtures.table(1)))
                .isInstanceOf(ModelTrainingException.class);
        assertThatThrownBy(() -> modelTrainer.train(new FeatureTable(List.of())))
                .isInstanceOf(ModelTrainingException.class);
    }

    @Test
    void shouldThrow_WhenEvaluatingEmptyTable() {
        TrainingResult result = modelTrainer.train(BehaviorFixtures.table(60));

        assertThatThrownBy(() -> modelTrainer.evaluate(result.candidate(), FeatureTable.empty()))
                .isInstanceOf(ModelTrainingException.class);
    }
}
