package com.behavior_ml_retraining.dto.train;

import com.behavior_ml_retraining.dto.model.ModelArtifactSet;

public record TrainingResult(ModelArtifactSet candidate, EvaluationMetrics trainMetrics) {}
