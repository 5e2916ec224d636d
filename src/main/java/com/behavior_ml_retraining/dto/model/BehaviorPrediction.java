package com.behavior_ml_retraining.dto.model;

public record BehaviorPrediction(Long userId, double churnProbability, double predictedSpending) {}
