package com.behavior_ml_retraining.dto.model;

import weka.classifiers.Classifier;
import weka.filters.unsupervised.attribute.Standardize;

/**
 * Churn classifier, spending regressor and the feature scaler both were fitted with.
 * {@code releaseId} is null for a candidate that has not been written to the store.
 */
public record ModelArtifactSet(
        String releaseId,
        Classifier classifier,
        Classifier regressor,
        Standardize featureScaler
) {

    public ModelArtifactSet withReleaseId(String id) {
        return new ModelArtifactSet(id, classifier, regressor, featureScaler);
    }
}
