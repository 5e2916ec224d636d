package com.behavior_ml_retraining.exception;


public class ModelTrainingException extends RuntimeException {

    public ModelTrainingException(String message) {
        super(message);
    }

    public ModelTrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
