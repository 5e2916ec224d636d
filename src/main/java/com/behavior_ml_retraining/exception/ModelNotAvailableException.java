package com.behavior_ml_retraining.exception;


public class ModelNotAvailableException extends RuntimeException {

    public ModelNotAvailableException() {
        super("No production models are deployed.");
    }

    public ModelNotAvailableException(String message) {
        super(message);
    }

    public ModelNotAvailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
