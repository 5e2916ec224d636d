package com.behavior_ml_retraining.exception;


public class ArtifactStoreException extends RuntimeException {

    public ArtifactStoreException() {
        super("Model artifact store operation failed.");
    }

    public ArtifactStoreException(String message) {
        super(message);
    }

    public ArtifactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
