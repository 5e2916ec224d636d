package com.behavior_ml_retraining.exception;


public class RetrainingCancelledException extends RuntimeException {

    public RetrainingCancelledException() {
        super("Retraining cycle cancelled by stop request.");
    }

    public RetrainingCancelledException(String message) {
        super(message);
    }

    public RetrainingCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
