package com.behavior_ml_retraining.enumeration;

public enum RetrainingOutcomeEnum {
    DEPLOYED,
    SKIPPED,
    REJECTED,
    FAILED,
    BACKUP_FAILED,
    TIMED_OUT,
    CANCELLED
}
