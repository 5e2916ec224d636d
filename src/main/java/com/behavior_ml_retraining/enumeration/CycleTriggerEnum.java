package com.behavior_ml_retraining.enumeration;

public enum CycleTriggerEnum {
    SCHEDULED,
    FORCED
}
