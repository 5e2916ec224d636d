package com.behavior_ml_retraining.enumeration;

import java.util.Arrays;
import java.util.Optional;

public enum BehaviorActionEnum {
    VIEW("view"),
    CART_ADD("cart_add"),
    PURCHASE("purchase");

    private final String value;

    BehaviorActionEnum(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<BehaviorActionEnum> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(e -> e.value.equalsIgnoreCase(value) || e.name().equalsIgnoreCase(value))
                .findFirst();
    }
}
