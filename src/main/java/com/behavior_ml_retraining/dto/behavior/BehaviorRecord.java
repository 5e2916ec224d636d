package com.behavior_ml_retraining.dto.behavior;

import lombok.Builder;

import java.time.Instant;

/**
 * One behavioral event joined with the user's cumulative activity up to and including that event.
 * Numeric fields are nullable; missing values are filled by the feature preparer.
 */
@Builder
public record BehaviorRecord(
        Long userId,
        String action,
        Double sessionDuration,
        Long productId,
        Instant createdAt,
        Long purchaseCount,
        Long cartAdds,
        Long pageViews,
        Double avgSessionDuration
) {}
