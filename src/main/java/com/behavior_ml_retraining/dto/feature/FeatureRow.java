package com.behavior_ml_retraining.dto.feature;

public record FeatureRow(
        double sessionDuration,
        double purchaseCount,
        double cartAdds,
        double pageViews,
        double avgSessionDuration,
        boolean willChurn,
        double spendingScore
) {

    public static final String[] FEATURE_NAMES = {
            "session_duration", "purchase_count", "cart_adds", "page_views", "avg_session_duration"
    };

    public double[] features() {
        return new double[]{sessionDuration, purchaseCount, cartAdds, pageViews, avgSessionDuration};
    }
}
