package com.behavior_ml_retraining.service;

import com.behavior_ml_retraining.dto.behavior.BehaviorRecord;
import com.behavior_ml_retraining.dto.feature.FeatureRow;
import com.behavior_ml_retraining.dto.feature.FeatureTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw behavior records into the numeric feature table both models are trained on.
 * Missing numeric values become zero; labels are derived from purchase activity.
 */
@Component
@Slf4j
public class FeaturePreparer {

    public static final double SPENDING_PER_PURCHASE = 100.0;
    public static final double MAX_SPENDING_SCORE = 1000.0;

    public FeatureTable prepare(List<BehaviorRecord> records) {
        if (records == null || records.isEmpty()) {
            return FeatureTable.empty();
        }
        List<FeatureRow> rows = new ArrayList<>(records.size());
        for (BehaviorRecord record : records) {
            if (record == null) {
                continue;
            }
            rows.add(toRow(record));
        }
        log.debug("🔧 Prepared {} feature rows from {} records", rows.size(), records.size());
        return new FeatureTable(rows);
    }

    public FeatureRow toRow(BehaviorRecord record) {
        double purchaseCount = orZero(record.purchaseCount());
        return new FeatureRow(
                orZero(record.sessionDuration()),
                purchaseCount,
                orZero(record.cartAdds()),
                orZero(record.pageViews()),
                orZero(record.avgSessionDuration()),
                purchaseCount == 0.0,
                spendingScore(purchaseCount)
        );
    }

    static double spendingScore(double purchaseCount) {
        return Math.max(0.0, Math.min(MAX_SPENDING_SCORE, purchaseCount * SPENDING_PER_PURCHASE));
    }

    private static double orZero(Number value) {
        if (value == null) {
            return 0.0;
        }
        double d = value.doubleValue();
        return Double.isFinite(d) ? d : 0.0;
    }
}
