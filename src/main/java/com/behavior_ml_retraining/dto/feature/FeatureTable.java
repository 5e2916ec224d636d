package com.behavior_ml_retraining.dto.feature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Fixed-width numeric feature table with the two derived label columns.
 */
public final class FeatureTable {

    private final List<FeatureRow> rows;

    public FeatureTable(List<FeatureRow> rows) {
        this.rows = List.copyOf(rows);
    }

    public static FeatureTable empty() {
        return new FeatureTable(List.of());
    }

    public List<FeatureRow> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Shuffles a copy of the rows with the given seed and cuts off {@code holdoutFraction} of them.
     * The holdout always keeps at least one row when the table has two or more.
     */
    public Split split(double holdoutFraction, long seed) {
        List<FeatureRow> shuffled = new ArrayList<>(rows);
        Collections.shuffle(shuffled, new Random(seed));

        int holdoutSize = (int) Math.round(shuffled.size() * holdoutFraction);
        if (shuffled.size() >= 2) {
            holdoutSize = Math.max(1, Math.min(holdoutSize, shuffled.size() - 1));
        } else {
            holdoutSize = 0;
        }
        int trainSize = shuffled.size() - holdoutSize;

        return new Split(
                new FeatureTable(shuffled.subList(0, trainSize)),
                new FeatureTable(shuffled.subList(trainSize, shuffled.size()))
        );
    }

    public record Split(FeatureTable training, FeatureTable holdout) {}
}
