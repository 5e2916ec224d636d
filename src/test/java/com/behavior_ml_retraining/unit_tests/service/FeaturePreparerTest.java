package com.behavior_ml_retraining.unit_tests.service;

import com.behavior_ml_retraining.dto.behavior.BehaviorRecord;
import com.behavior_ml_retraining.dto.feature.FeatureRow;
import com.behavior_ml_retraining.dto.feature.FeatureTable;
import com.behavior_ml_retraining.service.FeaturePreparer;
import com.behavior_ml_retraining.util.BehaviorFixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FeaturePreparerTest {

    private final FeaturePreparer featurePreparer = new FeaturePreparer();

    @Test
    void shouldFillMissingNumbersWithZero() {
        BehaviorRecord record = BehaviorRecord.builder().userId(1L).action("view").build();

        FeatureRow row = featurePreparer.toRow(record);

        assertThat(row.features()).containsExactly(0.0, 0.0, 0.0, 0.0, 0.0);
        assertThat(row.willChurn()).isTrue();
        assertThat(row.spendingScore()).isZero();
    }

    @Test
    void shouldTreatNonFiniteValuesAsZero() {
        BehaviorRecord record = BehaviorRecord.builder()
                .sessionDuration(Double.NaN)
                .avgSessionDuration(Double.POSITIVE_INFINITY)
                .purchaseCount(2L)
                .build();

        FeatureRow row = featurePreparer.toRow(record);

        assertThat(row.sessionDuration()).isZero();
        assertThat(row.avgSessionDuration()).isZero();
        assertThat(row.purchaseCount()).isEqualTo(2.0);
    }

    @Test
    void shouldDeriveLabelsFromPurchases() {
        FeatureRow buyer = featurePreparer.toRow(BehaviorRecord.builder().purchaseCount(3L).build());
        FeatureRow bigSpender = featurePreparer.toRow(BehaviorRecord.builder().purchaseCount(25L).build());

        assertThat(buyer.willChurn()).isFalse();
        assertThat(buyer.spendingScore()).isEqualTo(300.0);
        assertThat(bigSpender.spendingScore()).isEqualTo(FeaturePreparer.MAX_SPENDING_SCORE);
    }

    @Test
    void shouldSkipNullRecords_AndReturnEmptyTableForNoInput() {
        List<BehaviorRecord> records = new ArrayList<>(Arrays.asList(null, BehaviorRecord.builder().purchaseCount(1L).build()));

        assertThat(featurePreparer.prepare(records).size()).isEqualTo(1);
        assertThat(featurePreparer.prepare(List.of()).isEmpty()).isTrue();
        assertThat(featurePreparer.prepare(null).isEmpty()).isTrue();
    }

    @Test
    void shouldBeDeterministic() {
        List<BehaviorRecord> records = BehaviorFixtures.records(30);

        assertThat(featurePreparer.prepare(records).rows()).isEqualTo(featurePreparer.prepare(records).rows());
    }

    @Test
    void shouldSplitReproducibly_WithSameSeed() {
        FeatureTable table = BehaviorFixtures.table(100);

        FeatureTable.Split first = table.split(0.2, 42L);
        FeatureTable.Split second = table.split(0.2, 42L);

        assertThat(first.holdout().size()).isEqualTo(20);
        assertThat(first.training().size()).isEqualTo(80);
        assertThat(first.holdout().rows()).isEqualTo(second.holdout().rows());
    }

    @Test
    void shouldKeepOneHoldoutRow_WhenTableIsTiny() {
        FeatureTable table = BehaviorFixtures.table(2);

        FeatureTable.Split split = table.split(0.2, 42L);

        assertThat(split.holdout().size()).isEqualTo(1);
        assertThat(split.training().size()).isEqualTo(1);
    }
}
