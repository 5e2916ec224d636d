package com.behavior_ml_retraining.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class RetrainingConfiguration {

    private final Validator validator;

    @Value("${retraining.min-new-samples:100}")
    private int minNewSamples;

    @Value("${retraining.retrain-interval-hours:24}")
    private int retrainIntervalHours;

    @Value("${retraining.performance-threshold:0.05}")
    private double performanceThreshold;

    @Value("${retraining.backup-enabled:true}")
    private boolean backupEnabled;

    @Value("${retraining.poll-interval:PT1H}")
    private Duration pollInterval;

    @Value("${retraining.error-backoff:PT5M}")
    private Duration errorBackoff;

    @Value("${retraining.stop-timeout:PT5S}")
    private Duration stopTimeout;

    @Value("${retraining.cycle-timeout:PT30M}")
    private Duration cycleTimeout;

    @Value("${retraining.min-training-records:100}")
    private int minTrainingRecords;

    @Value("${retraining.min-prepared-rows:50}")
    private int minPreparedRows;

    @Value("${retraining.training-extract-limit:10000}")
    private int trainingExtractLimit;

    @Value("${retraining.error-metric-margin:100.0}")
    private double errorMetricMargin;

    @Value("${retraining.validation.fraction:0.2}")
    private double validationFraction;

    @Value("${retraining.validation.seed:42}")
    private long validationSeed;

    @Value("${retraining.drift.window:P7D}")
    private Duration driftWindow;

    @Value("${retraining.drift.window-limit:1000}")
    private int driftWindowLimit;

    @Value("${retraining.drift.min-samples:50}")
    private int driftMinSamples;

    @Value("${retraining.drift.history-window:5}")
    private int driftHistoryWindow;

    @Value("${retraining.auto-start:false}")
    private boolean autoStart;

    @Bean
    public RetrainingConfig retrainingConfig() {
        RetrainingConfig config = RetrainingConfig.builder()
                .minNewSamples(minNewSamples)
                .retrainIntervalHours(retrainIntervalHours)
                .performanceThreshold(performanceThreshold)
                .backupEnabled(backupEnabled)
                .pollInterval(pollInterval)
                .errorBackoff(errorBackoff)
                .stopTimeout(stopTimeout)
                .cycleTimeout(cycleTimeout)
                .minTrainingRecords(minTrainingRecords)
                .minPreparedRows(minPreparedRows)
                .trainingExtractLimit(trainingExtractLimit)
                .errorMetricMargin(errorMetricMargin)
                .validationFraction(validationFraction)
                .validationSeed(validationSeed)
                .driftWindow(driftWindow)
                .driftWindowLimit(driftWindowLimit)
                .driftMinSamples(driftMinSamples)
                .driftHistoryWindow(driftHistoryWindow)
                .autoStart(autoStart)
                .build();
        Set<ConstraintViolation<RetrainingConfig>> violations = validator.validate(config);
        if (!violations.isEmpty()) {
            violations.forEach(v -> log.error("❌ Invalid retraining property {}: {} (was {})",
                    v.getPropertyPath(), v.getMessage(), v.getInvalidValue()));
            throw new ConstraintViolationException("Invalid retraining policy", violations);
        }
        log.info("⚙️ Retraining policy: minNewSamples={}, intervalHours={}, threshold={}, backups={}, poll={}",
                config.minNewSamples(), config.retrainIntervalHours(), config.performanceThreshold(),
                config.backupEnabled(), config.pollInterval());
        return config;
    }

    @Bean
    public Clock retrainingClock() {
        return Clock.systemUTC();
    }
}
