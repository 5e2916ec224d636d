package com.behavior_ml_retraining.service.orchestrator;

import com.behavior_ml_retraining.config.RetrainingConfig;
import com.behavior_ml_retraining.dto.behavior.BehaviorRecord;
import com.behavior_ml_retraining.dto.feature.FeatureTable;
import com.behavior_ml_retraining.dto.model.ModelArtifactSet;
import com.behavior_ml_retraining.dto.retraining.CycleResult;
import com.behavior_ml_retraining.dto.retraining.RetrainingStatus;
import com.behavior_ml_retraining.dto.train.EvaluationMetrics;
import com.behavior_ml_retraining.dto.train.PerformanceRecord;
import com.behavior_ml_retraining.dto.train.TrainingResult;
import com.behavior_ml_retraining.enumeration.CycleTriggerEnum;
import com.behavior_ml_retraining.enumeration.RetrainingOutcomeEnum;
import com.behavior_ml_retraining.exception.ArtifactStoreException;
import com.behavior_ml_retraining.exception.ModelTrainingException;
import com.behavior_ml_retraining.exception.RetrainingCancelledException;
import com.behavior_ml_retraining.service.ArtifactStore;
import com.behavior_ml_retraining.service.DataProvider;
import com.behavior_ml_retraining.service.FeaturePreparer;
import com.behavior_ml_retraining.service.MetricStore;
import com.behavior_ml_retraining.service.ModelTrainer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Owns the background monitor, the retraining trigger policy and the
 * backup, train, validate, deploy or reject cycle.
 *
 * <p>Only one cycle runs at a time: the monitor and {@link #forceRetrain()} share {@code cycleLock}.
 * {@link #getStatus()} reads volatile and atomic state only and never waits for a cycle.
 */
@Service
@Slf4j
public class RetrainingOrchestrator {

    static final String MONITOR_THREAD_NAME = "retraining-monitor";
    static final String TRAINER_THREAD_NAME = "retraining-trainer";

    private final RetrainingConfig config;
    private final DataProvider dataProvider;
    private final FeaturePreparer featurePreparer;
    private final ModelTrainer modelTrainer;
    private final ArtifactStore artifactStore;
    private final MetricStore metricStore;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private final ReentrantLock cycleLock = new ReentrantLock();
    private final ReentrantLock monitorLock = new ReentrantLock();
    private final Condition wakeUp = monitorLock.newCondition();

    private volatile boolean running;
    private Thread monitorThread;
    private AtomicBoolean stopSignal = new AtomicBoolean(true);

    private final AtomicReference<Instant> lastRetrainTime;
    private final AtomicReference<CycleResult> lastCycleResult = new AtomicReference<>();

    public RetrainingOrchestrator(RetrainingConfig config,
                                  DataProvider dataProvider,
                                  FeaturePreparer featurePreparer,
                                  ModelTrainer modelTrainer,
                                  ArtifactStore artifactStore,
                                  MetricStore metricStore,
                                  Clock clock) {
        this.config = config;
        this.dataProvider = dataProvider;
        this.featurePreparer = featurePreparer;
        this.modelTrainer = modelTrainer;
        this.artifactStore = artifactStore;
        this.metricStore = metricStore;
        this.clock = clock;
        this.lastRetrainTime = new AtomicReference<>(metricStore.findLatest()
                .map(PerformanceRecord::timestamp)
                .orElseGet(clock::instant));
    }

    // ========== LIFECYCLE ==========

    public void startMonitoring() {
        synchronized (lifecycleLock) {
            if (running) {
                log.info("ℹ️ Retraining monitor already running");
                return;
            }
            AtomicBoolean signal = new AtomicBoolean(false);
            Thread worker = new Thread(() -> monitorLoop(signal), MONITOR_THREAD_NAME);
            worker.setDaemon(true);

            stopSignal = signal;
            monitorThread = worker;
            running = true;
            worker.start();
            log.info("🟢 Retraining monitor started [poll={}, intervalHours={}, minNewSamples={}]",
                    config.pollInterval(), config.retrainIntervalHours(), config.minNewSamples());
        }
    }

    /**
     * Signals the monitor and waits at most {@code stopTimeout} for it to exit.
     * A cycle already past its last cancellation point is allowed to finish.
     */
    public void stopMonitoring() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            stopSignal.set(true);
            signalMonitor();

            Thread worker = monitorThread;
            if (worker != null && worker != Thread.currentThread()) {
                try {
                    worker.join(config.stopTimeout().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("⚠️ Interrupted while waiting for the retraining monitor to stop");
                }
                if (worker.isAlive()) {
                    log.warn("⏱️ Retraining monitor did not stop within {}, leaving it to finish its iteration",
                            config.stopTimeout());
                }
            }
            monitorThread = null;
            running = false;
            log.info("🛑 Retraining monitor stopped");
        }
    }

    /**
     * Runs one cycle now, ignoring the trigger policy. Blocks until the cycle completes.
     *
     * @return true when the candidate was deployed
     */
    public boolean forceRetrain() {
        log.info("🔧 Forced retraining requested");
        return runCycle(CycleTriggerEnum.FORCED, () -> false).succeeded();
    }

    public RetrainingStatus getStatus() {
        Instant last = lastRetrainTime.get();
        long hoursSince = Duration.between(last, clock.instant()).toHours();
        CycleResult lastResult = lastCycleResult.get();

        return RetrainingStatus.builder()
                .running(running)
                .lastRetrainTime(last)
                .newSampleCount(countNewSamples(last))
                .minSamplesNeeded(config.minNewSamples())
                .historyLength(metricStore.size())
                .nextCheckHours((int) Math.max(0, config.retrainIntervalHours() - hoursSince))
                .cycleInProgress(cycleLock.isLocked())
                .lastOutcome(lastResult != null ? lastResult.outcome() : null)
                .build();
    }

    public Optional<CycleResult> getLastCycleResult() {
        return Optional.ofNullable(lastCycleResult.get());
    }

    public boolean isRunning() {
        return running;
    }

    // ========== MONITOR ==========

    private void monitorLoop(AtomicBoolean signal) {
        Duration wait = config.pollInterval();
        while (awaitNextCheck(wait, signal)) {
            try {
                if (shouldRetrain()) {
                    runCycle(CycleTriggerEnum.SCHEDULED, signal::get);
                }
                wait = config.pollInterval();
            } catch (Throwable t) {
                log.error("❌ Retraining monitor iteration failed, next check in {}", config.errorBackoff(), t);
                wait = config.errorBackoff();
            }
        }
        log.info("👋 Retraining monitor exiting");
    }

    /**
     * Sleeps on the wake-up condition for {@code wait}.
     *
     * @return false once a stop was requested
     */
    private boolean awaitNextCheck(Duration wait, AtomicBoolean signal) {
        monitorLock.lock();
        try {
            long remaining = wait.toNanos();
            while (!signal.get() && remaining > 0) {
                remaining = wakeUp.awaitNanos(remaining);
            }
            return !signal.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            monitorLock.unlock();
        }
    }

    private void signalMonitor() {
        monitorLock.lock();
        try {
            wakeUp.signalAll();
        } finally {
            monitorLock.unlock();
        }
    }

    // ========== TRIGGER POLICY ==========

    /**
     * Time gate first, then either enough new samples or a drift in production accuracy.
     */
    boolean shouldRetrain() {
        Instant last = lastRetrainTime.get();
        Duration elapsed = Duration.between(last, clock.instant());
        if (elapsed.compareTo(Duration.ofHours(config.retrainIntervalHours())) < 0) {
            log.debug("⏳ Last retrain {} ago, interval is {}h", elapsed, config.retrainIntervalHours());
            return false;
        }

        long newSamples = countNewSamples(last);
        if (newSamples >= config.minNewSamples()) {
            log.info("📈 Retraining triggered: {} new samples since {} [min={}]",
                    newSamples, last, config.minNewSamples());
            return true;
        }

        if (detectPerformanceDrift()) {
            log.info("📉 Retraining triggered by performance drift [newSamples={}]", newSamples);
            return true;
        }
        return false;
    }

    /**
     * Scores production on the recent validation window against the mean of the last recorded accuracies.
     * Missing evidence counts as no drift.
     */
    boolean detectPerformanceDrift() {
        try {
            if (metricStore.isEmpty()) {
                return false;
            }
            Optional<ModelArtifactSet> production = artifactStore.loadProduction();
            if (production.isEmpty()) {
                return false;
            }

            Instant since = clock.instant().minus(config.driftWindow());
            List<BehaviorRecord> window = dataProvider.loadValidationWindow(since, config.driftWindowLimit());
            FeatureTable table = featurePreparer.prepare(window);
            if (table.size() < config.driftMinSamples()) {
                log.debug("🔍 Drift check skipped: {} validation rows [min={}]", table.size(), config.driftMinSamples());
                return false;
            }

            EvaluationMetrics current = modelTrainer.evaluate(production.get(), table);
            double reference = metricStore.recentMean(config.driftHistoryWindow());
            boolean drift = current.accuracy() < reference - config.performanceThreshold();
            if (drift) {
                log.warn("⚠️ Performance drift detected: accuracy {} vs recent mean {}",
                        String.format("%.3f", current.accuracy()), String.format("%.3f", reference));
            }
            return drift;
        } catch (Exception e) {
            log.warn("⚠️ Drift check failed, assuming no drift: {}", e.getMessage(), e);
            return false;
        }
    }

    /**
     * Deploy unless accuracy dropped by more than the threshold without a meaningful error reduction.
     * A gain beyond the threshold and a "no worse" candidate both deploy.
     */
    boolean shouldDeploy(PerformanceRecord current, EvaluationMetrics candidate) {
        double accuracyGain = candidate.accuracy() - current.accuracy();
        double errorReduction = current.errorMetric() - candidate.errorMetric();
        if (errorReduction > config.errorMetricMargin()) {
            return true;
        }
        return accuracyGain >= -config.performanceThreshold();
    }

    private long countNewSamples(Instant since) {
        try {
            return dataProvider.countNewSamplesSince(since);
        } catch (Exception e) {
            log.warn("⚠️ Could not count new samples since {}, treating as 0: {}", since, e.getMessage());
            return 0L;
        }
    }

    // ========== CYCLE ==========

    CycleResult runCycle(CycleTriggerEnum trigger, BooleanSupplier cancelled) {
        cycleLock.lock();
        try {
            log.info("🔁 Retraining cycle started [trigger={}]", trigger);
            CycleResult result = executeCycle(trigger, cancelled);
            lastCycleResult.set(result);
            if (result.succeeded()) {
                log.info("✅ Retraining cycle finished [trigger={}, outcome={}]", trigger, result.outcome());
            } else {
                log.warn("⚠️ Retraining cycle finished [trigger={}, outcome={}]: {}",
                        trigger, result.outcome(), result.message());
            }
            return result;
        } finally {
            cycleLock.unlock();
        }
    }

    private CycleResult executeCycle(CycleTriggerEnum trigger, BooleanSupplier cancelled) {
        try {
            if (config.backupEnabled()) {
                try {
                    artifactStore.backup();
                } catch (ArtifactStoreException e) {
                    log.error("❌ Backup of production models failed, cycle aborted", e);
                    return result(trigger, RetrainingOutcomeEnum.BACKUP_FAILED, null, "Backup failed: " + e.getMessage());
                }
            }
            checkCancelled(cancelled, "backup");

            List<BehaviorRecord> extract;
            try {
                extract = dataProvider.loadTrainingExtract(config.trainingExtractLimit());
            } catch (Exception e) {
                log.error("❌ Could not load training extract", e);
                return result(trigger, RetrainingOutcomeEnum.FAILED, null, "Data load failed: " + e.getMessage());
            }
            if (extract.size() < config.minTrainingRecords()) {
                return result(trigger, RetrainingOutcomeEnum.SKIPPED, null,
                        "Insufficient training data: " + extract.size() + " records");
            }
            checkCancelled(cancelled, "extract");

            FeatureTable table = featurePreparer.prepare(extract);
            if (table.size() < config.minPreparedRows()) {
                return result(trigger, RetrainingOutcomeEnum.SKIPPED, null,
                        "Insufficient prepared data: " + table.size() + " rows");
            }

            EvaluatedCandidate evaluated;
            try {
                evaluated = trainAndValidate(table.split(config.validationFraction(), config.validationSeed()));
            } catch (TimeoutException e) {
                log.error("⏱️ Training exceeded {}, candidate discarded", config.cycleTimeout());
                return result(trigger, RetrainingOutcomeEnum.TIMED_OUT, null,
                        "Training exceeded " + config.cycleTimeout());
            } catch (ModelTrainingException e) {
                log.error("❌ Candidate training failed", e);
                return result(trigger, RetrainingOutcomeEnum.FAILED, null, e.getMessage());
            }

            EvaluationMetrics metrics = evaluated.metrics();
            if (metrics == null || !metrics.isValid()) {
                return result(trigger, RetrainingOutcomeEnum.FAILED, metrics, "Candidate produced invalid metrics");
            }
            log.info("🔍 Candidate validated: accuracy={}, mse={}, samples={}",
                    String.format("%.3f", metrics.accuracy()), String.format("%.2f", metrics.errorMetric()),
                    metrics.samplesUsed());
            checkCancelled(cancelled, "validation");

            PerformanceRecord current = metricStore.latest();
            if (!shouldDeploy(current, metrics)) {
                log.warn("⚠️ Candidate rejected: accuracy {} vs {}, mse {} vs {}",
                        String.format("%.3f", metrics.accuracy()), String.format("%.3f", current.accuracy()),
                        String.format("%.2f", metrics.errorMetric()), String.format("%.2f", current.errorMetric()));
                if (config.backupEnabled()) {
                    restoreAfterRejection();
                }
                return result(trigger, RetrainingOutcomeEnum.REJECTED, metrics, "Candidate performance insufficient");
            }
            checkCancelled(cancelled, "deploy decision");

            try {
                artifactStore.swapProduction(evaluated.candidate());
            } catch (ArtifactStoreException e) {
                log.error("❌ Swapping candidate into production failed, previous models kept", e);
                return result(trigger, RetrainingOutcomeEnum.FAILED, metrics, "Deploy failed: " + e.getMessage());
            }
            Instant now = clock.instant();
            metricStore.append(PerformanceRecord.of(metrics, now));
            lastRetrainTime.set(now);
            return result(trigger, RetrainingOutcomeEnum.DEPLOYED, metrics, "Candidate deployed");

        } catch (RetrainingCancelledException e) {
            return result(trigger, RetrainingOutcomeEnum.CANCELLED, null, e.getMessage());
        } catch (RuntimeException e) {
            log.error("❌ Unexpected failure in retraining cycle", e);
            return result(trigger, RetrainingOutcomeEnum.FAILED, null, "Unexpected failure: " + e.getMessage());
        } catch (StackOverflowError e) {
            log.error("❌ Retraining cycle overflowed the stack, candidate discarded", e);
            return result(trigger, RetrainingOutcomeEnum.FAILED, null, "Unexpected failure: " + e);
        }
    }

    /**
     * Trains on the training part and scores on the holdout, bounded by {@code cycleTimeout} when one is set.
     */
    private EvaluatedCandidate trainAndValidate(FeatureTable.Split split) throws TimeoutException {
        if (!config.hasCycleTimeout()) {
            return trainAndEvaluate(split);
        }
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, TRAINER_THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
        Future<EvaluatedCandidate> future = executor.submit(() -> trainAndEvaluate(split));
        try {
            return future.get(config.cycleTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ModelTrainingException("Interrupted while waiting for training", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ModelTrainingException mte) {
                throw mte;
            }
            throw new ModelTrainingException("Training failed: " + cause.getMessage(), cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private EvaluatedCandidate trainAndEvaluate(FeatureTable.Split split) {
        TrainingResult trained = modelTrainer.train(split.training());
        EvaluationMetrics metrics = modelTrainer.evaluate(trained.candidate(), split.holdout());
        return new EvaluatedCandidate(trained.candidate(), metrics);
    }

    private void restoreAfterRejection() {
        try {
            if (!artifactStore.restoreLatestBackup()) {
                log.error("🚨 Unrecoverable rollback: no backup to restore, production left on its current release");
            }
        } catch (ArtifactStoreException e) {
            log.error("🚨 Restoring the latest backup failed, production left on its current release", e);
        }
    }

    private static void checkCancelled(BooleanSupplier cancelled, String stage) {
        if (cancelled.getAsBoolean()) {
            throw new RetrainingCancelledException("Retraining cycle cancelled after " + stage);
        }
    }

    private CycleResult result(CycleTriggerEnum trigger, RetrainingOutcomeEnum outcome,
                               EvaluationMetrics metrics, String message) {
        return new CycleResult(trigger, outcome, metrics, message, clock.instant());
    }

    // ========== TEST HOOKS ==========

    void setLastRetrainTime(Instant instant) {
        lastRetrainTime.set(instant);
    }

    Thread monitorThread() {
        synchronized (lifecycleLock) {
            return monitorThread;
        }
    }

    private record EvaluatedCandidate(ModelArtifactSet candidate, EvaluationMetrics metrics) {}
}
