package com.behavior_ml_retraining.config;

import com.behavior_ml_retraining.service.orchestrator.RetrainingOrchestrator;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Ties the retraining monitor to the application: started after startup when
 * {@code retraining.auto-start} is set, always stopped on shutdown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetrainingLifecycle implements CommandLineRunner {

    private final RetrainingConfig retrainingConfig;
    private final RetrainingOrchestrator retrainingOrchestrator;

    @Override
    public void run(String... args) {
        if (!retrainingConfig.autoStart()) {
            log.info("⏸️ Retraining monitor not started automatically (retraining.auto-start=false)");
            return;
        }
        retrainingOrchestrator.startMonitoring();
    }

    @PreDestroy
    public void shutdown() {
        if (retrainingOrchestrator.isRunning()) {
            log.info("🔌 Application shutting down, stopping retraining monitor");
            retrainingOrchestrator.stopMonitoring();
        }
    }
}
