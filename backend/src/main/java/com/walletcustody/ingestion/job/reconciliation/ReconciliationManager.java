package com.walletcustody.ingestion.job.reconciliation;

import com.walletcustody.config.AsyncConfig;
import com.walletcustody.ingestion.adapter.LedgerClient;
import com.walletcustody.ingestion.config.ReconciliationProperties;
import com.walletcustody.ingestion.store.TransactionStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Owns one {@link ConfirmationReconciliationLoop} per configured tier. Tiers start when the application is ready
 * (if enabled) and stop on context shutdown.
 */
@Slf4j
@Component
public class ReconciliationManager {

    private final List<ConfirmationReconciliationLoop> loops;
    private final AsyncTaskExecutor reconciliationExecutor;
    private final ReconciliationProperties properties;

    public ReconciliationManager(
            ReconciliationProperties properties,
            TransactionStore transactionStore,
            LedgerClient ledgerClient,
            @Qualifier(AsyncConfig.RECONCILIATION_EXECUTOR) AsyncTaskExecutor reconciliationExecutor
    ) {
        this.properties = properties;
        this.reconciliationExecutor = reconciliationExecutor;
        this.loops = properties.getTiers().stream()
                .map(ReconciliationTier::from)
                .map(tier -> new ConfirmationReconciliationLoop(tier, transactionStore, ledgerClient, properties.getCheckDelay()))
                .toList();
        requireThreadPerTier(reconciliationExecutor, loops.size());
    }

    /** Tier workers never return, so a pool smaller than the tier count would reject some tiers on start. */
    static void requireThreadPerTier(AsyncTaskExecutor executor, int tiers) {
        if (executor instanceof ThreadPoolTaskExecutor pool && pool.getMaxPoolSize() < tiers) {
            throw new IllegalStateException(tiers + " reconciliation tiers configured but "
                    + AsyncConfig.RECONCILIATION_EXECUTOR + " allows only " + pool.getMaxPoolSize() + " threads");
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isEnabled()) {
            log.info("Confirmation reconciliation disabled");
            return;
        }
        startReconciliation();
    }

    public void startReconciliation() {
        int started = 0;
        for (ConfirmationReconciliationLoop loop : loops) {
            if (loop.start(reconciliationExecutor)) started++;
        }
        if (started > 0) {
            log.info("Started {} reconciliation tier(s)", started);
        }
    }

    @PreDestroy
    public void stopReconciliation() {
        loops.forEach(ConfirmationReconciliationLoop::stop);
    }

    public ReconciliationHealth healthStatus() {
        int running = (int) loops.stream().filter(ConfirmationReconciliationLoop::isRunning).count();
        return ReconciliationHealth.of(loops.size(), running);
    }

    List<ConfirmationReconciliationLoop> getLoops() {
        return loops;
    }
}
