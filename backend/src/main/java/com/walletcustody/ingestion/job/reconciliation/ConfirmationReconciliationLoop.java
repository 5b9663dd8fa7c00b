package com.walletcustody.ingestion.job.reconciliation;

import com.walletcustody.domain.Confirmations;
import com.walletcustody.domain.Transaction;
import com.walletcustody.domain.TransactionStatus;
import com.walletcustody.ingestion.adapter.LedgerClient;
import com.walletcustody.ingestion.store.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-lived worker for one {@link ReconciliationTier}. Each pass re-checks the tier's pending rows and promotes
 * those with enough confirmations. Failures of a single row or a whole pass are logged; the loop keeps going
 * until {@link #stop()}. Sleeps and in-flight ledger calls are interrupted on stop.
 */
@Slf4j
public class ConfirmationReconciliationLoop {

    private final ReconciliationTier tier;
    private final TransactionStore transactionStore;
    private final LedgerClient ledgerClient;
    private final Duration checkDelay;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile Future<?> worker;

    public ConfirmationReconciliationLoop(ReconciliationTier tier, TransactionStore transactionStore,
                                          LedgerClient ledgerClient, Duration checkDelay) {
        this.tier = tier;
        this.transactionStore = transactionStore;
        this.ledgerClient = ledgerClient;
        this.checkDelay = checkDelay != null ? checkDelay : Duration.ZERO;
    }

    /**
     * Submits the worker. No-op when already running.
     *
     * @return true when a worker was submitted
     */
    public synchronized boolean start(AsyncTaskExecutor executor) {
        if (isRunning()) {
            return false;
        }
        stopRequested.set(false);
        worker = executor.submit(this::run);
        log.info("Reconciliation tier '{}' started (minConfirmations={}, pollInterval={}, maxAgeHours={})",
                tier.name(), tier.minConfirmations(), tier.pollInterval(), tier.maxAgeHours());
        return true;
    }

    /** Idempotent; safe when the tier never started. */
    public synchronized void stop() {
        stopRequested.set(true);
        Future<?> current = worker;
        if (current != null && !current.isDone()) {
            current.cancel(true);
            log.info("Reconciliation tier '{}' stopped", tier.name());
        }
    }

    public boolean isRunning() {
        Future<?> current = worker;
        return current != null && !current.isDone() && !stopRequested.get();
    }

    public ReconciliationTier getTier() {
        return tier;
    }

    private void run() {
        try {
            while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
                try {
                    int confirmed = runOnce();
                    if (confirmed > 0) {
                        log.info("Tier '{}' confirmed {} transaction(s)", tier.name(), confirmed);
                    }
                } catch (RuntimeException e) {
                    if (stopRequested.get()) break;
                    log.error("Tier '{}' reconciliation pass failed", tier.name(), e);
                }
                Thread.sleep(tier.pollInterval().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Reconciliation tier '{}' interrupted", tier.name());
        }
    }

    /**
     * One pass over the pending set.
     *
     * @return number of rows promoted to confirmed
     */
    int runOnce() throws InterruptedException {
        List<Transaction> pending = transactionStore.listPending(tier.maxAgeHours());
        log.debug("Tier '{}' checking {} pending transaction(s)", tier.name(), pending.size());
        int confirmed = 0;
        for (Transaction tx : pending) {
            if (stopRequested.get()) break;
            try {
                if (checkTransaction(tx)) confirmed++;
            } catch (RuntimeException e) {
                log.warn("Tier '{}' failed to reconcile {}: {}", tier.name(), tx.getHash(), e.getMessage());
            }
            if (!checkDelay.isZero()) {
                Thread.sleep(checkDelay.toMillis());
            }
        }
        return confirmed;
    }

    private boolean checkTransaction(Transaction tx) {
        Confirmations confirmations = ledgerClient.getConfirmations(tx.getHash());
        if (!confirmations.atLeast(tier.minConfirmations())) {
            return false;
        }
        boolean updated = transactionStore.updateStatus(tx.getHash(), TransactionStatus.CONFIRMED);
        if (updated) {
            log.info("Transaction {} confirmed by tier '{}' with {} confirmations",
                    tx.getHash(), tier.name(), confirmations.count());
        }
        return updated;
    }
}
