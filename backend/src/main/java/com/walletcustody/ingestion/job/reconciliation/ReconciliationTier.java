package com.walletcustody.ingestion.job.reconciliation;

import com.walletcustody.ingestion.config.ReconciliationProperties;

import java.time.Duration;

/**
 * One confirmation tier: pending rows younger than {@code maxAgeHours} are promoted to confirmed once they reach
 * {@code minConfirmations}; the tier re-polls every {@code pollInterval}.
 */
public record ReconciliationTier(String name, long minConfirmations, Duration pollInterval, int maxAgeHours) {

    public static ReconciliationTier from(ReconciliationProperties.Tier tier) {
        return new ReconciliationTier(tier.getName(), tier.getMinConfirmations(), tier.getPollInterval(), tier.getMaxAgeHours());
    }
}
