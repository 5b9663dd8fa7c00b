package com.walletcustody.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Confirmation reconciliation tiers. Each tier is polled by its own worker.
 */
@ConfigurationProperties(prefix = "walletcustody.reconciliation")
@NoArgsConstructor
@Getter
@Setter
public class ReconciliationProperties {

    /** Start all tiers on ApplicationReadyEvent. */
    private boolean enabled = true;

    /** Pause between per-transaction confirmation checks inside one pass. */
    private Duration checkDelay = Duration.ofMillis(500);

    private List<Tier> tiers = new ArrayList<>(List.of(
            new Tier("fast", 1, Duration.ofSeconds(15), 2),
            new Tier("secure", 6, Duration.ofSeconds(60), 24)));

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Tier {
        private String name;
        private long minConfirmations;
        private Duration pollInterval;
        private int maxAgeHours;

        public Tier(String name, long minConfirmations, Duration pollInterval, int maxAgeHours) {
            this.name = name;
            this.minConfirmations = minConfirmations;
            this.pollInterval = pollInterval;
            this.maxAgeHours = maxAgeHours;
        }
    }
}
