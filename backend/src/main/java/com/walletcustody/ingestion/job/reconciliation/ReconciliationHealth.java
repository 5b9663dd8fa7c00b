package com.walletcustody.ingestion.job.reconciliation;

public record ReconciliationHealth(int tiersTotal, int tiersRunning, String status) {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
    public static final String STOPPED = "stopped";

    public static ReconciliationHealth of(int tiersTotal, int tiersRunning) {
        String status;
        if (tiersTotal > 0 && tiersRunning == tiersTotal) {
            status = HEALTHY;
        } else if (tiersRunning == 0) {
            status = STOPPED;
        } else {
            status = DEGRADED;
        }
        return new ReconciliationHealth(tiersTotal, tiersRunning, status);
    }
}
