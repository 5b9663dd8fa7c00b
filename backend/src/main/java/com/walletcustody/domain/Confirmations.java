package com.walletcustody.domain;

/**
 * Confirmation count for a transaction. {@code degraded} marks a fallback zero produced by a failed lookup,
 * as opposed to a genuinely unmined transaction.
 */
public record Confirmations(long count, boolean degraded) {

    public static Confirmations of(long count) {
        return new Confirmations(Math.max(0L, count), false);
    }

    public static Confirmations unavailable() {
        return new Confirmations(0L, true);
    }

    public boolean atLeast(long required) {
        return count >= required;
    }
}
