package com.walletcustody.ingestion.query;

import com.walletcustody.domain.Transaction;

/**
 * Stored transaction together with its live confirmation count.
 */
public record TransactionStatusView(Transaction transaction, long confirmations, boolean confirmed) {
}
