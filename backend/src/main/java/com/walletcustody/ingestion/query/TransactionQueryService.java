package com.walletcustody.ingestion.query;

import com.walletcustody.common.TransactionHashes;
import com.walletcustody.common.TransactionNotFoundException;
import com.walletcustody.domain.Confirmations;
import com.walletcustody.domain.Transaction;
import com.walletcustody.ingestion.adapter.LedgerClient;
import com.walletcustody.ingestion.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side over stored transactions.
 */
@Service
@RequiredArgsConstructor
public class TransactionQueryService {

    /** A status view counts a transaction as confirmed once it is mined. */
    static final long STATUS_VIEW_MIN_CONFIRMATIONS = 1;

    private final TransactionStore transactionStore;
    private final LedgerClient ledgerClient;

    public List<Transaction> list(int limit, int offset) {
        return transactionStore.list(limit, offset);
    }

    public TransactionStatusView getStatus(String rawHash) {
        String hash = TransactionHashes.normalize(rawHash);
        Transaction tx = transactionStore.getByHash(hash)
                .orElseThrow(() -> new TransactionNotFoundException("Transaction not stored: " + hash));
        Confirmations confirmations = ledgerClient.getConfirmations(hash);
        return new TransactionStatusView(tx, confirmations.count(), confirmations.atLeast(STATUS_VIEW_MIN_CONFIRMATIONS));
    }
}
