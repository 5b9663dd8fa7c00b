package com.walletcustody.ingestion.classifier;

import com.walletcustody.domain.Transfer;
import com.walletcustody.domain.TransactionType;

import java.math.BigInteger;
import java.util.List;

/**
 * Outcome of classifying one ledger transaction against the custodied wallet set.
 * {@code sourceAddress}/{@code destinationAddress} are the resolved owned ends for token calls
 * (the matching Transfer participants), the transaction ends otherwise.
 */
public record ClassificationResult(
        String hash,
        String asset,
        boolean token,
        String contractAddress,
        String sourceAddress,
        String destinationAddress,
        boolean sourceOwned,
        boolean destinationOwned,
        TransactionType type,
        BigInteger value,
        List<Transfer> transfers,
        long confirmations,
        boolean confirmed,
        long minConfirmationsRequired
) {

    public boolean isOwned() {
        return sourceOwned || destinationOwned;
    }
}
