package com.walletcustody.ingestion.lookup;

import com.walletcustody.common.TransactionHashes;
import com.walletcustody.common.TransactionNotFoundException;
import com.walletcustody.domain.RawLedgerTransaction;
import com.walletcustody.domain.Transaction;
import com.walletcustody.domain.TransactionStatus;
import com.walletcustody.ingestion.adapter.LedgerClient;
import com.walletcustody.ingestion.classifier.ClassificationResult;
import com.walletcustody.ingestion.classifier.TransactionClassifier;
import com.walletcustody.ingestion.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Lookup-by-hash: fetch from the ledger, classify, and record the transaction when a custodied wallet is involved.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionLookupService {

    private final LedgerClient ledgerClient;
    private final TransactionClassifier classifier;
    private final TransactionStore transactionStore;

    /**
     * @throws com.walletcustody.common.InvalidRequestException for a malformed hash
     * @throws TransactionNotFoundException when the ledger does not know the hash
     */
    public TransactionLookupResult lookup(String rawHash) {
        String hash = TransactionHashes.normalize(rawHash);
        RawLedgerTransaction tx = ledgerClient.getTransaction(hash)
                .orElseThrow(() -> new TransactionNotFoundException("Transaction not found on ledger: " + hash));
        ClassificationResult classification = classifier.classify(tx);
        if (!classification.isOwned()) {
            log.debug("Transaction {} involves no custodied wallet, not stored", hash);
            return new TransactionLookupResult(classification, false);
        }
        if (transactionStore.getByHash(hash).isPresent()) {
            log.info("Transaction {} already stored, skipping insert", hash);
            return new TransactionLookupResult(classification, false);
        }
        boolean stored = transactionStore.insertIfAbsent(toRow(classification));
        return new TransactionLookupResult(classification, stored);
    }

    private static Transaction toRow(ClassificationResult classification) {
        Transaction row = new Transaction();
        row.setHash(classification.hash());
        row.setAsset(classification.asset());
        row.setAddressFrom(classification.sourceAddress());
        row.setAddressTo(classification.destinationAddress());
        row.setValue(classification.value());
        row.setToken(classification.token());
        row.setContractAddress(classification.contractAddress());
        row.setType(classification.type());
        row.setStatus(classification.confirmed() ? TransactionStatus.CONFIRMED : TransactionStatus.PENDING);
        return row;
    }
}
