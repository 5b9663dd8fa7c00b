package com.walletcustody.ingestion.classifier;

import com.walletcustody.domain.Confirmations;
import com.walletcustody.domain.RawLedgerTransaction;
import com.walletcustody.domain.Transfer;
import com.walletcustody.domain.TransactionType;
import com.walletcustody.ingestion.adapter.LedgerClient;
import com.walletcustody.ingestion.config.ClassifierProperties;
import com.walletcustody.ingestion.config.LedgerRpcProperties;
import com.walletcustody.ingestion.wallet.WalletDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;

/**
 * Determines asset, transfers, ownership and direction of a ledger transaction.
 * Native calls use the transaction's own from/to/value; token calls (non-empty input) use decoded Transfer logs,
 * picking the first transfer whose sender or recipient is custodied.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransactionClassifier {

    private final LedgerClient ledgerClient;
    private final WalletDirectory walletDirectory;
    private final LedgerRpcProperties ledgerProperties;
    private final ClassifierProperties classifierProperties;

    public ClassificationResult classify(RawLedgerTransaction tx) {
        boolean token = ledgerClient.isTokenTransaction(tx);
        String asset = token
                ? (tx.to() != null ? ledgerClient.getTokenSymbol(tx.to()) : LedgerClient.UNKNOWN_SYMBOL)
                : ledgerProperties.getNativeSymbol().toUpperCase(Locale.ROOT);

        List<Transfer> transfers = token ? ledgerClient.getTransferEvents(tx) : nativeTransfers(tx);

        String destination = tx.to();
        boolean destinationOwned;
        if (token) {
            Transfer inbound = transfers.stream()
                    .filter(t -> walletDirectory.isCustodied(t.to()))
                    .findFirst()
                    .orElse(null);
            destinationOwned = inbound != null;
            if (inbound != null) {
                destination = inbound.to();
            }
        } else {
            destinationOwned = walletDirectory.isCustodied(tx.to());
        }

        String source = tx.from();
        boolean sourceOwned = walletDirectory.isCustodied(tx.from());
        if (token) {
            Transfer outbound = transfers.stream()
                    .filter(t -> walletDirectory.isCustodied(t.from()))
                    .findFirst()
                    .orElse(null);
            if (outbound != null) {
                sourceOwned = true;
                source = outbound.from();
            }
        }

        TransactionType type = resolveType(sourceOwned, destinationOwned);
        BigInteger value = token
                ? tokenValue(transfers, sourceOwned ? source : null, destinationOwned ? destination : null)
                : tx.value();

        Confirmations confirmations = ledgerClient.getConfirmations(tx.hash());
        long required = classifierProperties.getMinConfirmations();
        log.debug("Classified {} asset={} type={} sourceOwned={} destinationOwned={} confirmations={}",
                tx.hash(), asset, type, sourceOwned, destinationOwned, confirmations.count());
        return new ClassificationResult(
                tx.hash(),
                asset,
                token,
                token ? tx.to() : null,
                source,
                destination,
                sourceOwned,
                destinationOwned,
                type,
                value != null ? value : BigInteger.ZERO,
                transfers,
                confirmations.count(),
                confirmations.atLeast(required),
                required);
    }

    static TransactionType resolveType(boolean sourceOwned, boolean destinationOwned) {
        if (sourceOwned) {
            return TransactionType.WITHDRAW;
        }
        return destinationOwned ? TransactionType.DEPOSIT : TransactionType.UNKNOWN;
    }

    private static List<Transfer> nativeTransfers(RawLedgerTransaction tx) {
        if (tx.value() != null && tx.value().signum() > 0) {
            return List.of(Transfer.nativeTransfer(tx.from(), tx.to(), tx.value()));
        }
        return List.of();
    }

    /** Sender match wins over recipient match; zero when neither owned end appears in the transfers. */
    private static BigInteger tokenValue(List<Transfer> transfers, String ownedSource, String ownedDestination) {
        if (ownedSource != null) {
            for (Transfer t : transfers) {
                if (t.isFrom(ownedSource)) return t.value();
            }
        }
        if (ownedDestination != null) {
            for (Transfer t : transfers) {
                if (t.isTo(ownedDestination)) return t.value();
            }
        }
        return BigInteger.ZERO;
    }
}
