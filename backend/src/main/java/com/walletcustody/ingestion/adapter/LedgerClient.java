package com.walletcustody.ingestion.adapter;

import com.walletcustody.domain.Confirmations;
import com.walletcustody.domain.RawLedgerTransaction;
import com.walletcustody.domain.Transfer;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Access to the single account-based ledger this service custodies on.
 * Unless stated otherwise, node failures surface as {@link com.walletcustody.common.LedgerUnavailableException}.
 */
public interface LedgerClient {

    /** Asset of a token whose symbol() cannot be resolved. */
    String UNKNOWN_SYMBOL = "UNKNOWN";

    /** Empty when the node does not know the hash. */
    Optional<RawLedgerTransaction> getTransaction(String hash);

    /**
     * {@code currentBlock - txBlock + 1}; zero when unmined. Never throws: a failed lookup yields
     * {@link Confirmations#unavailable()}.
     */
    Confirmations getConfirmations(String hash);

    /**
     * Native transfer (when the value is positive) followed by every decoded ERC20 Transfer log of the receipt.
     * A receipt failure yields no token transfers.
     */
    List<Transfer> getTransferEvents(String hash);

    List<Transfer> getTransferEvents(RawLedgerTransaction tx);

    /** Upper-cased symbol() of the contract, or UNKNOWN. Never throws. */
    String getTokenSymbol(String contractAddress);

    boolean isTokenTransaction(RawLedgerTransaction tx);

    long getBlockNumber();

    BigInteger getBalance(String address);

    /** Nonce for the next transaction, counting pending ones. */
    long getTransactionCount(String address);

    BigInteger getGasPrice();

    /** Empty when the node does not support eth_maxPriorityFeePerGas. */
    Optional<BigInteger> getMaxPriorityFeePerGas();

    long getChainId();

    BigInteger estimateGas(LedgerCall call);

    /** Broadcasts signed bytes and returns the transaction hash reported by the node. */
    String sendRawTransaction(byte[] signedTransaction);
}
