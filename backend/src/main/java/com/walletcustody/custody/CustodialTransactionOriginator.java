package com.walletcustody.custody;

import com.walletcustody.common.AmountConverter;
import com.walletcustody.common.InsufficientBalanceException;
import com.walletcustody.common.InvalidRequestException;
import com.walletcustody.common.KeyCustodyUnavailableException;
import com.walletcustody.common.KeyNotFoundException;
import com.walletcustody.custody.config.KeyCustodyProperties;
import com.walletcustody.custody.keys.KeyCustodyClient;
import com.walletcustody.custody.keys.WalletKeyIds;
import com.walletcustody.custody.signing.Eip1559Transaction;
import com.walletcustody.custody.signing.Erc20Calls;
import com.walletcustody.custody.signing.SignedTransaction;
import com.walletcustody.custody.signing.TransactionSigner;
import com.walletcustody.domain.Transaction;
import com.walletcustody.domain.TransactionStatus;
import com.walletcustody.domain.TransactionType;
import com.walletcustody.ingestion.adapter.LedgerCall;
import com.walletcustody.ingestion.adapter.LedgerClient;
import com.walletcustody.ingestion.config.LedgerRpcProperties;
import com.walletcustody.ingestion.store.TransactionStore;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Builds, fee-checks, signs and broadcasts withdrawals from custodied wallets, then records them as pending.
 * Every precondition (validation, amount, balance, key presence) is checked before broadcast.
 * Originations from the same address are serialized in-process so concurrent requests do not reuse a nonce.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustodialTransactionOriginator {

    private final LedgerClient ledgerClient;
    private final KeyCustodyClient keyCustodyClient;
    private final TransactionSigner transactionSigner;
    private final TransactionStore transactionStore;
    private final AmountConverter amountConverter;
    private final LedgerRpcProperties ledgerProperties;
    private final KeyCustodyProperties keyCustodyProperties;
    private final Validator validator;

    /** Entries live only while at least one origination for the address is waiting or running. */
    private final Map<String, AddressLock> addressLocks = new ConcurrentHashMap<>();

    public OriginationResult originate(OriginationRequest request) {
        validate(request);
        BigInteger value = amountConverter.toSmallestUnit(request.value());
        String lockKey = request.from().toLowerCase(Locale.ROOT);
        AddressLock addressLock = addressLocks.compute(lockKey, (k, existing) -> {
            AddressLock held = existing != null ? existing : new AddressLock();
            held.holders++;
            return held;
        });
        addressLock.lock.lock();
        try {
            return originateLocked(request, value);
        } finally {
            addressLock.lock.unlock();
            addressLocks.computeIfPresent(lockKey, (k, held) -> --held.holders == 0 ? null : held);
        }
    }

    int lockedAddressCount() {
        return addressLocks.size();
    }

    private OriginationResult originateLocked(OriginationRequest request, BigInteger value) {
        String from = request.from();
        long nonce = ledgerClient.getTransactionCount(from);
        long chainId = ledgerClient.getChainId();
        BigInteger balance = ledgerClient.getBalance(from);
        BigInteger gasPrice = ledgerClient.getGasPrice();
        if (balance.signum() == 0) {
            throw new InsufficientBalanceException("Wallet " + from + " has zero balance");
        }

        BigInteger priorityFee = ledgerClient.getMaxPriorityFeePerGas()
                .orElse(ledgerProperties.getFallbackPriorityFeeWei());
        BigInteger maxFeePerGas = new BigDecimal(gasPrice)
                .multiply(ledgerProperties.getFeeMargin())
                .setScale(0, RoundingMode.DOWN)
                .toBigInteger()
                .add(priorityFee);

        boolean nativeAsset = ledgerProperties.getNativeSymbol().equalsIgnoreCase(request.asset().trim());
        BigInteger gasLimit;
        String txTo;
        BigInteger txValue;
        byte[] data;
        if (nativeAsset) {
            gasLimit = BigInteger.valueOf(ledgerProperties.getNativeTransferGasLimit());
            BigInteger required = value.add(gasLimit.multiply(maxFeePerGas));
            requireBalance(from, balance, required);
            txTo = request.to();
            txValue = value;
            data = new byte[0];
        } else {
            if (request.contractAddress() == null || request.contractAddress().isBlank()) {
                throw new InvalidRequestException("contractAddress is required for token " + request.asset());
            }
            data = Erc20Calls.transfer(request.to(), value);
            gasLimit = ledgerClient.estimateGas(new LedgerCall(from, request.contractAddress(), BigInteger.ZERO,
                    "0x" + Hex.toHexString(data)));
            requireBalance(from, balance, gasLimit.multiply(maxFeePerGas));
            txTo = request.contractAddress();
            txValue = BigInteger.ZERO;
        }

        String privateKey = loadKey(from);
        Eip1559Transaction unsigned = new Eip1559Transaction(
                chainId, nonce, priorityFee, maxFeePerGas, gasLimit, txTo, txValue, data);
        SignedTransaction signed = sign(unsigned, privateKey, from);

        String hash = ledgerClient.sendRawTransaction(signed.raw());
        BigInteger effectiveFee = gasLimit.multiply(maxFeePerGas);
        log.info("Broadcast {} from {} to {}: {} {} (nonce={}, gasLimit={}, maxFeePerGas={})",
                hash, from, request.to(), request.value(), request.asset(), nonce, gasLimit, maxFeePerGas);

        Transaction row = new Transaction();
        row.setHash(hash);
        row.setAsset(request.asset().trim().toUpperCase(Locale.ROOT));
        row.setAddressFrom(from);
        row.setAddressTo(request.to());
        row.setValue(value);
        row.setToken(!nativeAsset);
        row.setContractAddress(nativeAsset ? null : request.contractAddress());
        row.setType(TransactionType.WITHDRAW);
        row.setStatus(TransactionStatus.PENDING);
        row.setEffectiveFee(effectiveFee);
        row.setCreatedAt(Instant.now());
        try {
            transactionStore.insertIfAbsent(row);
        } catch (DataAccessException e) {
            log.error("Transaction {} was broadcast but could not be recorded", hash, e);
            throw e;
        }
        return new OriginationResult(hash, TransactionStatus.PENDING, effectiveFee, row.getCreatedAt());
    }

    private void validate(OriginationRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Origination request is required");
        }
        Set<ConstraintViolation<OriginationRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new InvalidRequestException("Invalid origination request: " + details);
        }
    }

    private static void requireBalance(String from, BigInteger balance, BigInteger required) {
        if (balance.compareTo(required) < 0) {
            throw new InsufficientBalanceException("Wallet " + from + " balance " + balance
                    + " is below required " + required);
        }
    }

    private String loadKey(String from) {
        String keyId = WalletKeyIds.keyId(keyCustodyProperties.getKeyIdPrefix(), from);
        return keyCustodyClient.getSecret(keyId)
                .orElseThrow(() -> new KeyNotFoundException("No signing key stored for " + keyId));
    }

    private SignedTransaction sign(Eip1559Transaction unsigned, String privateKey, String from) {
        String keyAddress;
        SignedTransaction signed;
        try {
            keyAddress = transactionSigner.addressOf(privateKey);
            signed = transactionSigner.sign(unsigned, privateKey);
        } catch (IllegalArgumentException e) {
            throw new KeyCustodyUnavailableException("Stored key for " + from + " is malformed", e);
        }
        if (!keyAddress.equalsIgnoreCase(from)) {
            throw new KeyCustodyUnavailableException("Stored key for " + from + " belongs to a different address");
        }
        return signed;
    }

    /** Holder count is only read and written inside map compute functions. */
    private static final class AddressLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
