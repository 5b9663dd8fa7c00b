package com.walletcustody.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.walletcustody.common.LedgerUnavailableException;
import com.walletcustody.domain.Confirmations;
import com.walletcustody.domain.RawLedgerTransaction;
import com.walletcustody.domain.Transfer;
import com.walletcustody.ingestion.adapter.LedgerCall;
import com.walletcustody.ingestion.adapter.LedgerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * EVM JSON-RPC implementation of {@link LedgerClient}. Every node request goes through {@link EvmRpcGateway}
 * (shared rate limiter, bounded timeout).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvmLedgerClient implements LedgerClient {

    private final EvmRpcGateway rpcGateway;
    private final TransferEventDecoder transferEventDecoder;
    private final TokenSymbolResolver tokenSymbolResolver;

    @Override
    public Optional<RawLedgerTransaction> getTransaction(String hash) {
        JsonNode tx = rpcGateway.call("eth_getTransactionByHash", List.of(hash));
        if (EvmRpcGateway.isAbsent(tx)) {
            return Optional.empty();
        }
        BigInteger blockNumber = EvmRpcGateway.parseQuantity(textOrNull(tx, "blockNumber"));
        BigInteger value = EvmRpcGateway.parseQuantity(textOrNull(tx, "value"));
        return Optional.of(new RawLedgerTransaction(
                tx.path("hash").asText(hash),
                textOrNull(tx, "from"),
                textOrNull(tx, "to"),
                value != null ? value : BigInteger.ZERO,
                textOrNull(tx, "input"),
                blockNumber != null ? blockNumber.longValueExact() : null));
    }

    @Override
    public Confirmations getConfirmations(String hash) {
        try {
            Optional<RawLedgerTransaction> tx = getTransaction(hash);
            if (tx.isEmpty() || !tx.get().isMined()) {
                return Confirmations.of(0L);
            }
            long currentBlock = getBlockNumber();
            return Confirmations.of(currentBlock - tx.get().blockNumber() + 1);
        } catch (RuntimeException e) {
            log.warn("Confirmation lookup failed for {}, reporting 0: {}", hash, e.getMessage());
            return Confirmations.unavailable();
        }
    }

    @Override
    public List<Transfer> getTransferEvents(String hash) {
        Optional<RawLedgerTransaction> tx = getTransaction(hash);
        if (tx.isEmpty()) {
            return List.of();
        }
        return getTransferEvents(tx.get());
    }

    @Override
    public List<Transfer> getTransferEvents(RawLedgerTransaction tx) {
        List<Transfer> transfers = new ArrayList<>();
        if (tx.value() != null && tx.value().signum() > 0) {
            transfers.add(Transfer.nativeTransfer(tx.from(), tx.to(), tx.value()));
        }
        try {
            JsonNode receipt = rpcGateway.call("eth_getTransactionReceipt", List.of(tx.hash()));
            if (!EvmRpcGateway.isAbsent(receipt)) {
                transfers.addAll(transferEventDecoder.decode(receipt.path("logs")));
            }
        } catch (LedgerUnavailableException e) {
            log.warn("Receipt lookup failed for {}, token transfers omitted: {}", tx.hash(), e.getMessage());
        }
        return transfers;
    }

    @Override
    public String getTokenSymbol(String contractAddress) {
        return tokenSymbolResolver.resolve(contractAddress);
    }

    @Override
    public boolean isTokenTransaction(RawLedgerTransaction tx) {
        return tx != null && tx.hasCallData();
    }

    @Override
    public long getBlockNumber() {
        return requireQuantity("eth_blockNumber", rpcGateway.call("eth_blockNumber", List.of())).longValueExact();
    }

    @Override
    public BigInteger getBalance(String address) {
        return requireQuantity("eth_getBalance", rpcGateway.call("eth_getBalance", List.of(address, "latest")));
    }

    @Override
    public long getTransactionCount(String address) {
        return requireQuantity("eth_getTransactionCount",
                rpcGateway.call("eth_getTransactionCount", List.of(address, "pending"))).longValueExact();
    }

    @Override
    public BigInteger getGasPrice() {
        return requireQuantity("eth_gasPrice", rpcGateway.call("eth_gasPrice", List.of()));
    }

    @Override
    public Optional<BigInteger> getMaxPriorityFeePerGas() {
        try {
            JsonNode result = rpcGateway.call("eth_maxPriorityFeePerGas", List.of());
            return Optional.ofNullable(EvmRpcGateway.parseQuantity(result.asText(null)));
        } catch (LedgerUnavailableException e) {
            log.debug("eth_maxPriorityFeePerGas unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public long getChainId() {
        return requireQuantity("eth_chainId", rpcGateway.call("eth_chainId", List.of())).longValueExact();
    }

    @Override
    public BigInteger estimateGas(LedgerCall call) {
        Map<String, Object> callObject = new LinkedHashMap<>();
        callObject.put("from", call.from());
        callObject.put("to", call.to());
        if (call.value() != null) {
            callObject.put("value", EvmRpcGateway.toQuantity(call.value()));
        }
        if (call.data() != null) {
            callObject.put("data", call.data());
        }
        return requireQuantity("eth_estimateGas", rpcGateway.call("eth_estimateGas", List.of(callObject)));
    }

    @Override
    public String sendRawTransaction(byte[] signedTransaction) {
        JsonNode result = rpcGateway.call("eth_sendRawTransaction", List.of("0x" + Hex.toHexString(signedTransaction)));
        if (EvmRpcGateway.isAbsent(result) || result.asText().isBlank()) {
            throw new LedgerUnavailableException("eth_sendRawTransaction returned no hash");
        }
        return result.asText();
    }

    private static BigInteger requireQuantity(String method, JsonNode result) {
        BigInteger value = EvmRpcGateway.isAbsent(result) ? null : EvmRpcGateway.parseQuantity(result.asText(null));
        if (value == null) {
            throw new LedgerUnavailableException(method + " returned no result");
        }
        return value;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return EvmRpcGateway.isAbsent(value) ? null : value.asText();
    }
}
