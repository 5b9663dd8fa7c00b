package com.walletcustody.ingestion.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletcustody.common.LedgerUnavailableException;
import com.walletcustody.config.CaffeineConfig;
import com.walletcustody.domain.Confirmations;
import com.walletcustody.domain.RawLedgerTransaction;
import com.walletcustody.domain.Transfer;
import com.walletcustody.domain.TransferAsset;
import com.walletcustody.ingestion.adapter.evm.EvmLedgerClient;
import com.walletcustody.ingestion.adapter.evm.EvmRpcGateway;
import com.walletcustody.ingestion.adapter.evm.TokenSymbolResolver;
import com.walletcustody.ingestion.adapter.evm.TransferEventDecoder;
import com.walletcustody.ingestion.config.LedgerRpcProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvmLedgerClientTest {

    private static final String HASH = "0x" + "1".repeat(64);
    private static final String SENDER = "0x1111111111111111111111111111111111111111";
    private static final String RECIPIENT = "0x2222222222222222222222222222222222222222";
    private static final String TOKEN = "0x3333333333333333333333333333333333333333";
    private static final String SENDER_TOPIC = "0x" + "0".repeat(24) + SENDER.substring(2);
    private static final String RECIPIENT_TOPIC = "0x" + "0".repeat(24) + RECIPIENT.substring(2);

    private MockLedgerRpcClient mockRpc;
    private EvmLedgerClient client;

    @BeforeEach
    void setUp() {
        mockRpc = new MockLedgerRpcClient();
        EvmRpcGateway gateway = new EvmRpcGateway(mockRpc, fastLimiter(), new LedgerRpcProperties(), new ObjectMapper());
        TokenSymbolResolver symbolResolver = new TokenSymbolResolver(gateway, new CaffeineConfig().caffeineCacheManager());
        client = new EvmLedgerClient(gateway, new TransferEventDecoder(), symbolResolver);
    }

    private static RateLimiter fastLimiter() {
        return RateLimiter.of("test", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(10_000)
                .timeoutDuration(Duration.ZERO)
                .build());
    }

    private void givenTransaction(String value, String input, String blockNumber) {
        mockRpc.setResult("eth_getTransactionByHash", """
                {"hash":"%s","from":"%s","to":"%s","value":"%s","input":"%s","blockNumber":%s}
                """.formatted(HASH, SENDER, TOKEN, value, input, blockNumber == null ? "null" : "\"" + blockNumber + "\""));
    }

    @Nested
    @DisplayName("getTransaction")
    class GetTransaction {

        @Test
        void parsesFields() {
            givenTransaction("0xde0b6b3a7640000", "0x", "0x64");

            Optional<RawLedgerTransaction> tx = client.getTransaction(HASH);

            assertThat(tx).isPresent();
            assertThat(tx.get().from()).isEqualTo(SENDER);
            assertThat(tx.get().value()).isEqualTo(new BigInteger("1000000000000000000"));
            assertThat(tx.get().blockNumber()).isEqualTo(100L);
            assertThat(client.isTokenTransaction(tx.get())).isFalse();
        }

        @Test
        void unknownHash_returnsEmpty() {
            mockRpc.setResult("eth_getTransactionByHash", "null");

            assertThat(client.getTransaction(HASH)).isEmpty();
        }

        @Test
        void nodeError_propagates() {
            mockRpc.setError("eth_getTransactionByHash", -32000, "boom");

            assertThatThrownBy(() -> client.getTransaction(HASH))
                    .isInstanceOf(LedgerUnavailableException.class)
                    .hasMessageContaining("boom");
        }
    }

    @Nested
    @DisplayName("getConfirmations")
    class GetConfirmations {

        @Test
        @DisplayName("tx in block 100 with head at 106 has 7 confirmations")
        void minedTransaction_countsInclusive() {
            givenTransaction("0x0", "0x", "0x64");
            mockRpc.setResult("eth_blockNumber", "\"0x6a\"");

            Confirmations confirmations = client.getConfirmations(HASH);

            assertThat(confirmations.count()).isEqualTo(7L);
            assertThat(confirmations.degraded()).isFalse();
        }

        @Test
        void unminedTransaction_hasZero() {
            givenTransaction("0x0", "0x", null);

            Confirmations confirmations = client.getConfirmations(HASH);

            assertThat(confirmations.count()).isZero();
            assertThat(confirmations.degraded()).isFalse();
            assertThat(mockRpc.callCount("eth_blockNumber")).isZero();
        }

        @Test
        void lookupFailure_degradesToZeroWithoutThrowing() {
            givenTransaction("0x0", "0x", "0x64");

            Confirmations confirmations = client.getConfirmations(HASH);

            assertThat(confirmations.count()).isZero();
            assertThat(confirmations.degraded()).isTrue();
        }
    }

    @Nested
    @DisplayName("getTransferEvents")
    class GetTransferEvents {

        @Test
        @DisplayName("decodes Transfer log with data 0x03e8 as 1000")
        void decodesTransferLog() {
            givenTransaction("0x0", "0xa9059cbb", "0x64");
            mockRpc.setResult("eth_getTransactionReceipt", """
                    {"transactionHash":"%s","logs":[
                      {"address":"%s","topics":["0xDDF252AD1BE2C89B69C2B068FC378DAA952BA7F163C4A11628F55A4DF523B3EF","%s","%s"],"data":"0x03e8","logIndex":"0x0"},
                      {"address":"%s","topics":["0x8c5be1e5ebec7d5bd14f71427d1e84f3dd0314c0f7b2291e5b200ac8c7c3b925","%s","%s"],"data":"0x01","logIndex":"0x1"},
                      {"address":"%s","topics":["0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef","%s"],"data":"0x01","logIndex":"0x2"}
                    ]}
                    """.formatted(HASH, TOKEN, SENDER_TOPIC, RECIPIENT_TOPIC, TOKEN, SENDER_TOPIC, RECIPIENT_TOPIC, TOKEN, SENDER_TOPIC));

            List<Transfer> transfers = client.getTransferEvents(HASH);

            assertThat(transfers).containsExactly(Transfer.tokenTransfer(SENDER, RECIPIENT, BigInteger.valueOf(1000)));
        }

        @Test
        void nativeValue_comesFirst() {
            givenTransaction("0x5", "0xa9059cbb", "0x64");
            mockRpc.setResult("eth_getTransactionReceipt", """
                    {"logs":[{"topics":["0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef","%s","%s"],"data":"0x"}]}
                    """.formatted(SENDER_TOPIC, RECIPIENT_TOPIC));

            List<Transfer> transfers = client.getTransferEvents(HASH);

            assertThat(transfers).hasSize(2);
            assertThat(transfers.get(0).asset()).isEqualTo(TransferAsset.NATIVE);
            assertThat(transfers.get(0).value()).isEqualTo(BigInteger.valueOf(5));
            assertThat(transfers.get(1).value()).isZero();
        }

        @Test
        void receiptFailure_yieldsNoTokenTransfers() {
            givenTransaction("0x5", "0xa9059cbb", "0x64");
            mockRpc.setError("eth_getTransactionReceipt", -32000, "receipt unavailable");

            List<Transfer> transfers = client.getTransferEvents(HASH);

            assertThat(transfers).extracting(Transfer::asset).containsExactly(TransferAsset.NATIVE);
        }
    }

    @Nested
    @DisplayName("getTokenSymbol")
    class GetTokenSymbol {

        @Test
        void dynamicString_isUpperCasedAndCached() {
            mockRpc.setResult("eth_call", "\"0x"
                    + "0000000000000000000000000000000000000000000000000000000000000020"
                    + "0000000000000000000000000000000000000000000000000000000000000004"
                    + "7573646300000000000000000000000000000000000000000000000000000000\"");

            assertThat(client.getTokenSymbol(TOKEN)).isEqualTo("USDC");
            assertThat(client.getTokenSymbol(TOKEN.toUpperCase().replace("0X", "0x"))).isEqualTo("USDC");
            assertThat(mockRpc.callCount("eth_call")).isEqualTo(1);
        }

        @Test
        void bytes32Symbol_isDecoded() {
            mockRpc.setResult("eth_call", "\"0x4d4b520000000000000000000000000000000000000000000000000000000000\"");

            assertThat(client.getTokenSymbol(TOKEN)).isEqualTo("MKR");
        }

        @Test
        void failure_returnsUnknownAndIsNotCached() {
            mockRpc.setError("eth_call", 3, "execution reverted");

            assertThat(client.getTokenSymbol(TOKEN)).isEqualTo(LedgerClient.UNKNOWN_SYMBOL);
            assertThat(client.getTokenSymbol(TOKEN)).isEqualTo(LedgerClient.UNKNOWN_SYMBOL);
            assertThat(mockRpc.callCount("eth_call")).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("origination primitives")
    class OriginationPrimitives {

        @Test
        void quantities_areParsedFromHex() {
            mockRpc.setResult("eth_getBalance", "\"0xde0b6b3a7640000\"");
            mockRpc.setResult("eth_getTransactionCount", "\"0x7\"");
            mockRpc.setResult("eth_gasPrice", "\"0x3b9aca00\"");
            mockRpc.setResult("eth_chainId", "\"0x1\"");
            mockRpc.setResult("eth_blockNumber", "\"0x12d687\"");

            assertThat(client.getBlockNumber()).isEqualTo(1_234_567L);
            assertThat(client.getBalance(SENDER)).isEqualTo(new BigInteger("1000000000000000000"));
            assertThat(client.getTransactionCount(SENDER)).isEqualTo(7L);
            assertThat(client.getGasPrice()).isEqualTo(BigInteger.valueOf(1_000_000_000L));
            assertThat(client.getChainId()).isEqualTo(1L);
            assertThat(mockRpc.lastParams("eth_getTransactionCount")).isEqualTo(List.of(SENDER, "pending"));
        }

        @Test
        void maxPriorityFee_unsupported_isEmpty() {
            mockRpc.setError("eth_maxPriorityFeePerGas", -32601, "the method does not exist");

            assertThat(client.getMaxPriorityFeePerGas()).isEmpty();
        }

        @Test
        void maxPriorityFee_supported() {
            mockRpc.setResult("eth_maxPriorityFeePerGas", "\"0x59682f00\"");

            assertThat(client.getMaxPriorityFeePerGas()).contains(BigInteger.valueOf(1_500_000_000L));
        }

        @Test
        void estimateGas_sendsCallObject() {
            mockRpc.setResult("eth_estimateGas", "\"0xfde8\"");

            BigInteger gas = client.estimateGas(new LedgerCall(SENDER, TOKEN, BigInteger.ZERO, "0xa9059cbb"));

            assertThat(gas).isEqualTo(BigInteger.valueOf(65_000));
            assertThat(mockRpc.lastParams("eth_estimateGas").toString()).contains("to=" + TOKEN, "data=0xa9059cbb", "value=0x0");
        }

        @Test
        void sendRawTransaction_hexEncodesPayload() {
            mockRpc.setResult("eth_sendRawTransaction", "\"" + HASH + "\"");

            String hash = client.sendRawTransaction(new byte[]{0x02, (byte) 0xf8});

            assertThat(hash).isEqualTo(HASH);
            assertThat(mockRpc.lastParams("eth_sendRawTransaction")).isEqualTo(List.of("0x02f8"));
        }

        @Test
        void balance_nodeUnreachable_throws() {
            assertThatThrownBy(() -> client.getBalance(SENDER))
                    .isInstanceOf(LedgerUnavailableException.class);
        }
    }
}
