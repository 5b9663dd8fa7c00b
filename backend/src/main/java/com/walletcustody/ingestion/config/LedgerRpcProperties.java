package com.walletcustody.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;

/**
 * Ledger node endpoint, throttling and fee settings.
 */
@ConfigurationProperties(prefix = "walletcustody.ledger")
@NoArgsConstructor
@Getter
@Setter
public class LedgerRpcProperties {

    /** JSON-RPC HTTP endpoint of the ledger node. */
    private String url = "http://localhost:8545";

    /** Native asset symbol, stored upper-cased as the asset of native transfers. */
    private String nativeSymbol = "ETH";

    private int nativeDecimals = 18;

    /** Upper bound accepted by the amount codec, in decimal units. */
    private BigDecimal maxSupply = new BigDecimal("120000000");

    /** Upper bound on a single RPC round trip. */
    private Duration requestTimeout = Duration.ofSeconds(10);

    /** RPC budget (requests per second) for this service instance. */
    private int maxRequestsPerSecond = 50;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 2_000;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 100;

    /** Used when the node does not implement eth_maxPriorityFeePerGas (2 gwei). */
    private BigInteger fallbackPriorityFeeWei = BigInteger.valueOf(2_000_000_000L);

    /** Multiplier applied to eth_gasPrice before adding the priority fee. */
    private BigDecimal feeMargin = new BigDecimal("1.2");

    private long nativeTransferGasLimit = 21_000L;
}
