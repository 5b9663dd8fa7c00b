package com.walletcustody.ingestion.config;

import com.walletcustody.common.AmountConverter;
import com.walletcustody.ingestion.adapter.evm.LedgerRpcClient;
import com.walletcustody.ingestion.adapter.evm.WebClientLedgerRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the ledger node transport, its shared rate limiter and the amount codec.
 */
@Configuration
@EnableConfigurationProperties({ LedgerRpcProperties.class, ClassifierProperties.class, ReconciliationProperties.class })
public class LedgerAdapterConfig {

    @Bean
    public LedgerRpcClient ledgerRpcClient(WebClient.Builder webClientBuilder, LedgerRpcProperties properties) {
        return new WebClientLedgerRpcClient(webClientBuilder, properties.getUrl(), properties.getRequestTimeout());
    }

    @Bean(name = "ledgerRpcRateLimiter")
    public RateLimiter ledgerRpcRateLimiter(LedgerRpcProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("ledger-rpc", config);
    }

    @Bean
    public AmountConverter amountConverter(LedgerRpcProperties properties) {
        return new AmountConverter(properties.getNativeDecimals(), properties.getMaxSupply());
    }
}
