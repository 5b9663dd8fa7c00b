package com.walletcustody.ingestion.adapter.evm;

import com.walletcustody.common.LedgerUnavailableException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC over HTTP using WebClient. Every request is bounded by {@code requestTimeout}.
 */
public class WebClientLedgerRpcClient implements LedgerRpcClient {

    private final WebClient webClient;
    private final String endpointUrl;
    private final Duration requestTimeout;
    private final AtomicLong requestIds = new AtomicLong();

    public WebClientLedgerRpcClient(WebClient.Builder builder, String endpointUrl, Duration requestTimeout) {
        this.webClient = builder.build();
        this.endpointUrl = endpointUrl;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Mono<String> call(String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", requestIds.incrementAndGet(),
                "method", method,
                "params", params != null ? params : List.of()
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(requestTimeout)
                .onErrorMap(WebClientException.class,
                        e -> new LedgerUnavailableException(method + " failed on " + endpointUrl + ": " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new LedgerUnavailableException(method + " timed out after " + requestTimeout + " on " + endpointUrl, e));
    }
}
