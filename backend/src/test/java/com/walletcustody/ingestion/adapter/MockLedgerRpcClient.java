package com.walletcustody.ingestion.adapter;

import com.walletcustody.common.LedgerUnavailableException;
import com.walletcustody.ingestion.adapter.evm.LedgerRpcClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Canned JSON-RPC responses keyed by method. Unconfigured methods fail like an unreachable node.
 */
public class MockLedgerRpcClient implements LedgerRpcClient {

    private final Map<String, String> responses = new ConcurrentHashMap<>();
    private final List<String> calledMethods = new ArrayList<>();
    private final Map<String, Object> lastParams = new ConcurrentHashMap<>();

    public void setResult(String method, String resultJson) {
        responses.put(method, "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":" + resultJson + "}");
    }

    public void setError(String method, int code, String message) {
        responses.put(method, "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":" + code + ",\"message\":\"" + message + "\"}}");
    }

    public synchronized int callCount(String method) {
        return (int) calledMethods.stream().filter(method::equals).count();
    }

    public Object lastParams(String method) {
        return lastParams.get(method);
    }

    @Override
    public synchronized Mono<String> call(String method, Object params) {
        calledMethods.add(method);
        if (params != null) {
            lastParams.put(method, params);
        }
        String response = responses.get(method);
        if (response == null) {
            return Mono.error(new LedgerUnavailableException(method + " failed: connection refused"));
        }
        return Mono.just(response);
    }
}
