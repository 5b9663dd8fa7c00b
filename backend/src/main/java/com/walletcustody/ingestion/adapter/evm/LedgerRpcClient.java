package com.walletcustody.ingestion.adapter.evm;

import reactor.core.publisher.Mono;

/**
 * Raw JSON-RPC transport. Returns the response body; callers parse result/error.
 */
public interface LedgerRpcClient {

    Mono<String> call(String method, Object params);
}
