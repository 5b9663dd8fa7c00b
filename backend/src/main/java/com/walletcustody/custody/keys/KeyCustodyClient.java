package com.walletcustody.custody.keys;

import java.util.Optional;

/**
 * Opaque secret store holding one signing key per custodied wallet.
 * Implementations throw {@link com.walletcustody.common.KeyCustodyUnavailableException} when the store cannot be
 * reached; an absent key is an empty result, not an error.
 */
public interface KeyCustodyClient {

    Optional<String> getSecret(String keyId);

    void putSecret(String keyId, String secret);
}
