package com.walletcustody.custody.keys;

import com.walletcustody.common.KeyCustodyUnavailableException;
import com.walletcustody.custody.config.KeyCustodyProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.vault.VaultException;
import org.springframework.vault.core.VaultTemplate;
import org.springframework.vault.core.VaultVersionedKeyValueOperations;
import org.springframework.vault.support.Versioned;
import org.springframework.web.client.RestClientException;

import java.util.Map;
import java.util.Optional;

/**
 * HashiCorp Vault KV v2 key store. Secrets live at {@code {mount}/data/{secretPath}/{keyId}} under field
 * {@value #SECRET_FIELD}. Key ids are logged, key material never is.
 */
@Slf4j
@RequiredArgsConstructor
public class VaultKeyCustodyClient implements KeyCustodyClient {

    static final String SECRET_FIELD = "private_key";

    private final VaultTemplate vaultTemplate;
    private final KeyCustodyProperties properties;

    @Override
    public Optional<String> getSecret(String keyId) {
        String path = secretPath(keyId);
        Versioned<Map<String, Object>> secret;
        try {
            secret = keyValue().get(path);
        } catch (VaultException | RestClientException e) {
            log.error("Key custody read failed for {}: {}", keyId, e.getMessage());
            throw new KeyCustodyUnavailableException("Key custody read failed for " + keyId, e);
        }
        if (secret == null || !secret.hasData()) {
            log.info("No key stored for {}", keyId);
            return Optional.empty();
        }
        Object value = secret.getData().get(SECRET_FIELD);
        if (value == null) {
            log.warn("Secret for {} has no {} field", keyId, SECRET_FIELD);
            return Optional.empty();
        }
        log.debug("Key custody read for {}", keyId);
        return Optional.of(value.toString());
    }

    @Override
    public void putSecret(String keyId, String secret) {
        try {
            keyValue().put(secretPath(keyId), Map.of(SECRET_FIELD, secret));
            log.info("Stored key for {}", keyId);
        } catch (VaultException | RestClientException e) {
            log.error("Key custody write failed for {}: {}", keyId, e.getMessage());
            throw new KeyCustodyUnavailableException("Key custody write failed for " + keyId, e);
        }
    }

    private VaultVersionedKeyValueOperations keyValue() {
        return vaultTemplate.opsForVersionedKeyValue(properties.getMount());
    }

    private String secretPath(String keyId) {
        return properties.getSecretPath() + "/" + keyId;
    }
}
