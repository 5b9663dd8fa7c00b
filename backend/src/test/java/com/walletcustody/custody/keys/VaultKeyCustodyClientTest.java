package com.walletcustody.custody.keys;

import com.walletcustody.common.KeyCustodyUnavailableException;
import com.walletcustody.custody.config.KeyCustodyProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.vault.VaultException;
import org.springframework.vault.core.VaultTemplate;
import org.springframework.vault.core.VaultVersionedKeyValueOperations;
import org.springframework.vault.support.Versioned;
import org.springframework.web.client.ResourceAccessException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VaultKeyCustodyClientTest {

    private static final String KEY_ID = "wallet_0x9d8a62f656a8d1615c1294fd71e9cfb3e4855a4f";
    private static final String PATH = "eth_wallets/" + KEY_ID;

    @Mock
    private VaultTemplate vaultTemplate;
    @Mock
    private VaultVersionedKeyValueOperations keyValue;

    private VaultKeyCustodyClient client;

    @BeforeEach
    void setUp() {
        when(vaultTemplate.opsForVersionedKeyValue("secret")).thenReturn(keyValue);
        client = new VaultKeyCustodyClient(vaultTemplate, new KeyCustodyProperties());
    }

    @Test
    void storedKey_returnsPrivateKeyField() {
        Map<String, Object> data = Map.of(VaultKeyCustodyClient.SECRET_FIELD, "46".repeat(32));
        when(keyValue.get(PATH)).thenReturn(Versioned.create(data));

        assertThat(client.getSecret(KEY_ID)).contains("46".repeat(32));
    }

    @Test
    void missingSecret_isEmpty() {
        when(keyValue.get(PATH)).thenReturn(null);

        assertThat(client.getSecret(KEY_ID)).isEmpty();
    }

    @Test
    void secretWithoutKeyField_isEmpty() {
        Map<String, Object> data = Map.of("other", "x");
        when(keyValue.get(PATH)).thenReturn(Versioned.create(data));

        assertThat(client.getSecret(KEY_ID)).isEmpty();
    }

    @Test
    void vaultError_mapsToUnavailable() {
        when(keyValue.get(PATH)).thenThrow(new VaultException("Status 503 Service Unavailable"));

        assertThatThrownBy(() -> client.getSecret(KEY_ID))
                .isInstanceOf(KeyCustodyUnavailableException.class)
                .hasMessageContaining(KEY_ID);
    }

    @Test
    void connectionRefused_mapsToUnavailable() {
        when(keyValue.get(PATH)).thenThrow(new ResourceAccessException("Connection refused"));

        assertThatThrownBy(() -> client.getSecret(KEY_ID))
                .isInstanceOfSatisfying(KeyCustodyUnavailableException.class, e -> assertThat(e.isClientError()).isFalse());
    }

    @Test
    void putSecret_writesPrivateKeyField() {
        client.putSecret(KEY_ID, "ab".repeat(32));

        verify(keyValue).put(PATH, Map.of(VaultKeyCustodyClient.SECRET_FIELD, "ab".repeat(32)));
    }
}
