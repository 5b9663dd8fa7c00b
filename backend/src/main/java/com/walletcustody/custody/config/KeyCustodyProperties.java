package com.walletcustody.custody.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Vault connection and key layout.
 */
@ConfigurationProperties(prefix = "walletcustody.key-custody")
@NoArgsConstructor
@Getter
@Setter
public class KeyCustodyProperties {

    private String url = "http://localhost:8200";

    private String token = "root";

    /** KV v2 mount. */
    private String mount = "secret";

    /** Directory under the mount holding one secret per wallet. */
    private String secretPath = "eth_wallets";

    /** Key id is this prefix followed by the wallet address. */
    private String keyIdPrefix = "wallet_";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(15);
}
