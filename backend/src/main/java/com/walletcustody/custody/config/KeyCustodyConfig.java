package com.walletcustody.custody.config;

import com.walletcustody.custody.keys.KeyCustodyClient;
import com.walletcustody.custody.keys.VaultKeyCustodyClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.vault.authentication.SimpleSessionManager;
import org.springframework.vault.authentication.TokenAuthentication;
import org.springframework.vault.client.ClientHttpRequestFactoryFactory;
import org.springframework.vault.client.VaultEndpoint;
import org.springframework.vault.core.VaultTemplate;
import org.springframework.vault.support.ClientOptions;
import org.springframework.vault.support.SslConfiguration;

import java.net.URI;

@Slf4j
@Configuration
@EnableConfigurationProperties(KeyCustodyProperties.class)
public class KeyCustodyConfig {

    @Bean
    public VaultTemplate keyCustodyVaultTemplate(KeyCustodyProperties properties) {
        VaultEndpoint endpoint = VaultEndpoint.from(URI.create(properties.getUrl()));
        ClientHttpRequestFactory requestFactory = ClientHttpRequestFactoryFactory.create(
                new ClientOptions(properties.getConnectTimeout(), properties.getReadTimeout()),
                SslConfiguration.unconfigured());
        log.info("Configured key custody Vault endpoint: {}", properties.getUrl());
        return new VaultTemplate(endpoint, requestFactory,
                new SimpleSessionManager(new TokenAuthentication(properties.getToken())));
    }

    @Bean
    public KeyCustodyClient keyCustodyClient(VaultTemplate keyCustodyVaultTemplate, KeyCustodyProperties properties) {
        return new VaultKeyCustodyClient(keyCustodyVaultTemplate, properties);
    }
}
