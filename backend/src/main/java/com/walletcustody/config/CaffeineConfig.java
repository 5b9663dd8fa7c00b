package com.walletcustody.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    /** ERC20 symbol() per contract address. Symbols are immutable in practice. */
    public static final String TOKEN_SYMBOL_CACHE = "tokenSymbolCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(TOKEN_SYMBOL_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(5_000)
                .build());
        return manager;
    }
}
