package com.walletcustody.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.RECONCILIATION_EXECUTOR)
    ThreadPoolTaskExecutor reconciliationExecutor;

    @Test
    @DisplayName("token symbol cache is created and usable")
    void tokenSymbolCacheCreated() {
        assertThat(cacheManager.getCache(CaffeineConfig.TOKEN_SYMBOL_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.TOKEN_SYMBOL_CACHE).put("0xabc", "USDT");
        assertThat(cacheManager.getCache(CaffeineConfig.TOKEN_SYMBOL_CACHE).get("0xabc").get()).isEqualTo("USDT");
    }

    @Test
    @DisplayName("reconciliation executor holds every default tier without queueing")
    void reconciliationExecutorCreated() {
        assertThat(reconciliationExecutor.getCorePoolSize()).isEqualTo(4);
        assertThat(reconciliationExecutor.getMaxPoolSize()).isEqualTo(8);
        assertThat(reconciliationExecutor.getThreadNamePrefix()).isEqualTo("reconcile-");
    }
}
