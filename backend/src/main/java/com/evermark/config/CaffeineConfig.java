package com.evermark.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. ledgerCache holds each account's materialized ledger; entries are evicted on
 * every ledger change, the TTL only bounds memory for idle accounts.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String LEDGER_CACHE = "ledgerCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(LEDGER_CACHE, Caffeine.newBuilder()
                .expireAfterAccess(10, TimeUnit.MINUTES)
                .maximumSize(10_000)
                .build());
        return manager;
    }
}
