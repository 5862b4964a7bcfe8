package com.smartmoneyradar.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Only the native SOL price is cached; asset snapshots are always fetched fresh.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String NATIVE_PRICE_CACHE = "nativePriceCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(NATIVE_PRICE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.SECONDS)
                .maximumSize(10)
                .build());
        return manager;
    }
}
