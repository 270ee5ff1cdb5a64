package com.example.simplecache.config;

import com.example.simplecache.core.Cache;
import com.example.simplecache.core.CacheClock;
import com.example.simplecache.core.CacheOptions;
import com.example.simplecache.core.LockingCache;
import com.example.simplecache.core.SimpleCache;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SimpleCacheProperties.class)
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @Bean
    public CacheClock cacheClock() {
        return CacheClock.SYSTEM;
    }

    @Bean
    public RandomGenerator evictionRandom(SimpleCacheProperties properties) {
        Long seed = properties.getRandomSeed();
        return seed != null ? new Well19937c(seed) : new Well19937c();
    }

    @Bean
    public Cache<String, Object> cache(SimpleCacheProperties properties, CacheClock cacheClock,
                                       RandomGenerator evictionRandom) {
        CacheOptions options = properties.toOptions();
        Cache<String, Object> cache = new SimpleCache<>(options, cacheClock, evictionRandom);
        log.info("Created cache with {} (threadSafe={})", options, properties.isThreadSafe());
        return properties.isThreadSafe() ? new LockingCache<>(cache) : cache;
    }
}
