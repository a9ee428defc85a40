package com.workhub.server.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.Instant;

/**
 * Bounded in-memory caches.
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Value("${hub.presence.transitions.max-size:100000}")
    private long presenceTransitionsMaxSize;

    @Value("${hub.presence.transitions.ttl-hours:24}")
    private long presenceTransitionsTtlHours;

    /**
     * Last online/offline transition per user id. Users not seen within the TTL
     * report no transition time.
     */
    @Bean
    public Cache<String, Instant> presenceTransitionsCache() {
        log.info("Creating presence transitions cache: maxSize={}, ttl={}h",
                presenceTransitionsMaxSize, presenceTransitionsTtlHours);
        return Caffeine.newBuilder()
                .maximumSize(presenceTransitionsMaxSize)
                .expireAfterWrite(Duration.ofHours(presenceTransitionsTtlHours))
                .recordStats()
                .build();
    }
}
