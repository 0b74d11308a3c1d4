package com.exportscan.config;

import com.exportscan.model.RunSnapshot;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Caffeine cache holding the most recent reconciliation runs.
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Value("${app.cache.runs.max-size:10}")
    private int runsMaxSize;

    @Value("${app.cache.runs.ttl-minutes:60}")
    private int runsTtlMinutes;

    @Bean
    public Cache<String, RunSnapshot> recentRunsCache() {
        log.info("Creating recent runs cache: maxSize={}, ttl={}m", runsMaxSize, runsTtlMinutes);
        return Caffeine.newBuilder()
                .maximumSize(runsMaxSize)
                .expireAfterWrite(Duration.ofMinutes(runsTtlMinutes))
                .recordStats()
                .build();
    }
}
