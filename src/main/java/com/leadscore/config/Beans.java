package com.leadscore.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.leadscore.models.ScoringConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.TimeUnit;


@Configuration
public class Beans {

    @Bean
    public Clock scoringClock() {
        return Clock.systemUTC();
    }

    @Bean(name = "scoringConfigCache")
    public Cache<String, ScoringConfig> scoringConfigCache(ScoringProperties properties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(properties.getConfigCacheTtlMinutes(), TimeUnit.MINUTES)
                .maximumSize(properties.getConfigCacheSize())
                .build();
    }
}
