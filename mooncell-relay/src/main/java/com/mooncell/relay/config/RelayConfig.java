package com.mooncell.relay.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.mooncell.relay.core.network.SourceNetworkClient;
import com.mooncell.relay.core.ratelimit.AdaptiveRateLimiter;
import com.mooncell.relay.core.session.SessionConnector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class RelayConfig {

    @Bean
    public AdaptiveRateLimiter adaptiveRateLimiter(RelayProperties properties) {
        RelayProperties.RateLimiter config = properties.getRateLimiter();
        log.info("Rate limiter: capacity={}, rate={}/s in [{}, {}]",
                config.getCapacity(), config.getInitialRate(), config.getMinRate(), config.getMaxRate());
        return new AdaptiveRateLimiter(config, Ticker.systemTicker());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public SourceNetworkClient sourceNetworkClient() {
        log.warn("No SourceNetworkClient bean found, relay tasks will fail until one is provided");
        return new UnconfiguredNetworkClient();
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionConnector sessionConnector() {
        log.warn("No SessionConnector bean found, sessions will stay degraded until one is provided");
        return new UnconfiguredSessionConnector();
    }
}
