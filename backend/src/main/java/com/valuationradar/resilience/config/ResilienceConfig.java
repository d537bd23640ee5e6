package com.valuationradar.resilience.config;

import com.valuationradar.common.Sleeper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience module configuration: properties and the blocking sleeper used by rate limiters.
 */
@Configuration
@EnableConfigurationProperties(ResilienceProperties.class)
public class ResilienceConfig {

    @Bean
    public Sleeper rateLimiterSleeper() {
        return Sleeper.THREAD;
    }
}
