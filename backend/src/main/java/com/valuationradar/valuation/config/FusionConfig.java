package com.valuationradar.valuation.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FusionProperties.class)
public class FusionConfig {
}
