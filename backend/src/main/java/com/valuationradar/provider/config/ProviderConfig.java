package com.valuationradar.provider.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Provider module configuration. Adapters pick up {@link ProviderProperties} and the Boot-managed WebClient.Builder.
 */
@Configuration
@EnableConfigurationProperties(ProviderProperties.class)
public class ProviderConfig {
}
