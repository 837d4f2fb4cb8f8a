package org.healthcare.loader.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Registers {@link LoaderProperties} and the clock used to stamp ingestion timestamps.
 */
@Configuration
@EnableConfigurationProperties(LoaderProperties.class)
public class LoaderConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
