package com.ryvin.matching.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "matching.sweep")
public record JourneySweepProperties(boolean enabled, Duration pollInterval, int batchSize) {}
