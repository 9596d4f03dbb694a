package com.maslen.favsync.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Starts the producer, consumer and reconciliation loops. Tests switch it off with
 * {@code favsync.scheduling.enabled=false} and drive the cycles themselves.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "favsync.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
