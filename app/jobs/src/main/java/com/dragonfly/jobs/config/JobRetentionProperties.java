/*
 * Where: Jobs application configuration binding
 * What: Holds retention cleanup settings for archived messages and processed jobs
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.dragonfly.jobs.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "jobs.retention")
public record JobRetentionProperties(
                boolean enabled,
                int retentionDays,
                Duration cleanupInterval) {
}
