package com.pressroom.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Settings for composite writes.
 *
 * @param transactionTimeout  upper bound for one write transaction; a timed out
 *                            transaction is rolled back
 * @param tagConflictRetries  attempts made when a concurrent writer creates the same
 *                            tag name first
 * @param retryBackoff        pause before the second attempt, doubled for each further one
 */
@ConfigurationProperties(prefix = "pressroom.write")
public record WriteProperties(
        @DefaultValue("30s") Duration transactionTimeout,
        @DefaultValue("3") int tagConflictRetries,
        @DefaultValue("50ms") Duration retryBackoff
) {}
