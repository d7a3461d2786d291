package com.acme.amqp.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Retry budget applied when messages are kicked back.
 */
@ConfigurationProperties("amqp.retry")
public class RetryConfig {

    private long maxRetries = 3;

    public long getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(long maxRetries) {
        this.maxRetries = maxRetries;
    }
}
