package com.acme.amqp.core;

/**
 * Thrown when a message asked to be kicked back has used up its retries.
 * The message should be treated as permanently failed.
 */
public class RetryExhaustedException extends RuntimeException {
    private final long retryCount;
    private final long maxRetries;

    public RetryExhaustedException(long retryCount, long maxRetries) {
        super("too many retries: " + retryCount + " > " + maxRetries);
        this.retryCount = retryCount;
        this.maxRetries = maxRetries;
    }

    public long getRetryCount() {
        return retryCount;
    }

    public long getMaxRetries() {
        return maxRetries;
    }
}
