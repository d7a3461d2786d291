package com.acme.amqp.core;

import com.acme.amqp.config.RetryConfig;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

@Singleton
public final class RetryingAmqpMessage implements AmqpMessage {

    private final long maxRetries;

    @Inject
    public RetryingAmqpMessage(RetryConfig config) {
        this(config.getMaxRetries());
    }

    public RetryingAmqpMessage(long maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getMaxRetries() {
        return maxRetries;
    }

    @Override
    public Envelope createMessage(Object body) {
        return Messages.createMessage(body);
    }

    @Override
    public Envelope getKickbackMessage(Delivery msg) {
        return Messages.getKickbackMessage(maxRetries, msg);
    }

    @Override
    public Envelope getNextMessage(Delivery msg, Object body) {
        return Messages.getNextMessage(msg, body);
    }
}
