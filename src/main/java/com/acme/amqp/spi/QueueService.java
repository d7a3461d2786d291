package com.acme.amqp.spi;

import com.acme.amqp.config.QueueConfig;

import java.io.IOException;

/**
 * Broker-side operations for one logical queue.
 */
public interface QueueService {
    void createQueue() throws IOException;
    void createExchange() throws IOException;
    AmqpChannel channel() throws IOException;
    QueueConfig config();
}
