package com.acme.amqp.spi;

import com.acme.amqp.core.Delivery;
import com.acme.amqp.core.Envelope;

import java.io.IOException;
import java.util.Map;
import java.util.function.Consumer;

/**
 * The subset of an AMQP channel this library needs.
 */
public interface AmqpChannel extends AutoCloseable {
    @Override
    void close() throws IOException;

    /**
     * Starts consuming {@code queue}, passing each delivery to {@code handler}.
     *
     * @return the consumer tag assigned by the broker
     */
    String consume(String queue, String consumer, boolean autoAck, boolean exclusive, boolean noLocal,
                   boolean noWait, Map<String, Object> args, Consumer<Delivery> handler) throws IOException;

    void publish(String exchange, String key, boolean mandatory, boolean immediate, Envelope msg) throws IOException;

    void queueDeclare(String name, boolean durable, boolean autoDelete, boolean exclusive, boolean noWait,
                      Map<String, Object> args) throws IOException;

    void exchangeBind(String destination, String key, String source, boolean noWait,
                      Map<String, Object> args) throws IOException;

    void exchangeDeclare(String name, String kind, boolean durable, boolean autoDelete, boolean internal,
                         boolean noWait, Map<String, Object> args) throws IOException;

    void queueBind(String name, String key, String exchange, boolean noWait, Map<String, Object> args) throws IOException;

    void tx() throws IOException;
    void txCommit() throws IOException;
    void txRollback() throws IOException;
}
