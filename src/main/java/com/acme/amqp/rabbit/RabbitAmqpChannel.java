package com.acme.amqp.rabbit;

import com.acme.amqp.core.Delivery;
import com.acme.amqp.core.Envelope;
import com.acme.amqp.spi.AmqpChannel;
import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DeliverCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * {@link AmqpChannel} backed by a RabbitMQ client channel. {@code noWait} maps to the client's
 * {@code *NoWait} methods.
 */
public class RabbitAmqpChannel implements AmqpChannel {
    private static final Logger LOG = LoggerFactory.getLogger(RabbitAmqpChannel.class);

    private final Channel channel;

    public RabbitAmqpChannel(Channel channel) {
        this.channel = channel;
    }

    @Override
    public void close() throws IOException {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (TimeoutException e) {
            throw new IOException("Timed out closing channel " + channel.getChannelNumber(), e);
        }
    }

    /**
     * The RabbitMQ client always waits for consume-ok, so {@code noWait} has no effect here.
     */
    @Override
    public String consume(String queue, String consumer, boolean autoAck, boolean exclusive, boolean noLocal,
                          boolean noWait, Map<String, Object> args, Consumer<Delivery> handler) throws IOException {
        DeliverCallback deliver = (tag, d) -> handler.accept(Mappers.toDelivery(tag, d));
        CancelCallback cancel = tag -> LOG.warn("Consumer {} on queue {} was cancelled by the broker", tag, queue);
        return channel.basicConsume(queue, autoAck, consumer, noLocal, exclusive, args, deliver, cancel);
    }

    @Override
    public void publish(String exchange, String key, boolean mandatory, boolean immediate, Envelope msg) throws IOException {
        channel.basicPublish(exchange, key, mandatory, immediate, Mappers.toProperties(msg), msg.body());
    }

    @Override
    public void queueDeclare(String name, boolean durable, boolean autoDelete, boolean exclusive, boolean noWait,
                             Map<String, Object> args) throws IOException {
        if (noWait) {
            channel.queueDeclareNoWait(name, durable, exclusive, autoDelete, args);
        } else {
            channel.queueDeclare(name, durable, exclusive, autoDelete, args);
        }
    }

    @Override
    public void exchangeBind(String destination, String key, String source, boolean noWait,
                             Map<String, Object> args) throws IOException {
        if (noWait) {
            channel.exchangeBindNoWait(destination, source, key, args);
        } else {
            channel.exchangeBind(destination, source, key, args);
        }
    }

    @Override
    public void exchangeDeclare(String name, String kind, boolean durable, boolean autoDelete, boolean internal,
                                boolean noWait, Map<String, Object> args) throws IOException {
        if (noWait) {
            channel.exchangeDeclareNoWait(name, kind, durable, autoDelete, internal, args);
        } else {
            channel.exchangeDeclare(name, kind, durable, autoDelete, internal, args);
        }
    }

    @Override
    public void queueBind(String name, String key, String exchange, boolean noWait, Map<String, Object> args) throws IOException {
        if (noWait) {
            channel.queueBindNoWait(name, exchange, key, args);
        } else {
            channel.queueBind(name, exchange, key, args);
        }
    }

    @Override
    public void tx() throws IOException {
        channel.txSelect();
    }

    @Override
    public void txCommit() throws IOException {
        channel.txCommit();
    }

    @Override
    public void txRollback() throws IOException {
        channel.txRollback();
    }
}
