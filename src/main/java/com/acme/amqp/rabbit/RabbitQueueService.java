package com.acme.amqp.rabbit;

import com.acme.amqp.config.QueueConfig;
import com.acme.amqp.spi.AmqpChannel;
import com.acme.amqp.spi.QueueService;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * {@link QueueService} over one RabbitMQ connection. Every declare runs on its own channel.
 */
public class RabbitQueueService implements QueueService, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RabbitQueueService.class);

    private final QueueConfig config;
    private final Connection connection;

    public RabbitQueueService(QueueConfig config, Connection connection) {
        this.config = config;
        this.connection = connection;
    }

    @Override
    public void createQueue() throws IOException {
        QueueConfig.Queue queue = config.getQueue();
        try (AmqpChannel ch = channel()) {
            ch.queueDeclare(config.getQueueName(), queue.isDurable(), queue.isAutoDelete(), queue.isExclusive(),
                queue.isNoWait(), args(queue.getArgs()));
        }
        LOG.debug("Declared queue {}", config.getQueueName());
    }

    @Override
    public void createExchange() throws IOException {
        QueueConfig.Exchange exchange = config.getExchange();
        if (exchange.isDefault()) {
            LOG.debug("Queue {} uses the default exchange, nothing to declare", config.getQueueName());
            return;
        }
        try (AmqpChannel ch = channel()) {
            ch.exchangeDeclare(exchange.getName(), exchange.getKind(), exchange.isDurable(), exchange.isAutoDelete(),
                exchange.isInternal(), exchange.isNoWait(), args(exchange.getArgs()));
        }
        LOG.debug("Declared exchange {}", exchange.getName());
    }

    @Override
    public AmqpChannel channel() throws IOException {
        Channel ch = connection.createChannel();
        if (ch == null) {
            throw new IOException("No channel available on connection " + connection.getClientProvidedName());
        }
        return new RabbitAmqpChannel(ch);
    }

    @Override
    public QueueConfig config() {
        return config;
    }

    @Override
    public void close() throws IOException {
        if (connection.isOpen()) {
            LOG.info("Closing AMQP connection for queue {}", config.getQueueName());
            connection.close();
        }
    }

    private static Map<String, Object> args(Map<String, String> args) {
        return args == null ? null : new HashMap<>(args);
    }
}
