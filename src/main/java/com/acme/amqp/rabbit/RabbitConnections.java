package com.acme.amqp.rabbit;

import com.acme.amqp.config.QueueConfig;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.concurrent.TimeoutException;

public final class RabbitConnections {

    private RabbitConnections() {
    }

    /**
     * Dials a new connection to the given endpoint.
     */
    public static Connection open(QueueConfig.Endpoint endpoint, String connectionName) throws IOException {
        ConnectionFactory factory = connectionFactory(endpoint);
        try {
            return factory.newConnection(connectionName);
        } catch (TimeoutException e) {
            throw new IOException("Timed out connecting to " + endpoint.getHost() + ":" + endpoint.getPort(), e);
        }
    }

    static ConnectionFactory connectionFactory(QueueConfig.Endpoint endpoint) throws IOException {
        ConnectionFactory cf = new ConnectionFactory();
        cf.setHost(endpoint.getHost());
        cf.setPort(endpoint.getPort());
        cf.setUsername(endpoint.getUser());
        cf.setPassword(endpoint.getPassword());
        cf.setVirtualHost(endpoint.getVhost());
        if (endpoint.isTls()) {
            try {
                cf.useSslProtocol();
            } catch (GeneralSecurityException e) {
                throw new IOException("Failed to enable TLS for " + endpoint.getHost(), e);
            }
        }
        return cf;
    }
}
