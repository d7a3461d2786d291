package com.acme.amqp.rabbit;

import com.acme.amqp.config.QueueConfig;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.EachBean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.env.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

@Requires(notEnv = Environment.TEST)
@Factory
public class RabbitFactoryProvider {
    private static final Logger LOG = LoggerFactory.getLogger(RabbitFactoryProvider.class);

    @EachBean(QueueConfig.class)
    @Bean(preDestroy = "close")
    public RabbitQueueService queueService(QueueConfig config) throws IOException {
        QueueConfig.Endpoint endpoint = config.getEndpoint();
        LOG.info("Opening AMQP connection to {}:{}{} for queue {}",
            endpoint.getHost(), endpoint.getPort(), endpoint.getVhost(), config.getQueueName());
        return new RabbitQueueService(config, RabbitConnections.open(endpoint, config.getQueueName()));
    }
}
