package com.acme.amqp.topology;

import com.acme.amqp.config.QueueConfig;
import com.acme.amqp.core.ConfigurationException;
import com.acme.amqp.spi.QueueService;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.env.Environment;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

/**
 * Sets up the broker topology of every configured queue service at startup.
 * Duplicate queue names are a deployment error: the application exits.
 */
@Singleton
@Requires(notEnv = Environment.TEST)
@Requires(property = "amqp.auto-setup", value = "true", defaultValue = "true")
public class TopologyInitializer implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(TopologyInitializer.class);

    private final List<QueueService> services;
    private final TopologyBootstrapper bootstrapper;
    private final IntConsumer exit;

    @Inject
    public TopologyInitializer(List<QueueService> services, TopologyBootstrapper bootstrapper) {
        this(services, bootstrapper, System::exit);
    }

    TopologyInitializer(List<QueueService> services, TopologyBootstrapper bootstrapper, IntConsumer exit) {
        this.services = services;
        this.bootstrapper = bootstrapper;
        this.exit = exit;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        setup();
    }

    void setup() {
        if (services.isEmpty()) {
            LOG.info("No AMQP services configured for topology setup");
            return;
        }

        List<QueueConfig> configs = services.stream()
            .map(QueueService::config)
            .collect(Collectors.toList());
        try {
            QueueUniqueness.assertUniqueQueues(configs);
        } catch (ConfigurationException e) {
            LOG.error("Invalid AMQP queue configuration", e);
            exitApplication(e.getMessage());
            return;
        }

        LOG.info("Setting up AMQP topology for queues {}",
            configs.stream().map(QueueConfig::getQueueName).collect(Collectors.toList()));
        bootstrapper.bootstrap(services);
        LOG.info("AMQP topology setup completed");
    }

    private void exitApplication(String reason) {
        LOG.error("CRITICAL ERROR: {}", reason);
        LOG.error("Application cannot start. Exiting...");
        exit.accept(1);
    }
}
