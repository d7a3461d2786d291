package com.acme.amqp.topology;

import com.acme.amqp.config.QueueConfig;
import com.acme.amqp.spi.AmqpChannel;
import com.acme.amqp.spi.QueueService;
import io.micronaut.scheduling.TaskExecutors;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;

/**
 * Realizes queue topologies on the broker. Every operation runs as its own task and is
 * best-effort: failures are logged and never stop the other operations. Each call returns
 * once all of its operations have completed.
 */
@Singleton
public class TopologyBootstrapper {

    private static final Logger LOG = LoggerFactory.getLogger(TopologyBootstrapper.class);

    private final ExecutorService executor;

    public TopologyBootstrapper(@Named(TaskExecutors.IO) ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Creates every queue and exchange, then binds the queues. No binding starts before all
     * creations are done.
     */
    public void bootstrap(List<? extends QueueService> services) {
        createTopologies(services);
        bindTopologies(services);
    }

    /**
     * Attempts to create the queue and the exchange of every service, ignoring failures.
     */
    public void createTopologies(List<? extends QueueService> services) {
        CompletionService<Void> results = new ExecutorCompletionService<>(executor);
        for (QueueService service : services) {
            results.submit(task("create queue", service, service::createQueue));
            results.submit(task("create exchange", service, service::createExchange));
        }
        drain(results, services.size() * 2, "Failed to create a queue or exchange");
    }

    /**
     * Binds every queue to its exchange using the queue name as the routing key.
     * Queues on the default exchange are skipped.
     */
    public void bindTopologies(List<? extends QueueService> services) {
        CompletionService<Void> results = new ExecutorCompletionService<>(executor);
        for (QueueService service : services) {
            results.submit(task("bind queue", service, () -> bind(service)));
        }
        drain(results, services.size(), "Failed to bind a queue to its exchange");
    }

    private static void bind(QueueService service) throws IOException {
        try (AmqpChannel ch = service.channel()) {
            QueueConfig conf = service.config();
            if (conf.getExchange().isDefault()) {
                return;
            }
            ch.queueBind(conf.getQueueName(), conf.getQueueName(), conf.getExchange().getName(), false, Map.of());
        }
    }

    private static Callable<Void> task(String operation, QueueService service, BrokerCall call) {
        return () -> {
            try {
                call.run();
                return null;
            } catch (IOException | RuntimeException e) {
                throw new TopologyOperationException(operation, queueName(service), e);
            }
        };
    }

    private static String queueName(QueueService service) {
        QueueConfig conf = service.config();
        return conf == null ? "<unknown>" : conf.getQueueName();
    }

    private static void drain(CompletionService<Void> results, int count, String failure) {
        for (int i = 0; i < count; i++) {
            try {
                results.take().get();
            } catch (ExecutionException e) {
                LOG.debug(failure, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for topology operations", e);
            }
        }
    }

    @FunctionalInterface
    private interface BrokerCall {
        void run() throws IOException;
    }
}
