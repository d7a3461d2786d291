package com.acme.amqp.topology;

import com.acme.amqp.config.QueueConfig;
import com.acme.amqp.core.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Startup check that a set of configurations names disjoint queues.
 */
public final class QueueUniqueness {

    private static final Logger LOG = LoggerFactory.getLogger(QueueUniqueness.class);

    private QueueUniqueness() {
    }

    /**
     * Fails on the first repeated queue name, after logging every configuration's index and
     * queue name.
     *
     * @throws ConfigurationException if two configurations share a queue name
     */
    public static void assertUniqueQueues(List<QueueConfig> confs) {
        Set<String> queues = new HashSet<>();
        for (int i = 0; i < confs.size(); i++) {
            queues.add(confs.get(i).getQueueName());
            if (queues.size() - 1 != i) {
                for (int j = 0; j < confs.size(); j++) {
                    LOG.error("{} = {}", j, confs.get(j).getQueueName());
                }
                throw new ConfigurationException("queue names are not unique");
            }
        }
    }
}
