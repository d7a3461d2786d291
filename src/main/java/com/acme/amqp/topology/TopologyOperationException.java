package com.acme.amqp.topology;

public class TopologyOperationException extends RuntimeException {
    public TopologyOperationException(String operation, String queueName, Throwable cause) {
        super("Failed to " + operation + " for queue " + queueName, cause);
    }
}
