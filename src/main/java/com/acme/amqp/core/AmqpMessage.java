package com.acme.amqp.core;

/**
 * Message utilities bound to a fixed retry budget.
 */
public interface AmqpMessage {

    Envelope createMessage(Object body);

    /**
     * Creates a message from the delivery for requeuing on non-fatal error.
     *
     * @throws RetryExhaustedException if the retry budget is used up
     */
    Envelope getKickbackMessage(Delivery msg);

    Envelope getNextMessage(Delivery msg, Object body);
}
