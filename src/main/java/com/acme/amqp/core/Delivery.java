package com.acme.amqp.core;

import java.time.Instant;
import java.util.Map;

/**
 * A message received from the broker, including broker-assigned metadata.
 * {@code headers} is {@code null} when the message carried no header table.
 * The body is compared by reference in {@code equals}.
 */
public record Delivery(
    Map<String, HeaderValue> headers,
    String contentType,
    String contentEncoding,
    Integer deliveryMode,
    Integer priority,
    String correlationId,
    String replyTo,
    String expiration,
    String messageId,
    Instant timestamp,
    String type,
    String consumerTag,
    long deliveryTag,
    boolean redelivered,
    String exchange,
    String routingKey,
    byte[] body
) {}
