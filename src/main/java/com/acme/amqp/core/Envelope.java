package com.acme.amqp.core;

import java.time.Instant;
import java.util.Map;

/**
 * A message ready to be handed to the broker's publish primitive.
 * Absent properties are {@code null}. The body is compared by reference in {@code equals}.
 */
public record Envelope(
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
    byte[] body
) {
    public Envelope {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public long retryCount() {
        return RetryCount.read(headers);
    }
}
