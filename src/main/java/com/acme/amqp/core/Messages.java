package com.acme.amqp.core;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds publishable envelopes: fresh ones, forwarded ones carrying a new body,
 * and kickbacks that requeue a delivery with its retry count incremented.
 * All functions are pure; nothing here touches the broker.
 */
public final class Messages {

    private Messages() {
    }

    /**
     * Creates an envelope whose body is {@code body} serialized as JSON.
     * Only the retry count header is set, to 0.
     *
     * @throws SerializationException if the body cannot be serialized
     */
    public static Envelope createMessage(Object body) {
        byte[] rawBody = Jsons.toJsonBytes(body);
        Map<String, HeaderValue> headers = new HashMap<>();
        RetryCount.write(headers, 0);
        return new Envelope(headers, null, null, null, null, null, null, null, null, null, null, rawBody);
    }

    /**
     * Like {@link #getKickbackMessage(long, Delivery)} but with a new body. The retry count is
     * reset to 0 instead of incremented.
     *
     * @throws SerializationException if the body cannot be serialized
     */
    public static Envelope getNextMessage(Delivery msg, Object body) {
        byte[] rawBody = Jsons.toJsonBytes(body);
        Map<String, HeaderValue> headers = copyHeaders(msg);
        RetryCount.write(headers, 0);
        return new Envelope(
            headers,
            msg.contentType(),
            msg.contentEncoding(),
            msg.deliveryMode(),
            null,
            null,
            null,
            null,
            null,
            null,
            msg.type(),
            rawBody
        );
    }

    /**
     * Creates an envelope for requeuing {@code msg} after a non-fatal error. The body is
     * passed through untouched.
     * <p>
     * The check runs against the count before it is incremented, so a message can be kicked
     * back {@code maxRetries + 1} times.
     *
     * @throws RetryExhaustedException if the current retry count is greater than {@code maxRetries}
     */
    public static Envelope getKickbackMessage(long maxRetries, Delivery msg) {
        Map<String, HeaderValue> headers = copyHeaders(msg);
        long retries = RetryCount.read(headers);
        if (retries > maxRetries) {
            throw new RetryExhaustedException(retries, maxRetries);
        }
        RetryCount.write(headers, retries + 1);
        return new Envelope(
            headers,
            msg.contentType(),
            msg.contentEncoding(),
            msg.deliveryMode(),
            msg.priority(),
            msg.correlationId(),
            msg.replyTo(),
            msg.expiration(),
            msg.messageId(),
            msg.timestamp(),
            msg.type(),
            msg.body()
        );
    }

    private static Map<String, HeaderValue> copyHeaders(Delivery msg) {
        return msg.headers() == null ? new HashMap<>() : new HashMap<>(msg.headers());
    }
}
