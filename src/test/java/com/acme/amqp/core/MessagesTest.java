package com.acme.amqp.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static com.acme.amqp.test.Deliveries.delivery;
import static com.acme.amqp.test.Deliveries.redeliver;
import static org.junit.jupiter.api.Assertions.*;

class MessagesTest {

    private static final byte[] BODY = "{\"orderId\":42}".getBytes(StandardCharsets.UTF_8);

    @Test
    void testCreateMessageSetsOnlyRetryCount() {
        Envelope env = Messages.createMessage(Map.of("orderId", 42));

        assertEquals(Map.of(RetryCount.HEADER, HeaderValue.of(0L)), env.headers());
        assertEquals(0, env.retryCount());
        assertEquals("{\"orderId\":42}", new String(env.body(), StandardCharsets.UTF_8));
        assertNull(env.contentType());
        assertNull(env.contentEncoding());
        assertNull(env.deliveryMode());
        assertNull(env.priority());
        assertNull(env.correlationId());
        assertNull(env.messageId());
        assertNull(env.timestamp());
        assertNull(env.type());
    }

    @Test
    void testCreateMessageSerializationFailure() {
        assertThrows(SerializationException.class, () -> Messages.createMessage(new Object()));
    }

    @Test
    void testGetNextMessageResetsRetryCount() {
        Map<String, HeaderValue> headers = Map.of(
            RetryCount.HEADER, HeaderValue.of(4L),
            "tenant", HeaderValue.of("acme")
        );

        Envelope env = Messages.getNextMessage(delivery(headers, BODY), Map.of("shipped", true));

        assertEquals(0, env.retryCount());
        assertEquals(HeaderValue.of("acme"), env.headers().get("tenant"));
        assertEquals("{\"shipped\":true}", new String(env.body(), StandardCharsets.UTF_8));
    }

    @Test
    void testGetNextMessageCopiesOnlyContentProperties() {
        Envelope env = Messages.getNextMessage(delivery(null, BODY), "next");

        assertEquals("application/json", env.contentType());
        assertEquals("utf-8", env.contentEncoding());
        assertEquals(2, env.deliveryMode());
        assertEquals("OrderPlaced", env.type());
        assertNull(env.priority());
        assertNull(env.correlationId());
        assertNull(env.replyTo());
        assertNull(env.expiration());
        assertNull(env.messageId());
        assertNull(env.timestamp());
    }

    @Test
    void testGetNextMessageWithoutHeaders() {
        Envelope env = Messages.getNextMessage(delivery(null, BODY), "next");

        assertEquals(Map.of(RetryCount.HEADER, HeaderValue.of(0L)), env.headers());
    }

    @Test
    void testGetNextMessageSerializationFailure() {
        var source = delivery(null, BODY);
        assertThrows(SerializationException.class, () -> Messages.getNextMessage(source, new Object()));
    }

    @Test
    void testKickbackCopiesEverythingAndKeepsBody() {
        var source = delivery(Map.of("tenant", HeaderValue.of("acme")), BODY);

        Envelope env = Messages.getKickbackMessage(3, source);

        assertSame(BODY, env.body());
        assertEquals("{\"orderId\":42}", new String(env.body(), StandardCharsets.UTF_8));
        assertEquals(1, env.retryCount());
        assertEquals(HeaderValue.of("acme"), env.headers().get("tenant"));
        assertEquals(source.contentType(), env.contentType());
        assertEquals(source.contentEncoding(), env.contentEncoding());
        assertEquals(source.deliveryMode(), env.deliveryMode());
        assertEquals(source.priority(), env.priority());
        assertEquals(source.correlationId(), env.correlationId());
        assertEquals(source.replyTo(), env.replyTo());
        assertEquals(source.expiration(), env.expiration());
        assertEquals(source.messageId(), env.messageId());
        assertEquals(source.timestamp(), env.timestamp());
        assertEquals(source.type(), env.type());
    }

    @Test
    void testKickbackWithoutHeadersStartsAtOne() {
        Envelope env = Messages.getKickbackMessage(0, delivery(null, BODY));

        assertEquals(1, env.retryCount());
    }

    @Test
    void testKickbackDoesNotMutateSourceHeaders() {
        Map<String, HeaderValue> headers = new HashMap<>();
        headers.put(RetryCount.HEADER, HeaderValue.of(1L));
        var source = delivery(headers, BODY);

        Messages.getKickbackMessage(5, source);

        assertEquals(HeaderValue.of(1L), source.headers().get(RetryCount.HEADER));
    }

    @Test
    void testKickbackChainWithMaxRetriesTwo() {
        Envelope first = Messages.getKickbackMessage(2, delivery(null, BODY));
        assertEquals(1, first.retryCount());

        Envelope second = Messages.getKickbackMessage(2, redeliver(first));
        assertEquals(2, second.retryCount());

        // 2 is not greater than 2, so this one still goes through
        Envelope third = Messages.getKickbackMessage(2, redeliver(second));
        assertEquals(3, third.retryCount());

        RetryExhaustedException ex = assertThrows(RetryExhaustedException.class,
            () -> Messages.getKickbackMessage(2, redeliver(third)));
        assertEquals(3, ex.getRetryCount());
        assertEquals(2, ex.getMaxRetries());
    }

    @Test
    void testKickbackAllowsMaxRetriesPlusOneAttempts() {
        long maxRetries = 5;
        Envelope env = Messages.getKickbackMessage(maxRetries, delivery(null, BODY));
        int kickbacks = 1;
        while (true) {
            try {
                env = Messages.getKickbackMessage(maxRetries, redeliver(env));
                kickbacks++;
            } catch (RetryExhaustedException e) {
                break;
            }
        }

        assertEquals(maxRetries + 1, kickbacks);
        assertEquals(maxRetries + 1, env.retryCount());
        assertSame(BODY, env.body());
    }

    @Test
    void testForwardAfterKickbacksResetsCount() {
        Envelope kicked = Messages.getKickbackMessage(3, redeliver(Messages.getKickbackMessage(3, delivery(null, BODY))));
        assertEquals(2, kicked.retryCount());

        Envelope next = Messages.getNextMessage(redeliver(kicked), "replacement");

        assertEquals(0, next.retryCount());
    }

    @Test
    void testKickbackRejectsNonIntegerRetryCount() {
        var source = delivery(Map.of(RetryCount.HEADER, HeaderValue.of("2")), BODY);

        assertThrows(IllegalStateException.class, () -> Messages.getKickbackMessage(3, source));
    }
}
