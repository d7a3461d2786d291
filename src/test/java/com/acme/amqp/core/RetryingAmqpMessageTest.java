package com.acme.amqp.core;

import com.acme.amqp.config.RetryConfig;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static com.acme.amqp.test.Deliveries.delivery;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RetryingAmqpMessageTest {

    @Test
    void testMaxRetriesFromConfig() {
        RetryConfig config = mock(RetryConfig.class);
        when(config.getMaxRetries()).thenReturn(7L);

        RetryingAmqpMessage messages = new RetryingAmqpMessage(config);

        assertEquals(7, messages.getMaxRetries());
    }

    @Test
    void testDefaultRetryConfig() {
        assertEquals(3, new RetryingAmqpMessage(new RetryConfig()).getMaxRetries());
    }

    @Test
    void testKickbackUsesBoundMaxRetries() {
        AmqpMessage messages = new RetryingAmqpMessage(1);

        Envelope ok = messages.getKickbackMessage(delivery(Map.of(RetryCount.HEADER, HeaderValue.of(1L)), new byte[0]));
        assertEquals(2, ok.retryCount());

        var exhausted = delivery(Map.of(RetryCount.HEADER, HeaderValue.of(2L)), new byte[0]);
        assertThrows(RetryExhaustedException.class, () -> messages.getKickbackMessage(exhausted));
    }

    @Test
    void testCreateAndNextMessage() {
        AmqpMessage messages = new RetryingAmqpMessage(1);

        Envelope created = messages.createMessage("hello");
        assertEquals("\"hello\"", new String(created.body(), StandardCharsets.UTF_8));
        assertEquals(0, created.retryCount());

        Envelope next = messages.getNextMessage(delivery(Map.of(RetryCount.HEADER, HeaderValue.of(9L)), new byte[0]), 12);
        assertEquals("12", new String(next.body(), StandardCharsets.UTF_8));
        assertEquals(0, next.retryCount());
    }
}
