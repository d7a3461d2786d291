package com.acme.amqp.core;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class ExceptionTest {

    @Test
    void testRetryExhaustedException() {
        RetryExhaustedException ex = new RetryExhaustedException(4, 3);
        assertEquals("too many retries: 4 > 3", ex.getMessage());
        assertEquals(4, ex.getRetryCount());
        assertEquals(3, ex.getMaxRetries());
        assertTrue(ex instanceof RuntimeException);
    }

    @Test
    void testSerializationException() {
        var cause = new IllegalArgumentException("boom");
        SerializationException ex = new SerializationException("Cannot serialize", cause);
        assertEquals("Cannot serialize", ex.getMessage());
        assertSame(cause, ex.getCause());
        assertTrue(ex instanceof RuntimeException);
    }

    @Test
    void testConfigurationException() {
        ConfigurationException ex = new ConfigurationException("queue names are not unique");
        assertEquals("queue names are not unique", ex.getMessage());
        assertTrue(ex instanceof RuntimeException);
    }
}
