package com.acme.amqp.core;

import java.util.Map;

/**
 * Access to the reserved {@value #HEADER} header.
 */
public final class RetryCount {

    /** Header holding the retry count of a message, always a 64-bit integer. */
    public static final String HEADER = "retryCount";

    private RetryCount() {
    }

    /**
     * Returns the retry count stored in {@code headers}, or 0 when the header is missing.
     *
     * @throws IllegalStateException if the header is present but not an integer
     */
    public static long read(Map<String, HeaderValue> headers) {
        if (headers == null) {
            return 0;
        }
        HeaderValue value = headers.get(HEADER);
        return value == null ? 0 : value.asLong();
    }

    static void write(Map<String, HeaderValue> headers, long count) {
        headers.put(HEADER, HeaderValue.of(count));
    }
}
