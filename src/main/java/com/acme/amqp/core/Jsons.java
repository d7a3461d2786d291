package com.acme.amqp.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class Jsons {
    private static final ObjectMapper M = new ObjectMapper();

    private Jsons() {
    }

    public static byte[] toJsonBytes(Object o) {
        try {
            return M.writeValueAsBytes(o);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize message body of type "
                + (o == null ? "null" : o.getClass().getName()), e);
        }
    }
}
