package com.acme.amqp.rabbit;

import com.acme.amqp.core.Delivery;
import com.acme.amqp.core.Envelope;
import com.acme.amqp.core.HeaderValue;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.LongString;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps between RabbitMQ client messages and the typed {@link Envelope}/{@link Delivery} model.
 */
public final class Mappers {

    private Mappers() {
    }

    public static Delivery toDelivery(String consumerTag, com.rabbitmq.client.Delivery d) {
        AMQP.BasicProperties p = d.getProperties();
        com.rabbitmq.client.Envelope e = d.getEnvelope();
        return new Delivery(
            toHeaders(p.getHeaders()),
            p.getContentType(),
            p.getContentEncoding(),
            p.getDeliveryMode(),
            p.getPriority(),
            p.getCorrelationId(),
            p.getReplyTo(),
            p.getExpiration(),
            p.getMessageId(),
            p.getTimestamp() == null ? null : p.getTimestamp().toInstant(),
            p.getType(),
            consumerTag,
            e.getDeliveryTag(),
            e.isRedeliver(),
            e.getExchange(),
            e.getRoutingKey(),
            d.getBody()
        );
    }

    public static AMQP.BasicProperties toProperties(Envelope env) {
        return new AMQP.BasicProperties.Builder()
            .headers(fromHeaders(env.headers()))
            .contentType(env.contentType())
            .contentEncoding(env.contentEncoding())
            .deliveryMode(env.deliveryMode())
            .priority(env.priority())
            .correlationId(env.correlationId())
            .replyTo(env.replyTo())
            .expiration(env.expiration())
            .messageId(env.messageId())
            .timestamp(env.timestamp() == null ? null : Date.from(env.timestamp()))
            .type(env.type())
            .build();
    }

    /**
     * Converts a client header table. Returns {@code null} for a missing table and drops
     * void (null) entries.
     */
    public static Map<String, HeaderValue> toHeaders(Map<String, Object> headers) {
        if (headers == null) {
            return null;
        }
        Map<String, HeaderValue> out = new HashMap<>();
        headers.forEach((k, v) -> {
            HeaderValue value = toHeaderValue(v);
            if (value != null) {
                out.put(k, value);
            }
        });
        return out;
    }

    public static Map<String, Object> fromHeaders(Map<String, HeaderValue> headers) {
        Map<String, Object> out = new HashMap<>();
        headers.forEach((k, v) -> out.put(k, fromHeaderValue(v)));
        return out;
    }

    @SuppressWarnings("unchecked")
    static HeaderValue toHeaderValue(Object v) {
        if (v == null) {
            return null;
        }
        if (v instanceof LongString) {
            return longString(((LongString) v).getBytes());
        }
        if (v instanceof String) {
            return HeaderValue.of((String) v);
        }
        if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return HeaderValue.of(((Number) v).longValue());
        }
        if (v instanceof BigDecimal) {
            return HeaderValue.of((BigDecimal) v);
        }
        if (v instanceof Double || v instanceof Float) {
            return HeaderValue.of(((Number) v).doubleValue());
        }
        if (v instanceof Boolean) {
            return HeaderValue.of((Boolean) v);
        }
        if (v instanceof Date) {
            return HeaderValue.of(((Date) v).toInstant());
        }
        if (v instanceof byte[]) {
            return HeaderValue.of((byte[]) v);
        }
        if (v instanceof Map) {
            return HeaderValue.table(toHeaders((Map<String, Object>) v));
        }
        if (v instanceof List) {
            List<HeaderValue> values = new ArrayList<>();
            for (Object item : (List<Object>) v) {
                HeaderValue value = toHeaderValue(item);
                if (value != null) {
                    values.add(value);
                }
            }
            return HeaderValue.array(values);
        }
        return HeaderValue.of(v.toString());
    }

    /**
     * Long strings are raw bytes on the wire. Only valid UTF-8 becomes a STRING; anything else is
     * kept as BYTES so republishing does not alter it.
     */
    static HeaderValue longString(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return HeaderValue.of(decoder.decode(ByteBuffer.wrap(bytes)).toString());
        } catch (CharacterCodingException e) {
            return HeaderValue.of(bytes);
        }
    }

    static Object fromHeaderValue(HeaderValue v) {
        return switch (v.kind()) {
            case STRING -> v.asString();
            case INTEGER -> v.asLong();
            case FLOAT -> v.asDouble();
            case DECIMAL -> v.asDecimal();
            case BYTES -> v.asBytes();
            case BOOLEAN -> v.asBoolean();
            case TIMESTAMP -> Date.from(v.asInstant());
            case TABLE -> fromHeaders(v.asTable());
            case ARRAY -> {
                List<Object> values = new ArrayList<>();
                v.asArray().forEach(item -> values.add(fromHeaderValue(item)));
                yield values;
            }
        };
    }
}
