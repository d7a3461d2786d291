package com.acme.amqp.core;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A typed AMQP header value.
 * Accessors fail when the stored kind differs instead of coercing.
 * <p>
 * FLOAT holds a {@code double}; a 32-bit float header is widened and is written back as a double.
 * DECIMAL keeps the exact {@link BigDecimal}. Two BYTES values are equal when their contents are.
 */
public record HeaderValue(Kind kind, Object value) {

    public enum Kind {
        STRING,
        INTEGER,
        FLOAT,
        DECIMAL,
        BYTES,
        BOOLEAN,
        TIMESTAMP,
        TABLE,
        ARRAY
    }

    public HeaderValue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
    }

    public static HeaderValue of(String value) {
        return new HeaderValue(Kind.STRING, value);
    }

    public static HeaderValue of(long value) {
        return new HeaderValue(Kind.INTEGER, value);
    }

    public static HeaderValue of(double value) {
        return new HeaderValue(Kind.FLOAT, value);
    }

    public static HeaderValue of(BigDecimal value) {
        return new HeaderValue(Kind.DECIMAL, value);
    }

    public static HeaderValue of(byte[] value) {
        return new HeaderValue(Kind.BYTES, value);
    }

    public static HeaderValue of(boolean value) {
        return new HeaderValue(Kind.BOOLEAN, value);
    }

    public static HeaderValue of(Instant value) {
        return new HeaderValue(Kind.TIMESTAMP, value);
    }

    public static HeaderValue table(Map<String, HeaderValue> value) {
        return new HeaderValue(Kind.TABLE, Map.copyOf(value));
    }

    public static HeaderValue array(List<HeaderValue> value) {
        return new HeaderValue(Kind.ARRAY, List.copyOf(value));
    }

    public String asString() {
        return (String) expect(Kind.STRING);
    }

    public long asLong() {
        return (Long) expect(Kind.INTEGER);
    }

    public double asDouble() {
        return (Double) expect(Kind.FLOAT);
    }

    public BigDecimal asDecimal() {
        return (BigDecimal) expect(Kind.DECIMAL);
    }

    public byte[] asBytes() {
        return (byte[]) expect(Kind.BYTES);
    }

    public boolean asBoolean() {
        return (Boolean) expect(Kind.BOOLEAN);
    }

    public Instant asInstant() {
        return (Instant) expect(Kind.TIMESTAMP);
    }

    @SuppressWarnings("unchecked")
    public Map<String, HeaderValue> asTable() {
        return (Map<String, HeaderValue>) expect(Kind.TABLE);
    }

    @SuppressWarnings("unchecked")
    public List<HeaderValue> asArray() {
        return (List<HeaderValue>) expect(Kind.ARRAY);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HeaderValue other) || kind != other.kind) {
            return false;
        }
        if (kind == Kind.BYTES) {
            return Arrays.equals((byte[]) value, (byte[]) other.value);
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        int valueHash = kind == Kind.BYTES ? Arrays.hashCode((byte[]) value) : value.hashCode();
        return 31 * kind.hashCode() + valueHash;
    }

    private Object expect(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("header value is " + kind + ", not " + expected);
        }
        return value;
    }
}
