package com.iotfleet.infrastructure.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * JSON encoding of one record type over the application's shared {@link ObjectMapper}.
 */
public class JsonCodec<T> {

    private final ObjectMapper objectMapper;
    private final Class<T> type;

    public JsonCodec(ObjectMapper objectMapper, Class<T> type) {
        this.objectMapper = objectMapper;
        this.type = type;
    }

    public byte[] encode(T value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CodecException("Failed to encode " + type.getSimpleName(), e);
        }
    }

    /**
     * @throws CodecException when the payload is empty, malformed, or the JSON {@code null} literal
     */
    public T decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new CodecException("Empty " + type.getSimpleName() + " payload", null);
        }
        T value;
        try {
            value = objectMapper.readValue(payload, type);
        } catch (IOException e) {
            throw new CodecException("Failed to decode " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
        if (value == null) {
            throw new CodecException("Null " + type.getSimpleName() + " payload", null);
        }
        return value;
    }

    public Class<T> type() {
        return type;
    }
}
