package com.qqsuccubus.rkafka.core.codec;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qqsuccubus.rkafka.core.error.CodecException;
import com.qqsuccubus.rkafka.core.util.JsonUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * JSON codec backed by the shared Jackson mapper.
 *
 * @param <T> payload type
 */
public final class JsonCodec<T> implements Codec<T> {

    private final ObjectMapper mapper;
    private final JavaType type;

    private JsonCodec(ObjectMapper mapper, JavaType type) {
        this.mapper = mapper;
        this.type = type;
    }

    public static <T> JsonCodec<T> of(Class<T> type) {
        return new JsonCodec<>(JsonUtils.mapper(), JsonUtils.mapper().constructType(type));
    }

    public static <T> JsonCodec<T> of(ObjectMapper mapper, Class<T> type) {
        return new JsonCodec<>(mapper, mapper.constructType(type));
    }

    @Override
    public T decode(byte[] bytes) throws CodecException {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new CodecException("Cannot decode " + type.getTypeName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void encode(T value, ByteArrayOutputStream into) throws CodecException {
        try {
            mapper.writeValue(into, value);
        } catch (IOException e) {
            throw new CodecException("Cannot encode " + type.getTypeName() + ": " + e.getMessage(), e);
        }
    }
}
