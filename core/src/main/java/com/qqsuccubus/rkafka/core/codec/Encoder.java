package com.qqsuccubus.rkafka.core.codec;

import com.qqsuccubus.rkafka.core.error.CodecException;

import java.io.ByteArrayOutputStream;

/**
 * Serializes a typed value into a caller-owned, reusable buffer.
 * <p>
 * The buffer is reset by the caller before each call; implementations only append.
 * </p>
 *
 * @param <M> value type
 */
@FunctionalInterface
public interface Encoder<M> {

    void encode(M value, ByteArrayOutputStream into) throws CodecException;
}
