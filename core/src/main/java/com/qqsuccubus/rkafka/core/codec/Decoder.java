package com.qqsuccubus.rkafka.core.codec;

import com.qqsuccubus.rkafka.core.error.CodecException;

/**
 * Turns a received payload into a typed value.
 *
 * @param <M> decoded value type
 */
@FunctionalInterface
public interface Decoder<M> {

    /**
     * @param bytes raw payload, never null (absent payloads are not decoded)
     * @return decoded value
     * @throws CodecException if the bytes cannot be decoded
     */
    M decode(byte[] bytes) throws CodecException;
}
