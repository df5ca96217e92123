package com.qqsuccubus.rkafka.core.codec;

/**
 * Convenience pairing of {@link Decoder} and {@link Encoder} for the same value type.
 *
 * @param <M> value type
 */
public interface Codec<M> extends Decoder<M>, Encoder<M> {
}
