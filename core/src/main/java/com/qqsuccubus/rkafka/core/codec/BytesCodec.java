package com.qqsuccubus.rkafka.core.codec;

import java.io.ByteArrayOutputStream;

/**
 * Identity codec: payload bytes in, payload bytes out. Default for adapters built without a codec.
 */
public final class BytesCodec implements Codec<byte[]> {

    public static final BytesCodec INSTANCE = new BytesCodec();

    private BytesCodec() {
    }

    @Override
    public byte[] decode(byte[] bytes) {
        return bytes;
    }

    @Override
    public void encode(byte[] value, ByteArrayOutputStream into) {
        into.writeBytes(value);
    }
}
