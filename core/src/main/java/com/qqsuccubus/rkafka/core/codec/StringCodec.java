package com.qqsuccubus.rkafka.core.codec;

import com.qqsuccubus.rkafka.core.error.CodecException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Strict UTF-8 codec. Malformed input is reported as a {@link CodecException} instead of
 * being replaced with U+FFFD.
 */
public final class StringCodec implements Codec<String> {

    public static final StringCodec INSTANCE = new StringCodec();

    private StringCodec() {
    }

    @Override
    public String decode(byte[] bytes) throws CodecException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            throw new CodecException("Payload is not valid UTF-8 (" + bytes.length + " bytes)", e);
        }
    }

    @Override
    public void encode(String value, ByteArrayOutputStream into) {
        into.writeBytes(value.getBytes(StandardCharsets.UTF_8));
    }
}
