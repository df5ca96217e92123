package com.qqsuccubus.rkafka.core.codec;

import com.qqsuccubus.rkafka.core.error.CodecException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CodecTest {

    @Test
    void testBytesCodec_Identity() {
        byte[] payload = {0, 1, 2, (byte) 0xFF};
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        BytesCodec.INSTANCE.encode(payload, buffer);

        assertArrayEquals(payload, buffer.toByteArray());
        assertArrayEquals(payload, BytesCodec.INSTANCE.decode(buffer.toByteArray()));
    }

    @Test
    void testBytesCodec_EmptyPayload() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        BytesCodec.INSTANCE.encode(new byte[0], buffer);

        assertEquals(0, buffer.size());
        assertEquals(0, BytesCodec.INSTANCE.decode(new byte[0]).length);
    }

    @Test
    void testStringCodec_Utf8() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        StringCodec.INSTANCE.encode("zdravo, światło", buffer);

        assertArrayEquals("zdravo, światło".getBytes(StandardCharsets.UTF_8), buffer.toByteArray());
        assertEquals("zdravo, światło", StringCodec.INSTANCE.decode(buffer.toByteArray()));
    }

    @Test
    void testStringCodec_MalformedInputRejected() {
        byte[] malformed = {(byte) 0xC3, (byte) 0x28};

        assertThrows(CodecException.class, () -> StringCodec.INSTANCE.decode(malformed));
    }

    @Test
    void testEncoder_ResetBufferIsReused() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        StringCodec.INSTANCE.encode("a much longer first payload", buffer);
        buffer.reset();
        StringCodec.INSTANCE.encode("short", buffer);

        assertEquals("short", new String(buffer.toByteArray(), StandardCharsets.UTF_8));
    }

    @Test
    void testJsonCodec_Record() {
        JsonCodec<Order> codec = JsonCodec.of(Order.class);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Order order = new Order();
        order.id = "o-1";
        order.amount = 42;

        codec.encode(order, buffer);
        Order decoded = codec.decode(buffer.toByteArray());

        assertEquals("o-1", decoded.id);
        assertEquals(42, decoded.amount);
    }

    @Test
    void testJsonCodec_MapPayload() {
        @SuppressWarnings("rawtypes")
        JsonCodec<Map> codec = JsonCodec.of(Map.class);

        Map<?, ?> decoded = codec.decode("{\"k\":\"v\"}".getBytes(StandardCharsets.UTF_8));

        assertEquals("v", decoded.get("k"));
    }

    @Test
    void testJsonCodec_InvalidPayloadRejected() {
        JsonCodec<Order> codec = JsonCodec.of(Order.class);

        CodecException e = assertThrows(CodecException.class,
                () -> codec.decode("{not json".getBytes(StandardCharsets.UTF_8)));
        assertEquals(true, e.getMessage().contains("Order"));
    }

    static class Order {
        public String id;
        public int amount;
    }
}
