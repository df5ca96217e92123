package com.qqsuccubus.rkafka.client.kafka;

import com.qqsuccubus.rkafka.core.error.PartitionEofException;
import com.qqsuccubus.rkafka.core.error.TransportException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.AuthenticationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Exercises the kafka-clients binding against {@link MockConsumer}.
 */
class KafkaConsumerHandleTest {

    private static final String TOPIC = "events";
    private static final TopicPartition TP0 = new TopicPartition(TOPIC, 0);
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private MockConsumer<byte[], byte[]> mock;

    @BeforeEach
    void setUp() {
        mock = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    }

    @Test
    void testReceive_OneRecordPerCallInOrder() {
        KafkaConsumerHandle handle = subscribed(false);
        mock.addRecord(record(0, "first"));
        mock.addRecord(record(1, "second"));

        StepVerifier.create(handle.receive())
                .assertNext(r -> assertEquals("first", value(r)))
                .expectComplete()
                .verify(TIMEOUT);
        StepVerifier.create(handle.receive())
                .assertNext(r -> assertEquals("second", value(r)))
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    void testReceive_TransientPollError() {
        KafkaConsumerHandle handle = subscribed(false);
        mock.setPollException(new KafkaException("broker hiccup"));

        StepVerifier.create(handle.receive())
                .expectErrorSatisfies(e -> {
                    assertTrue(e instanceof TransportException);
                    assertFalse(((TransportException) e).isFatal());
                })
                .verify(TIMEOUT);
    }

    @Test
    void testReceive_FatalPollError() {
        KafkaConsumerHandle handle = subscribed(false);
        mock.setPollException(new AuthenticationException("bad credentials"));

        StepVerifier.create(handle.receive())
                .expectErrorSatisfies(e -> assertTrue(((TransportException) e).isFatal()))
                .verify(TIMEOUT);
    }

    @Test
    void testPartitionEof_ReportedOncePerPartition() {
        KafkaConsumerHandle handle = subscribed(true);
        mock.updateEndOffsets(Map.of(TP0, 1L));
        mock.addRecord(record(0, "only"));

        StepVerifier.create(handle.receive())
                .assertNext(r -> assertEquals("only", value(r)))
                .expectComplete()
                .verify(TIMEOUT);

        StepVerifier.create(handle.receive())
                .expectErrorSatisfies(e -> {
                    PartitionEofException eof = (PartitionEofException) e;
                    assertEquals(TOPIC, eof.getTopic());
                    assertEquals(0, eof.getPartition());
                    assertEquals(1L, eof.getOffset());
                    assertFalse(eof.isFatal());
                })
                .verify(TIMEOUT);

        mock.addRecord(record(1, "next"));
        StepVerifier.create(handle.receive())
                .assertNext(r -> assertEquals("next", value(r)))
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    void testSubscribe_AfterCloseFails() {
        KafkaConsumerHandle handle = new KafkaConsumerHandle(mock, false, Duration.ofMillis(10));

        handle.close();

        assertTrue(mock.closed());
        assertThrows(TransportException.class, () -> handle.subscribe(List.of(TOPIC)));
    }

    @Test
    void testSubscribe_TopicsForwarded() {
        KafkaConsumerHandle handle = new KafkaConsumerHandle(mock, false, Duration.ofMillis(10));

        handle.subscribe(List.of("a", "b"));

        assertEquals(2, mock.subscription().size());
        assertTrue(mock.subscription().contains("a"));
    }

    private KafkaConsumerHandle subscribed(boolean partitionEof) {
        KafkaConsumerHandle handle = new KafkaConsumerHandle(mock, partitionEof, Duration.ofMillis(10));
        handle.subscribe(List.of(TOPIC));
        mock.rebalance(List.of(TP0));
        mock.updateBeginningOffsets(Map.of(TP0, 0L));
        return handle;
    }

    private static ConsumerRecord<byte[], byte[]> record(long offset, String value) {
        return new ConsumerRecord<>(TOPIC, 0, offset, null, value.getBytes(StandardCharsets.UTF_8));
    }

    private static String value(ConsumerRecord<byte[], byte[]> record) {
        return new String(record.value(), StandardCharsets.UTF_8);
    }
}
