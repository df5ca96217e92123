package com.qqsuccubus.rkafka.client.kafka;

import com.qqsuccubus.rkafka.client.spi.IConsumerHandle;
import com.qqsuccubus.rkafka.core.error.PartitionEofException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Consumer session backed by a kafka-clients {@link Consumer}.
 * <p>
 * {@code poll()} returns batches; they are buffered here and handed out one record per
 * {@link #receive()}. The blocking poll loop runs on {@link Schedulers#boundedElastic()};
 * cancelling a pending receive wakes the consumer up.
 * </p>
 * <p>
 * With partition EOF enabled, an empty poll on an assigned partition whose position has
 * reached its end offset fails the receive with {@link PartitionEofException}, once per
 * partition until new records arrive on it.
 * </p>
 */
public final class KafkaConsumerHandle implements IConsumerHandle {
    private static final Logger log = LoggerFactory.getLogger(KafkaConsumerHandle.class);

    static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final Consumer<byte[], byte[]> consumer;
    private final boolean partitionEof;
    private final Duration pollTimeout;

    private final Deque<ConsumerRecord<byte[], byte[]>> pending = new ArrayDeque<>();
    private final Set<TopicPartition> eofReported = new HashSet<>();

    public KafkaConsumerHandle(Consumer<byte[], byte[]> consumer, boolean partitionEof, Duration pollTimeout) {
        this.consumer = consumer;
        this.partitionEof = partitionEof;
        this.pollTimeout = pollTimeout;
    }

    @Override
    public void subscribe(Collection<String> topics) {
        try {
            consumer.subscribe(List.copyOf(topics));
        } catch (RuntimeException e) {
            throw KafkaErrors.translate("Subscribe to " + topics, e);
        }
        log.info("Subscribed to topics: {}", topics);
    }

    @Override
    public Mono<ConsumerRecord<byte[], byte[]>> receive() {
        return Mono.fromCallable(this::nextRecord)
            .subscribeOn(Schedulers.boundedElastic())
            .doOnCancel(consumer::wakeup)
            .onErrorMap(e -> KafkaErrors.translate("Receive", e));
    }

    private ConsumerRecord<byte[], byte[]> nextRecord() {
        while (true) {
            ConsumerRecord<byte[], byte[]> next = pending.poll();
            if (next != null) {
                return next;
            }

            ConsumerRecords<byte[], byte[]> records = consumer.poll(pollTimeout);
            for (ConsumerRecord<byte[], byte[]> record : records) {
                pending.add(record);
                eofReported.remove(new TopicPartition(record.topic(), record.partition()));
            }

            if (records.isEmpty() && partitionEof) {
                PartitionEofException eof = detectEndOfPartition();
                if (eof != null) {
                    throw eof;
                }
            }
        }
    }

    private PartitionEofException detectEndOfPartition() {
        Set<TopicPartition> assignment = consumer.assignment();
        if (assignment.isEmpty()) {
            return null;
        }
        Map<TopicPartition, Long> endOffsets = consumer.endOffsets(assignment);
        for (TopicPartition tp : assignment) {
            if (eofReported.contains(tp)) {
                continue;
            }
            Long end = endOffsets.get(tp);
            long position = consumer.position(tp);
            if (end != null && position >= end) {
                eofReported.add(tp);
                return new PartitionEofException(tp.topic(), tp.partition(), position);
            }
        }
        return null;
    }

    @Override
    public void close() {
        try {
            consumer.close(CLOSE_TIMEOUT);
            log.info("Kafka consumer closed");
        } catch (RuntimeException e) {
            log.warn("Error while closing Kafka consumer: {}", e.getMessage(), e);
        }
    }
}
