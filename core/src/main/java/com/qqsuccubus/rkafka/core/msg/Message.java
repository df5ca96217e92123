package com.qqsuccubus.rkafka.core.msg;

import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Optional;

/**
 * Uniform envelope for a received or to-be-sent record.
 * <p>
 * A missing payload models a tombstone/empty record, not an error.
 * The key is copied on the way in and out, so instances are immutable.
 * </p>
 *
 * @param <M> payload type
 */
@Value
public class Message<M> implements KafkaMessage<M> {

    byte[] key;

    /**
     * Epoch millis, UTC.
     */
    Long timestampMs;

    M payload;

    int partition;

    @Builder(toBuilder = true)
    public Message(@Nullable byte[] key, @Nullable Long timestampMs, @Nullable M payload, int partition) {
        this.key = key == null ? null : key.clone();
        this.timestampMs = timestampMs;
        this.payload = payload;
        this.partition = partition;
    }

    public static <M> Message<M> of(@Nullable byte[] key, @Nullable M payload) {
        return new Message<>(key, null, payload, 0);
    }

    @Override
    @Nullable
    public byte[] getKey() {
        return key == null ? null : key.clone();
    }

    public Optional<M> payload() {
        return Optional.ofNullable(payload);
    }

    public boolean isTombstone() {
        return payload == null;
    }

    /**
     * @return record timestamp as an instant, if the record carried one
     */
    public Optional<Instant> timestamp() {
        return Optional.ofNullable(timestampMs).map(Instant::ofEpochMilli);
    }

    public <N> Message<N> withPayload(@Nullable N newPayload) {
        return new Message<>(key, timestampMs, newPayload, partition);
    }
}
