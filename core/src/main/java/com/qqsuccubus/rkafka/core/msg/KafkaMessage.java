package com.qqsuccubus.rkafka.core.msg;

import javax.annotation.Nullable;

/**
 * Capability view of an outbound record: everything the producer needs to build it.
 *
 * @param <V> payload type handed to the encoder
 */
public interface KafkaMessage<V> {

    @Nullable
    byte[] getKey();

    /**
     * @return payload, or null for a tombstone
     */
    @Nullable
    V getPayload();

    /**
     * @return record timestamp in epoch millis (UTC), or null to let the client assign one
     */
    @Nullable
    Long getTimestampMs();
}
