package com.qqsuccubus.rkafka.core.error;

import lombok.Getter;

/**
 * Signals that the consumer reached the end of a partition.
 * Only raised when partition EOF reporting is enabled; never fatal.
 */
@Getter
public class PartitionEofException extends TransportException {

    private final String topic;
    private final int partition;
    private final long offset;

    public PartitionEofException(String topic, int partition, long offset) {
        super("Reached end of partition " + topic + "-" + partition + " at offset " + offset, null, false);
        this.topic = topic;
        this.partition = partition;
        this.offset = offset;
    }
}
