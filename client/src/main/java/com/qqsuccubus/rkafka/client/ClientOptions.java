package com.qqsuccubus.rkafka.client;

import com.qqsuccubus.rkafka.core.config.AutoOffsetReset;
import com.qqsuccubus.rkafka.core.config.KafkaLogLevel;
import lombok.Builder;
import lombok.Value;

/**
 * Client-library options derived from a {@link com.qqsuccubus.rkafka.core.config.KafkaConfig}.
 * <p>
 * A {@code null} field means "not set": the client library default governs.
 * Produced only by {@link ConnectionBuilder#build}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ClientOptions {

    /**
     * Comma-separated broker list.
     */
    String bootstrapServers;

    String groupId;

    Boolean partitionEof;

    Integer sessionTimeoutMs;

    Integer messageTimeoutMs;

    /**
     * Hard per-message byte cap.
     */
    Integer maxMessageBytes;

    /**
     * Producer buffering budget in KB, always {@code maxMessageBytes / 1024}.
     */
    Integer bufferingMaxKbytes;

    Boolean autoCommit;

    AutoOffsetReset autoOffsetReset;

    KafkaLogLevel logLevel;
}
