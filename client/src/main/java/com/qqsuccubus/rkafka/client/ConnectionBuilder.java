package com.qqsuccubus.rkafka.client;

import com.qqsuccubus.rkafka.client.spi.IBrokerClient;
import com.qqsuccubus.rkafka.client.spi.IConsumerHandle;
import com.qqsuccubus.rkafka.client.spi.IProducerHandle;
import com.qqsuccubus.rkafka.core.config.AutoOffsetReset;
import com.qqsuccubus.rkafka.core.config.KafkaConfig;
import com.qqsuccubus.rkafka.core.error.AdapterException;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Maps a validated {@link KafkaConfig} onto {@link ClientOptions} and builds consumer and
 * producer handles from them.
 * <p>
 * The mapping is deterministic and performs no retries. Construction errors (for example a
 * malformed broker address) are not checked up front: they surface from
 * {@link #buildConsumer()} / {@link #buildProducer()} as adapter failures, and the caller's
 * state machine counts them as failed connection attempts.
 * </p>
 */
public final class ConnectionBuilder {

    private final ClientOptions options;
    private final IBrokerClient client;

    public ConnectionBuilder(KafkaConfig config, IBrokerClient client) {
        this.options = build(config);
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * Maps the configuration onto client options.
     * <ul>
     *   <li>brokers joined with {@code ,} in their original order</li>
     *   <li>partition EOF, auto-commit, session timeout: omitted when unset</li>
     *   <li>max message size sets both the byte cap and the KB buffering budget</li>
     *   <li>{@link AutoOffsetReset#NONE} is omitted</li>
     * </ul>
     *
     * @param config configuration to map
     * @return derived options
     */
    public static ClientOptions build(KafkaConfig config) {
        Objects.requireNonNull(config, "config");
        Integer maxMessageSize = config.getMaxMessageSize();

        return ClientOptions.builder()
            .bootstrapServers(String.join(",", config.getBrokers()))
            .groupId(config.getGroupId())
            .partitionEof(config.getPartitionEof())
            .sessionTimeoutMs(config.getSessionTimeoutMs())
            .messageTimeoutMs(config.getMessageTimeoutMs())
            .maxMessageBytes(maxMessageSize)
            .bufferingMaxKbytes(maxMessageSize != null ? maxMessageSize / 1024 : null)
            .autoCommit(config.getAutoCommit())
            .autoOffsetReset(config.getAutoOffsetReset() == AutoOffsetReset.NONE ? null : config.getAutoOffsetReset())
            .logLevel(config.getLogLevel())
            .build();
    }

    public ClientOptions options() {
        return options;
    }

    public Mono<IConsumerHandle> buildConsumer() {
        return Mono.defer(() -> client.openConsumer(options))
            .onErrorMap(AdapterException::wrap);
    }

    public Mono<IProducerHandle> buildProducer() {
        return Mono.defer(() -> client.openProducer(options))
            .onErrorMap(AdapterException::wrap);
    }
}
