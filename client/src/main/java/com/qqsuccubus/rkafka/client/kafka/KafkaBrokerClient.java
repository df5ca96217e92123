package com.qqsuccubus.rkafka.client.kafka;

import com.qqsuccubus.rkafka.client.ClientOptions;
import com.qqsuccubus.rkafka.client.spi.IBrokerClient;
import com.qqsuccubus.rkafka.client.spi.IConsumerHandle;
import com.qqsuccubus.rkafka.client.spi.IProducerHandle;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.kafka.sender.SenderOptions;

import java.time.Duration;

/**
 * {@link IBrokerClient} for Apache Kafka.
 * <p>
 * Consumers use kafka-clients directly (the adapter needs one record per receive step);
 * producers go through reactor-kafka.
 * </p>
 */
public class KafkaBrokerClient implements IBrokerClient {
    private static final Logger log = LoggerFactory.getLogger(KafkaBrokerClient.class);

    private final Duration pollTimeout;

    public KafkaBrokerClient() {
        this(KafkaConsumerHandle.DEFAULT_POLL_TIMEOUT);
    }

    public KafkaBrokerClient(Duration pollTimeout) {
        this.pollTimeout = pollTimeout;
    }

    @Override
    public Mono<IConsumerHandle> openConsumer(ClientOptions options) {
        return Mono.<IConsumerHandle>fromCallable(() -> {
                KafkaLogLevels.apply(options.getLogLevel());
                KafkaConsumer<byte[], byte[]> consumer = new KafkaConsumer<>(KafkaProperties.consumer(options));
                log.info("Kafka consumer created: bootstrap={}, groupId={}",
                    options.getBootstrapServers(), options.getGroupId());
                return new KafkaConsumerHandle(consumer, Boolean.TRUE.equals(options.getPartitionEof()), pollTimeout);
            })
            .onErrorMap(e -> KafkaErrors.translate("Consumer creation", e));
    }

    @Override
    public Mono<IProducerHandle> openProducer(ClientOptions options) {
        return Mono.defer(() -> {
                KafkaLogLevels.apply(options.getLogLevel());
                SenderOptions<byte[], byte[]> senderOptions = SenderOptions.create(KafkaProperties.producer(options));
                return KafkaProducerHandle.open(senderOptions);
            })
            .doOnNext(handle -> log.info("Kafka producer created: bootstrap={}", options.getBootstrapServers()))
            .onErrorMap(e -> KafkaErrors.translate("Producer creation", e));
    }
}
