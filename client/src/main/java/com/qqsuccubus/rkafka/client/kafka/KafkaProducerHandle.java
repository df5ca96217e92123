package com.qqsuccubus.rkafka.client.kafka;

import com.qqsuccubus.rkafka.client.spi.IProducerHandle;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

/**
 * Producer session backed by a reactor-kafka {@link KafkaSender}.
 */
public final class KafkaProducerHandle implements IProducerHandle {
    private static final Logger log = LoggerFactory.getLogger(KafkaProducerHandle.class);

    private final KafkaSender<byte[], byte[]> sender;

    KafkaProducerHandle(KafkaSender<byte[], byte[]> sender) {
        this.sender = sender;
    }

    /**
     * Creates the sender and forces construction of its underlying producer, so that
     * configuration errors fail the connect instead of the first send.
     *
     * @param options sender options
     * @return Mono emitting the ready handle
     */
    public static Mono<IProducerHandle> open(SenderOptions<byte[], byte[]> options) {
        return Mono.defer(() -> {
            KafkaSender<byte[], byte[]> sender = KafkaSender.create(options);
            return sender.doOnProducer(Producer::metrics)
                .<IProducerHandle>thenReturn(new KafkaProducerHandle(sender))
                .doOnError(e -> sender.close());
        });
    }

    @Override
    public Mono<Void> send(ProducerRecord<byte[], byte[]> record) {
        return sender.send(Mono.just(SenderRecord.create(record, null)))
            .next()
            .flatMap(result -> result.exception() != null
                ? Mono.<Void>error(result.exception())
                : Mono.<Void>empty())
            .onErrorMap(e -> KafkaErrors.translate("Send to " + record.topic(), e));
    }

    @Override
    public void close() {
        sender.close();
        log.info("Kafka sender closed");
    }
}
