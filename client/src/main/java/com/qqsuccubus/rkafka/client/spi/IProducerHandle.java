package com.qqsuccubus.rkafka.client.spi;

import org.apache.kafka.clients.producer.ProducerRecord;
import reactor.core.publisher.Mono;

/**
 * Live producer session. Exclusively owned by one adapter; closed when the adapter reconnects.
 */
public interface IProducerHandle extends AutoCloseable {

    /**
     * Submits the record without local queuing delay.
     *
     * @return Mono completing once the broker acknowledged the record
     */
    Mono<Void> send(ProducerRecord<byte[], byte[]> record);

    @Override
    void close();
}
