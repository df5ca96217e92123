package com.qqsuccubus.rkafka.client.spi;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import reactor.core.publisher.Mono;

import java.util.Collection;

/**
 * Live consumer session. Exclusively owned by one adapter; closed when the adapter reconnects.
 */
public interface IConsumerHandle extends AutoCloseable {

    void subscribe(Collection<String> topics);

    /**
     * Waits for the next record. Cancelling the returned Mono aborts the wait.
     *
     * @return Mono emitting exactly one record or failing with a transport error
     */
    Mono<ConsumerRecord<byte[], byte[]>> receive();

    @Override
    void close();
}
