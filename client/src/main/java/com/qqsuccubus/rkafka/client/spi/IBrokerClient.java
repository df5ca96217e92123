package com.qqsuccubus.rkafka.client.spi;

import com.qqsuccubus.rkafka.client.ClientOptions;
import reactor.core.publisher.Mono;

/**
 * Underlying broker client the adapters delegate to (Dependency Inversion Principle).
 * <p>
 * Implementations own the wire protocol, partition assignment and offset storage.
 * Failures are reported as {@link com.qqsuccubus.rkafka.core.error.TransportException}s;
 * {@code isFatal()} marks errors after which the session cannot continue.
 * </p>
 */
public interface IBrokerClient {

    /**
     * Builds a new, unsubscribed consumer.
     *
     * @param options client options
     * @return Mono emitting the handle, or failing if the client cannot be constructed
     */
    Mono<IConsumerHandle> openConsumer(ClientOptions options);

    /**
     * Builds a new producer.
     *
     * @param options client options
     * @return Mono emitting the handle, or failing if the client cannot be constructed
     */
    Mono<IProducerHandle> openProducer(ClientOptions options);
}
