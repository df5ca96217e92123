package com.qqsuccubus.rkafka.client.producer;

import com.qqsuccubus.rkafka.client.ConnectionBuilder;
import com.qqsuccubus.rkafka.client.kafka.KafkaBrokerClient;
import com.qqsuccubus.rkafka.client.metrics.AdapterMetrics;
import com.qqsuccubus.rkafka.client.spi.IBrokerClient;
import com.qqsuccubus.rkafka.client.spi.IProducerHandle;
import com.qqsuccubus.rkafka.core.codec.Encoder;
import com.qqsuccubus.rkafka.core.config.KafkaConfig;
import com.qqsuccubus.rkafka.core.error.AdapterException;
import com.qqsuccubus.rkafka.core.error.CodecException;
import com.qqsuccubus.rkafka.core.msg.KafkaMessage;
import com.qqsuccubus.rkafka.core.retry.ConnectionStateMachine;
import com.qqsuccubus.rkafka.core.retry.FailureKind;
import com.qqsuccubus.rkafka.core.retry.Result;
import com.qqsuccubus.rkafka.core.retry.RetryStep;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.Objects;

/**
 * Producer adapter: publishes one message per {@link #send(KafkaMessage)} call to a fixed topic,
 * reconnecting within the configured budget.
 * <p>
 * <b>Send sequence:</b>
 * <ol>
 *   <li>connect if needed, looping until connected or the budget is exhausted</li>
 *   <li>encode the payload into the shared buffer and submit the record</li>
 *   <li>fatal transport error: drop the connection, consume one attempt, go back to 1</li>
 *   <li>transient transport or codec error: fail immediately, connection kept</li>
 * </ol>
 * Each call starts with a fresh budget.
 * </p>
 * <p>
 * The encode buffer is reused across sends, so calls must not overlap on one instance.
 * </p>
 *
 * @param <V> payload type accepted by the encoder
 */
public class ResilientProducer<V> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResilientProducer.class);

    private static final String COMPONENT = "producer";

    private final ConnectionBuilder connectionBuilder;
    private final Encoder<V> encoder;
    private final String topic;
    private final ConnectionStateMachine<IProducerHandle> connection;
    private final AdapterMetrics metrics;
    private final Duration reconnectSleep;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    /**
     * Publishes to the topic named in the configuration.
     *
     * @throws IllegalArgumentException if the configuration has no topic
     */
    public ResilientProducer(KafkaConfig config, Encoder<V> encoder) {
        this(config, encoder, requireTopic(config));
    }

    public ResilientProducer(KafkaConfig config, Encoder<V> encoder, String topic) {
        this(config, encoder, topic, new KafkaBrokerClient(), Metrics.globalRegistry);
    }

    public ResilientProducer(KafkaConfig config, Encoder<V> encoder, String topic,
                             IBrokerClient client, MeterRegistry registry) {
        Objects.requireNonNull(config, "config").validate();
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
        this.connectionBuilder = new ConnectionBuilder(config, client);
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.topic = topic;
        this.connection = new ConnectionStateMachine<>(COMPONENT, config.getReconnectCount());
        this.metrics = new AdapterMetrics(registry, COMPONENT);
        this.reconnectSleep = Duration.ofMillis(config.getReconnectSleepMs());
    }

    public String topic() {
        return topic;
    }

    public boolean isConnected() {
        return connection.isConnected();
    }

    public long remainingAttempts() {
        return connection.remaining();
    }

    /**
     * Builds a producer, replacing any current connection. Does not touch the reconnect budget.
     */
    public Mono<Void> connect() {
        return Mono.defer(() -> {
                metrics.recordConnectAttempt();
                return connectionBuilder.buildProducer();
            })
            .doOnNext(connection::onConnected)
            .doOnError(e -> connection.close())
            .then();
    }

    /**
     * Publishes {@code message}, reconnecting after fatal errors while the budget allows.
     *
     * @return Mono completing once the broker acknowledged the record, or failing with the
     *         transient/codec error of the attempt, or with the last fatal/connect error once
     *         the budget is exhausted
     */
    public Mono<Void> send(KafkaMessage<? extends V> message) {
        Objects.requireNonNull(message, "message");
        return Flux.defer(() -> {
                connection.resetBudget();
                return Mono.defer(() -> step(message)).repeat();
            })
            .filter(RetryStep::isTerminal)
            .next()
            .flatMap(step -> {
                Result<Void> result = step.getResult();
                return result.isSuccess() ? Mono.<Void>empty() : Mono.<Void>error(result.getError());
            });
    }

    /**
     * Single publish attempt on the current connection. No reconnect, no budget accounting.
     *
     * @return Mono failing with {@link com.qqsuccubus.rkafka.core.error.NoConnectionException}
     *         when not connected
     */
    public Mono<Void> trySend(KafkaMessage<? extends V> message) {
        return Mono.defer(() -> {
            IProducerHandle handle = connection.handle();
            return handle.send(toRecord(message));
        });
    }

    @Override
    public void close() {
        connection.close();
    }

    private Mono<RetryStep<Void>> step(KafkaMessage<? extends V> message) {
        switch (connection.state()) {
            case EXHAUSTED:
                metrics.recordExhausted();
                return Mono.just(RetryStep.terminal(Result.failure(connection.lastError())));

            case DISCONNECTED:
                return reconnectDelay()
                    .then(connect())
                    .thenReturn(RetryStep.<Void>silent())
                    .onErrorResume(e -> {
                        metrics.recordConnectFailure();
                        connection.onConnectFailed(AdapterException.wrap(e));
                        return Mono.just(RetryStep.silent());
                    });

            default:
                return trySend(message)
                    .then(Mono.fromCallable(() -> {
                        metrics.recordMessage();
                        return RetryStep.<Void>terminal(Result.success(null));
                    }))
                    .onErrorResume(e -> {
                        AdapterException error = AdapterException.wrap(e);
                        FailureKind kind = connection.onOperationFailed(error);
                        metrics.recordFailure(kind);
                        if (kind.requiresReconnect()) {
                            return Mono.just(RetryStep.silent());
                        }
                        log.debug("Send to {} failed without retry ({}): {}", topic, kind, error.getMessage());
                        return Mono.just(RetryStep.terminal(Result.failure(error)));
                    });
        }
    }

    private Mono<Void> reconnectDelay() {
        if (!connection.isRecovering() || reconnectSleep.isZero()) {
            return Mono.empty();
        }
        return Mono.delay(reconnectSleep).then();
    }

    private ProducerRecord<byte[], byte[]> toRecord(KafkaMessage<? extends V> message) {
        byte[] value = null;
        V payload = message.getPayload();
        if (payload != null) {
            buffer.reset();
            encode(payload);
            value = buffer.toByteArray();
        }
        return new ProducerRecord<>(topic, null, message.getTimestampMs(), message.getKey(), value);
    }

    private void encode(V payload) {
        try {
            encoder.encode(payload, buffer);
        } catch (CodecException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CodecException("Encoder failed: " + e.getMessage(), e);
        }
    }

    private static String requireTopic(KafkaConfig config) {
        String topic = Objects.requireNonNull(config, "config").getTopic();
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic is required when not passed explicitly");
        }
        return topic;
    }
}
