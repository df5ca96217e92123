package com.qqsuccubus.rkafka.client.consumer;

import com.qqsuccubus.rkafka.client.ConnectionBuilder;
import com.qqsuccubus.rkafka.client.kafka.KafkaBrokerClient;
import com.qqsuccubus.rkafka.client.metrics.AdapterMetrics;
import com.qqsuccubus.rkafka.client.spi.IBrokerClient;
import com.qqsuccubus.rkafka.client.spi.IConsumerHandle;
import com.qqsuccubus.rkafka.core.codec.BytesCodec;
import com.qqsuccubus.rkafka.core.codec.Decoder;
import com.qqsuccubus.rkafka.core.config.KafkaConfig;
import com.qqsuccubus.rkafka.core.error.AdapterException;
import com.qqsuccubus.rkafka.core.error.CodecException;
import com.qqsuccubus.rkafka.core.msg.Message;
import com.qqsuccubus.rkafka.core.retry.ConnectionStateMachine;
import com.qqsuccubus.rkafka.core.retry.FailureKind;
import com.qqsuccubus.rkafka.core.retry.Result;
import com.qqsuccubus.rkafka.core.retry.RetryStep;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.record.TimestampType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Consumer adapter: turns "connect + subscribe, then receive forever" into a lazy stream of
 * {@link Result}s, reconnecting within the configured budget.
 * <p>
 * <b>Per step:</b>
 * <ul>
 *   <li>disconnected: build a consumer and subscribe; a failure consumes one attempt</li>
 *   <li>connected: receive one record and decode its payload
 *     <ul>
 *       <li>success: emit {@code Result.success(message)}</li>
 *       <li>fatal transport error: emit nothing, drop the connection, consume one attempt</li>
 *       <li>any other error (transient, codec): emit {@code Result.failure(error)}, keep the connection</li>
 *     </ul>
 *   </li>
 *   <li>budget exhausted: emit the last connect/fatal error and complete</li>
 * </ul>
 * </p>
 * <p>
 * A record that fails to decode never ends the stream nor costs budget: the next step
 * receives again on the same connection. A permanently malformed topic therefore yields
 * an endless run of codec failures, which callers must handle themselves.
 * </p>
 * <p>
 * One stream at a time per instance; items are emitted in the order the client returns them.
 * </p>
 *
 * @param <M> decoded payload type
 */
public class ResilientConsumer<M> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResilientConsumer.class);

    private static final String COMPONENT = "consumer";

    private final ConnectionBuilder connectionBuilder;
    private final Decoder<M> decoder;
    private final ConnectionStateMachine<IConsumerHandle> connection;
    private final AdapterMetrics metrics;
    private final Duration reconnectSleep;
    private final String defaultTopic;

    private List<String> subscription = List.of();

    public static ResilientConsumer<byte[]> create(KafkaConfig config) {
        return new ResilientConsumer<>(config, BytesCodec.INSTANCE);
    }

    public ResilientConsumer(KafkaConfig config, Decoder<M> decoder) {
        this(config, decoder, new KafkaBrokerClient(), Metrics.globalRegistry);
    }

    public ResilientConsumer(KafkaConfig config, Decoder<M> decoder, IBrokerClient client, MeterRegistry registry) {
        Objects.requireNonNull(config, "config").validate();
        if (!config.hasGroupId()) {
            throw new IllegalArgumentException("group_id is required for consuming");
        }
        this.connectionBuilder = new ConnectionBuilder(config, client);
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.connection = new ConnectionStateMachine<>(COMPONENT, config.getReconnectCount());
        this.metrics = new AdapterMetrics(registry, COMPONENT);
        this.reconnectSleep = Duration.ofMillis(config.getReconnectSleepMs());
        this.defaultTopic = config.getTopic();
    }

    public boolean isConnected() {
        return connection.isConnected();
    }

    /**
     * @return attempts left in the budget of the current (or last) stream
     */
    public long remainingAttempts() {
        return connection.remaining();
    }

    /**
     * Streams the configured default topic.
     *
     * @throws IllegalStateException if the configuration has no topic
     */
    public Flux<Result<Message<M>>> stream() {
        if (defaultTopic == null || defaultTopic.isBlank()) {
            throw new IllegalStateException("No topic configured; pass topics to stream(...)");
        }
        return stream(List.of(defaultTopic));
    }

    public Flux<Result<Message<M>>> stream(String... topics) {
        return stream(Arrays.asList(topics));
    }

    /**
     * Same as {@link #stream(Collection)}, with {@code context} made visible to every step.
     */
    public Flux<Result<Message<M>>> stream(Collection<String> topics, ContextView context) {
        return stream(topics).contextWrite(context);
    }

    /**
     * Subscribes to {@code topics} and streams their records.
     * Nothing happens until the returned Flux is subscribed.
     *
     * @param topics topics to subscribe to, non-empty
     * @return unbounded stream of results, completing only after the budget is exhausted
     */
    public Flux<Result<Message<M>>> stream(Collection<String> topics) {
        List<String> requested = List.copyOf(topics);
        if (requested.isEmpty()) {
            throw new IllegalArgumentException("At least one topic is required");
        }

        return Flux.defer(() -> {
                connection.resetBudget();
                if (connection.isConnected() && !subscription.equals(requested)) {
                    log.info("Subscription changed from {} to {}, reconnecting", subscription, requested);
                    connection.close();
                }
                return Mono.defer(() -> step(requested)).repeat();
            })
            .takeUntil(RetryStep::isTerminal)
            .filter(RetryStep::hasResult)
            .map(RetryStep::getResult);
    }

    /**
     * Builds a consumer and subscribes it, replacing any current connection.
     * Does not touch the reconnect budget.
     */
    public Mono<Void> connect(Collection<String> topics) {
        List<String> requested = List.copyOf(topics);
        return Mono.defer(() -> {
                metrics.recordConnectAttempt();
                return connectionBuilder.buildConsumer();
            })
            .map(handle -> subscribe(handle, requested))
            .doOnNext(handle -> {
                connection.onConnected(handle);
                subscription = requested;
            })
            .doOnError(e -> connection.close())
            .then();
    }

    /**
     * Receives and decodes one record on the current connection.
     *
     * @return Mono failing with {@link com.qqsuccubus.rkafka.core.error.NoConnectionException}
     *         when not connected
     */
    public Mono<Message<M>> receive() {
        return Mono.defer(() -> connection.handle().receive())
            .map(this::toMessage);
    }

    @Override
    public void close() {
        connection.close();
    }

    private Mono<RetryStep<Message<M>>> step(List<String> topics) {
        switch (connection.state()) {
            case EXHAUSTED:
                metrics.recordExhausted();
                return Mono.just(RetryStep.terminal(Result.failure(connection.lastError())));

            case DISCONNECTED:
                return reconnectDelay()
                    .then(connect(topics))
                    .thenReturn(RetryStep.<Message<M>>silent())
                    .onErrorResume(e -> {
                        metrics.recordConnectFailure();
                        connection.onConnectFailed(AdapterException.wrap(e));
                        return Mono.just(RetryStep.silent());
                    });

            default:
                return receive()
                    .map(message -> {
                        metrics.recordMessage();
                        return RetryStep.item(Result.success(message));
                    })
                    .onErrorResume(e -> {
                        AdapterException error = AdapterException.wrap(e);
                        FailureKind kind = connection.onOperationFailed(error);
                        metrics.recordFailure(kind);
                        return Mono.just(kind.requiresReconnect()
                            ? RetryStep.<Message<M>>silent()
                            : RetryStep.<Message<M>>item(Result.failure(error)));
                    });
        }
    }

    private Mono<Void> reconnectDelay() {
        if (!connection.isRecovering() || reconnectSleep.isZero()) {
            return Mono.empty();
        }
        return Mono.delay(reconnectSleep).then();
    }

    private IConsumerHandle subscribe(IConsumerHandle handle, List<String> topics) {
        try {
            handle.subscribe(topics);
            return handle;
        } catch (RuntimeException e) {
            handle.close();
            throw e;
        }
    }

    private Message<M> toMessage(ConsumerRecord<byte[], byte[]> record) {
        byte[] value = record.value();
        return Message.<M>builder()
            .key(record.key())
            .timestampMs(timestampOf(record))
            .payload(value != null ? decode(value) : null)
            .partition(record.partition())
            .build();
    }

    private M decode(byte[] value) {
        try {
            return decoder.decode(value);
        } catch (CodecException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CodecException("Decoder failed: " + e.getMessage(), e);
        }
    }

    private static Long timestampOf(ConsumerRecord<?, ?> record) {
        if (record.timestampType() == TimestampType.NO_TIMESTAMP_TYPE || record.timestamp() < 0) {
            return null;
        }
        return record.timestamp();
    }
}
