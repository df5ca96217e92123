package com.qqsuccubus.rkafka.client.kafka;

import com.qqsuccubus.rkafka.client.ClientOptions;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Turns {@link ClientOptions} into kafka-clients properties. Unset options are left out.
 */
public final class KafkaProperties {
    private KafkaProperties() {
    }

    public static Map<String, Object> consumer(ClientOptions options) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, options.getBootstrapServers());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        putIfSet(props, ConsumerConfig.GROUP_ID_CONFIG, options.getGroupId());
        putIfSet(props, ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, options.getSessionTimeoutMs());
        putIfSet(props, ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, options.getAutoCommit());
        putIfSet(props, ConsumerConfig.MAX_PARTITION_FETCH_BYTES_CONFIG, options.getMaxMessageBytes());
        if (options.getAutoOffsetReset() != null) {
            props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, options.getAutoOffsetReset().propertyValue());
        }
        return props;
    }

    public static Map<String, Object> producer(ClientOptions options) {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, options.getBootstrapServers());
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        // records leave the accumulator immediately
        props.put(ProducerConfig.LINGER_MS_CONFIG, 0);

        Integer messageTimeoutMs = options.getMessageTimeoutMs();
        if (messageTimeoutMs != null) {
            // delivery.timeout.ms must be >= linger.ms + request.timeout.ms
            props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, messageTimeoutMs);
            props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, messageTimeoutMs);
        }
        putIfSet(props, ProducerConfig.MAX_REQUEST_SIZE_CONFIG, options.getMaxMessageBytes());
        if (options.getBufferingMaxKbytes() != null) {
            props.put(ProducerConfig.BUFFER_MEMORY_CONFIG, options.getBufferingMaxKbytes() * 1024L);
        }
        return props;
    }

    private static void putIfSet(Map<String, Object> props, String key, Object value) {
        if (value != null) {
            props.put(key, value);
        }
    }
}
