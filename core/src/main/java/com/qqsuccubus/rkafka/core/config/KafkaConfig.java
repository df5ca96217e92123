package com.qqsuccubus.rkafka.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qqsuccubus.rkafka.core.util.JsonUtils;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.function.Function;

/**
 * Configuration shared by the resilient consumer and producer.
 * <p>
 * Can be built programmatically, loaded from environment variables ({@link #fromEnv()})
 * or from a JSON document with snake_case keys ({@link #fromJson(String)}).
 * Call {@link #validate()} before handing it to an adapter.
 * </p>
 * <p>
 * Nullable {@code Integer}/{@code Boolean} fields are tri-state: {@code null} leaves the
 * decision to the underlying client library.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class KafkaConfig {

    public static final int DEFAULT_MESSAGE_TIMEOUT_MS = 500;
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 30 * (1 << 20);
    public static final int DEFAULT_RECONNECT_COUNT = 100;
    public static final int DEFAULT_RECONNECT_SLEEP_MS = 500;

    /**
     * Broker addresses (host:port), in the order they are handed to the client.
     */
    @Singular
    @JsonProperty("brokers")
    List<String> brokers;

    @JsonProperty("group_id")
    String groupId;

    /**
     * Default topic for adapters constructed without an explicit one.
     */
    @JsonProperty("topic")
    String topic;

    /**
     * Emit end-of-partition as a distinct event.
     */
    @JsonProperty("partition_eof")
    Boolean partitionEof;

    @JsonProperty("session_timeout")
    Integer sessionTimeoutMs;

    @Builder.Default
    @JsonProperty("message_timeout_ms")
    Integer messageTimeoutMs = DEFAULT_MESSAGE_TIMEOUT_MS;

    /**
     * Single-message byte cap. Also drives the producer buffering budget (size / 1024 KB).
     */
    @Builder.Default
    @JsonProperty("max_message_size")
    Integer maxMessageSize = DEFAULT_MAX_MESSAGE_SIZE;

    @JsonProperty("auto_commit")
    Boolean autoCommit;

    @Builder.Default
    @JsonProperty("auto_offset_reset")
    AutoOffsetReset autoOffsetReset = AutoOffsetReset.EARLIEST;

    /**
     * Extra connection attempts allowed after the first one.
     */
    @Builder.Default
    @JsonProperty("reconnect_count")
    int reconnectCount = DEFAULT_RECONNECT_COUNT;

    @Builder.Default
    @JsonProperty("reconnect_sleep_ms")
    int reconnectSleepMs = DEFAULT_RECONNECT_SLEEP_MS;

    @Builder.Default
    @JsonProperty("log_level")
    KafkaLogLevel logLevel = KafkaLogLevel.ERROR;

    /**
     * Checks ranges and required fields.
     *
     * @return this configuration, for chaining
     * @throws IllegalArgumentException naming the first offending field
     */
    public KafkaConfig validate() {
        if (brokers == null || brokers.isEmpty()) {
            throw new IllegalArgumentException("brokers must not be empty");
        }
        for (String broker : brokers) {
            if (broker == null || broker.isBlank()) {
                throw new IllegalArgumentException("brokers must not contain blank entries: " + brokers);
            }
        }
        requirePositive("session_timeout", sessionTimeoutMs);
        requirePositive("message_timeout_ms", messageTimeoutMs);
        requirePositive("max_message_size", maxMessageSize);
        if (reconnectCount < 0) {
            throw new IllegalArgumentException("reconnect_count must be >= 0, got " + reconnectCount);
        }
        if (reconnectSleepMs < 0) {
            throw new IllegalArgumentException("reconnect_sleep_ms must be >= 0, got " + reconnectSleepMs);
        }
        if (autoOffsetReset == null) {
            throw new IllegalArgumentException("auto_offset_reset must be set");
        }
        if (logLevel == null) {
            throw new IllegalArgumentException("log_level must be set");
        }
        return this;
    }

    /**
     * @return true if a consumer can be built from this configuration
     */
    public boolean hasGroupId() {
        return groupId != null && !groupId.isBlank();
    }

    public static KafkaConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    /**
     * Loads the configuration from variables resolved through {@code env}.
     * Unset variables keep the builder defaults.
     *
     * @param env variable lookup, returns null for unset keys
     * @return validated configuration
     */
    public static KafkaConfig fromEnv(Function<String, String> env) {
        KafkaConfigBuilder builder = KafkaConfig.builder()
            .groupId(env.apply("KAFKA_GROUP_ID"))
            .topic(env.apply("KAFKA_TOPIC"))
            .partitionEof(optionalBoolean(env, "KAFKA_PARTITION_EOF"))
            .sessionTimeoutMs(optionalInt(env, "KAFKA_SESSION_TIMEOUT_MS"))
            .autoCommit(optionalBoolean(env, "KAFKA_AUTO_COMMIT"))
            .messageTimeoutMs(Integer.parseInt(
                getEnv(env, "KAFKA_MESSAGE_TIMEOUT_MS", String.valueOf(DEFAULT_MESSAGE_TIMEOUT_MS))))
            .maxMessageSize(Integer.parseInt(
                getEnv(env, "KAFKA_MAX_MESSAGE_SIZE", String.valueOf(DEFAULT_MAX_MESSAGE_SIZE))))
            .autoOffsetReset(AutoOffsetReset.of(getEnv(env, "KAFKA_AUTO_OFFSET_RESET", "earliest")))
            .reconnectCount(Integer.parseInt(
                getEnv(env, "KAFKA_RECONNECT_COUNT", String.valueOf(DEFAULT_RECONNECT_COUNT))))
            .reconnectSleepMs(Integer.parseInt(
                getEnv(env, "KAFKA_RECONNECT_SLEEP_MS", String.valueOf(DEFAULT_RECONNECT_SLEEP_MS))))
            .logLevel(KafkaLogLevel.of(getEnv(env, "KAFKA_LOG_LEVEL", "ERROR")));

        for (String broker : getEnv(env, "KAFKA_BROKERS", "localhost:9092").split(",")) {
            if (!broker.isBlank()) {
                builder.broker(broker.trim());
            }
        }
        return builder.build().validate();
    }

    /**
     * Parses a JSON document, e.g. {@code {"brokers":["b1:9092"],"group_id":"g","reconnect_count":12}}.
     *
     * @param json configuration document
     * @return validated configuration
     */
    public static KafkaConfig fromJson(String json) {
        return JsonUtils.readValue(json, KafkaConfig.class).validate();
    }

    private static void requirePositive(String name, Integer value) {
        if (value != null && value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    private static Integer optionalInt(Function<String, String> env, String key) {
        String value = getEnv(env, key, null);
        return value != null ? Integer.valueOf(value) : null;
    }

    private static Boolean optionalBoolean(Function<String, String> env, String key) {
        String value = getEnv(env, key, null);
        return value != null ? Boolean.valueOf(value) : null;
    }
}
