package com.qqsuccubus.rkafka.core.config;

import com.qqsuccubus.rkafka.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KafkaConfigTest {

    @Test
    void testBuilderDefaults() {
        KafkaConfig config = KafkaConfig.builder()
                .broker("localhost:9092")
                .build();

        assertEquals(List.of("localhost:9092"), config.getBrokers());
        assertEquals(500, config.getMessageTimeoutMs());
        assertEquals(31_457_280, config.getMaxMessageSize());
        assertEquals(AutoOffsetReset.EARLIEST, config.getAutoOffsetReset());
        assertEquals(100, config.getReconnectCount());
        assertEquals(500, config.getReconnectSleepMs());
        assertEquals(KafkaLogLevel.ERROR, config.getLogLevel());
        assertNull(config.getGroupId());
        assertNull(config.getPartitionEof());
        assertNull(config.getSessionTimeoutMs());
        assertNull(config.getAutoCommit());
        assertFalse(config.hasGroupId());
    }

    @Test
    void testValidate_ReturnsSameInstance() {
        KafkaConfig config = KafkaConfig.builder().broker("b1:9092").groupId("g").build();

        assertSame(config, config.validate());
        assertTrue(config.hasGroupId());
    }

    @Test
    void testValidate_EmptyBrokersRejected() {
        KafkaConfig config = KafkaConfig.builder().build();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, config::validate);
        assertTrue(e.getMessage().contains("brokers"));
    }

    @Test
    void testValidate_BlankBrokerRejected() {
        KafkaConfig config = KafkaConfig.builder().broker("b1:9092").broker(" ").build();

        assertThrows(IllegalArgumentException.class, config::validate);
    }

    @Test
    void testValidate_NonPositiveTimeoutsRejected() {
        KafkaConfig base = KafkaConfig.builder().broker("b1:9092").build();

        assertThrows(IllegalArgumentException.class,
                () -> base.toBuilder().sessionTimeoutMs(0).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> base.toBuilder().messageTimeoutMs(-1).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> base.toBuilder().maxMessageSize(0).build().validate());
    }

    @Test
    void testValidate_NegativeReconnectSettingsRejected() {
        KafkaConfig base = KafkaConfig.builder().broker("b1:9092").build();

        assertThrows(IllegalArgumentException.class,
                () -> base.toBuilder().reconnectCount(-1).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> base.toBuilder().reconnectSleepMs(-5).build().validate());
    }

    @Test
    void testValidate_ZeroReconnectCountAccepted() {
        KafkaConfig config = KafkaConfig.builder().broker("b1:9092").reconnectCount(0).build();

        assertEquals(0, config.validate().getReconnectCount());
    }

    @Test
    void testFromJson_SnakeCaseKeys() {
        String json = "{"
                + "\"brokers\":[\"b1:9092\",\"b2:9092\"],"
                + "\"group_id\":\"orders\","
                + "\"topic\":\"orders.v1\","
                + "\"partition_eof\":true,"
                + "\"session_timeout\":6000,"
                + "\"message_timeout_ms\":1500,"
                + "\"max_message_size\":3145728,"
                + "\"auto_commit\":false,"
                + "\"auto_offset_reset\":\"Latest\","
                + "\"reconnect_count\":12,"
                + "\"reconnect_sleep_ms\":0,"
                + "\"log_level\":\"debug\""
                + "}";

        KafkaConfig config = KafkaConfig.fromJson(json);

        assertEquals(List.of("b1:9092", "b2:9092"), config.getBrokers());
        assertEquals("orders", config.getGroupId());
        assertEquals("orders.v1", config.getTopic());
        assertEquals(Boolean.TRUE, config.getPartitionEof());
        assertEquals(6000, config.getSessionTimeoutMs());
        assertEquals(1500, config.getMessageTimeoutMs());
        assertEquals(3_145_728, config.getMaxMessageSize());
        assertEquals(Boolean.FALSE, config.getAutoCommit());
        assertEquals(AutoOffsetReset.LATEST, config.getAutoOffsetReset());
        assertEquals(12, config.getReconnectCount());
        assertEquals(0, config.getReconnectSleepMs());
        assertEquals(KafkaLogLevel.DEBUG, config.getLogLevel());
    }

    @Test
    void testFromJson_MissingKeysKeepDefaults() {
        KafkaConfig config = KafkaConfig.fromJson("{\"brokers\":[\"b1:9092\"],\"unknown\":1}");

        assertEquals(100, config.getReconnectCount());
        assertEquals(AutoOffsetReset.EARLIEST, config.getAutoOffsetReset());
        assertEquals(KafkaLogLevel.ERROR, config.getLogLevel());
    }

    @Test
    void testFromJson_InvalidDocumentRejected() {
        assertThrows(IllegalArgumentException.class, () -> KafkaConfig.fromJson("{\"brokers\":[]}"));
        assertThrows(IllegalArgumentException.class,
                () -> KafkaConfig.fromJson("{\"brokers\":[\"b1:9092\"],\"auto_offset_reset\":\"sideways\"}"));
        assertThrows(IllegalArgumentException.class, () -> KafkaConfig.fromJson("not json"));
    }

    @Test
    void testToJson_ReadableBack() {
        KafkaConfig config = KafkaConfig.builder()
                .broker("b1:9092")
                .groupId("g")
                .reconnectCount(7)
                .build();

        String json = JsonUtils.writeValueAsString(config);

        assertTrue(json.contains("\"group_id\":\"g\""));
        assertTrue(json.contains("\"reconnect_count\":7"));
        assertEquals(config, KafkaConfig.fromJson(json));
    }

    @Test
    void testFromEnv_ReadsVariables() {
        Map<String, String> env = new HashMap<>();
        env.put("KAFKA_BROKERS", "b1:9092, b2:9092");
        env.put("KAFKA_GROUP_ID", "payments");
        env.put("KAFKA_AUTO_COMMIT", "true");
        env.put("KAFKA_AUTO_OFFSET_RESET", "none");
        env.put("KAFKA_RECONNECT_COUNT", "3");
        env.put("KAFKA_LOG_LEVEL", "warning");

        KafkaConfig config = KafkaConfig.fromEnv(env::get);

        assertEquals(List.of("b1:9092", "b2:9092"), config.getBrokers());
        assertEquals("payments", config.getGroupId());
        assertEquals(Boolean.TRUE, config.getAutoCommit());
        assertEquals(AutoOffsetReset.NONE, config.getAutoOffsetReset());
        assertEquals(3, config.getReconnectCount());
        assertEquals(KafkaLogLevel.WARNING, config.getLogLevel());
        assertNull(config.getSessionTimeoutMs());
    }

    @Test
    void testFromEnv_EmptyEnvironmentUsesDefaults() {
        KafkaConfig config = KafkaConfig.fromEnv(key -> null);

        assertEquals(List.of("localhost:9092"), config.getBrokers());
        assertEquals(100, config.getReconnectCount());
        assertEquals(500, config.getReconnectSleepMs());
    }

    @Test
    void testEnumParsing_CaseInsensitive() {
        assertEquals(AutoOffsetReset.EARLIEST, AutoOffsetReset.of("EaRlIeSt"));
        assertEquals("latest", AutoOffsetReset.LATEST.propertyValue());
        assertEquals(KafkaLogLevel.CRITICAL, KafkaLogLevel.of(" critical "));
        assertEquals(7, KafkaLogLevel.DEBUG.syslogSeverity());
        assertThrows(IllegalArgumentException.class, () -> KafkaLogLevel.of("TRACE"));
    }
}
