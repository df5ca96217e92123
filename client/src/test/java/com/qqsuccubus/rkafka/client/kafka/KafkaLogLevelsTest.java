package com.qqsuccubus.rkafka.client.kafka;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.qqsuccubus.rkafka.core.config.KafkaLogLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KafkaLogLevelsTest {

    private final Logger kafkaLogger = (Logger) LoggerFactory.getLogger(KafkaLogLevels.CLIENT_LOGGER);
    private final Level original = kafkaLogger.getLevel();

    @AfterEach
    void restore() {
        kafkaLogger.setLevel(original);
    }

    @Test
    void testMapping() {
        assertEquals(Level.ERROR, KafkaLogLevels.toLogback(KafkaLogLevel.CRITICAL));
        assertEquals(Level.ERROR, KafkaLogLevels.toLogback(KafkaLogLevel.ERROR));
        assertEquals(Level.WARN, KafkaLogLevels.toLogback(KafkaLogLevel.WARNING));
        assertEquals(Level.INFO, KafkaLogLevels.toLogback(KafkaLogLevel.INFO));
        assertEquals(Level.DEBUG, KafkaLogLevels.toLogback(KafkaLogLevel.DEBUG));
    }

    @Test
    void testApply_SetsClientLoggerLevel() {
        assertTrue(KafkaLogLevels.apply(KafkaLogLevel.INFO));
        assertEquals(Level.INFO, kafkaLogger.getLevel());

        assertTrue(KafkaLogLevels.apply(KafkaLogLevel.CRITICAL));
        assertEquals(Level.ERROR, kafkaLogger.getLevel());
    }

    @Test
    void testApply_NullIgnored() {
        assertFalse(KafkaLogLevels.apply(null));
    }
}
