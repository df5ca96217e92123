package com.qqsuccubus.rkafka.client.kafka;

import ch.qos.logback.classic.Level;
import com.qqsuccubus.rkafka.core.config.KafkaLogLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the configured {@link KafkaLogLevel} to the kafka-clients loggers.
 * <p>
 * kafka-clients logs through SLF4J and has no verbosity property of its own, so the level is
 * set on the {@code org.apache.kafka} logger when Logback is the active backend.
 * </p>
 */
public final class KafkaLogLevels {
    private KafkaLogLevels() {
    }

    public static final String CLIENT_LOGGER = "org.apache.kafka";

    public static Level toLogback(KafkaLogLevel level) {
        switch (level) {
            case CRITICAL:
            case ERROR:
                return Level.ERROR;
            case WARNING:
                return Level.WARN;
            case INFO:
                return Level.INFO;
            case DEBUG:
                return Level.DEBUG;
            default:
                throw new IllegalArgumentException("Unknown log level: " + level);
        }
    }

    /**
     * @return true if the level was applied
     */
    public static boolean apply(KafkaLogLevel level) {
        if (level == null) {
            return false;
        }
        Logger logger = LoggerFactory.getLogger(CLIENT_LOGGER);
        if (logger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) logger).setLevel(toLogback(level));
            return true;
        }
        return false;
    }
}
