package com.qqsuccubus.rkafka.core.config;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Log verbosity handed to the underlying broker client.
 * <p>
 * Constants are declared from least to most verbose, so {@link #compareTo} orders them.
 * Each level carries its syslog severity.
 * </p>
 */
public enum KafkaLogLevel {
    CRITICAL(2),
    ERROR(3),
    WARNING(4),
    INFO(6),
    DEBUG(7);

    private final int syslogSeverity;

    KafkaLogLevel(int syslogSeverity) {
        this.syslogSeverity = syslogSeverity;
    }

    public int syslogSeverity() {
        return syslogSeverity;
    }

    /**
     * Parses a level name case-insensitively.
     *
     * @param value level name, e.g. {@code "ERROR"} or {@code "debug"}
     * @return parsed level
     * @throws IllegalArgumentException if the name is unknown
     */
    @JsonCreator
    public static KafkaLogLevel of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("log_level must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown log_level: " + value, e);
        }
    }
}
