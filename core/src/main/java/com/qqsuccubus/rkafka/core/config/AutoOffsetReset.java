package com.qqsuccubus.rkafka.core.config;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Strategy for resetting the consumer offset when no committed offset exists
 * or the committed one is no longer on the broker.
 */
public enum AutoOffsetReset {
    /**
     * No specific reset strategy is defined; the client default applies.
     */
    NONE("none"),

    /**
     * Always start from the latest message.
     */
    LATEST("latest"),

    /**
     * Always start from the earliest available message.
     */
    EARLIEST("earliest");

    private final String propertyValue;

    AutoOffsetReset(String propertyValue) {
        this.propertyValue = propertyValue;
    }

    /**
     * @return value understood by the {@code auto.offset.reset} client property
     */
    public String propertyValue() {
        return propertyValue;
    }

    /**
     * Parses a policy name case-insensitively ({@code "Earliest"}, {@code "earliest"}, ...).
     *
     * @param value policy name
     * @return parsed policy
     * @throws IllegalArgumentException if the name is unknown
     */
    @JsonCreator
    public static AutoOffsetReset of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("auto_offset_reset must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown auto_offset_reset: " + value, e);
        }
    }
}
