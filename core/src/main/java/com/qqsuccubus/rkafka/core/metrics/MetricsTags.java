package com.qqsuccubus.rkafka.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for the adapter type (consumer/producer).
     */
    public static final String COMPONENT = "component";

    /**
     * Tag key for failure classification.
     */
    public static final String KIND = "kind";
}
