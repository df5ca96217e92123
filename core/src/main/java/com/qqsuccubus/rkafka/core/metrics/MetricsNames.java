package com.qqsuccubus.rkafka.core.metrics;

/**
 * Micrometer metric names used by the adapters.
 * <p>
 * <b>Naming convention:</b> {@code rkafka.<metric>}, counters end in {@code .total}.
 * Every meter is tagged with {@link MetricsTags#COMPONENT}.
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: connection attempts, successful or not.
     */
    public static final String CONNECT_ATTEMPTS_TOTAL = "rkafka.connect.attempts.total";

    /**
     * Counter: failed connection attempts.
     */
    public static final String CONNECT_FAILURES_TOTAL = "rkafka.connect.failures.total";

    /**
     * Counter: operation failures on a live connection.
     * <p>
     * Tags: component, kind (fatal/transient/codec)
     * </p>
     */
    public static final String ERRORS_TOTAL = "rkafka.errors.total";

    /**
     * Counter: messages received (consumer) or sent (producer).
     */
    public static final String MESSAGES_TOTAL = "rkafka.messages.total";

    /**
     * Counter: reconnect budgets run down to zero.
     */
    public static final String EXHAUSTED_TOTAL = "rkafka.exhausted.total";
}
