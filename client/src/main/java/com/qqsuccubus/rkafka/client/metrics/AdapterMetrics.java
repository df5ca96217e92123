package com.qqsuccubus.rkafka.client.metrics;

import com.qqsuccubus.rkafka.core.metrics.MetricsNames;
import com.qqsuccubus.rkafka.core.metrics.MetricsTags;
import com.qqsuccubus.rkafka.core.retry.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Micrometer counters for one adapter type.
 */
public class AdapterMetrics {

    private final Counter connectAttempts;
    private final Counter connectFailures;
    private final Counter messages;
    private final Counter exhausted;
    private final Map<FailureKind, Counter> errors = new EnumMap<>(FailureKind.class);

    /**
     * @param registry  target registry
     * @param component adapter type, used as the {@code component} tag
     */
    public AdapterMetrics(MeterRegistry registry, String component) {
        connectAttempts = Counter.builder(MetricsNames.CONNECT_ATTEMPTS_TOTAL)
            .tag(MetricsTags.COMPONENT, component)
            .description("Connection attempts, successful or not")
            .register(registry);

        connectFailures = Counter.builder(MetricsNames.CONNECT_FAILURES_TOTAL)
            .tag(MetricsTags.COMPONENT, component)
            .description("Failed connection attempts")
            .register(registry);

        messages = Counter.builder(MetricsNames.MESSAGES_TOTAL)
            .tag(MetricsTags.COMPONENT, component)
            .description("Messages received or sent")
            .register(registry);

        exhausted = Counter.builder(MetricsNames.EXHAUSTED_TOTAL)
            .tag(MetricsTags.COMPONENT, component)
            .description("Reconnect budgets exhausted")
            .register(registry);

        for (FailureKind kind : FailureKind.values()) {
            errors.put(kind, Counter.builder(MetricsNames.ERRORS_TOTAL)
                .tag(MetricsTags.COMPONENT, component)
                .tag(MetricsTags.KIND, kind.name().toLowerCase(Locale.ROOT))
                .description("Operation failures on a live connection")
                .register(registry));
        }
    }

    public void recordConnectAttempt() {
        connectAttempts.increment();
    }

    public void recordConnectFailure() {
        connectFailures.increment();
    }

    public void recordMessage() {
        messages.increment();
    }

    public void recordFailure(FailureKind kind) {
        errors.get(kind).increment();
    }

    public void recordExhausted() {
        exhausted.increment();
    }
}
