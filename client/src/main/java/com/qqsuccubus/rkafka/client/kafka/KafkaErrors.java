package com.qqsuccubus.rkafka.client.kafka;

import com.qqsuccubus.rkafka.core.error.AdapterException;
import com.qqsuccubus.rkafka.core.error.TransportException;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.ClusterAuthorizationException;
import org.apache.kafka.common.errors.FencedInstanceIdException;
import org.apache.kafka.common.errors.OutOfOrderSequenceException;
import org.apache.kafka.common.errors.ProducerFencedException;
import org.apache.kafka.common.errors.TransactionalIdAuthorizationException;
import org.apache.kafka.common.errors.UnsupportedVersionException;

import java.util.List;

/**
 * Translates kafka-clients exceptions into adapter failures.
 * <p>
 * An error is <b>fatal</b> when it, or anything in its cause chain, belongs to the
 * exceptions after which kafka-clients refuses to continue the current producer/consumer
 * session (fenced producer or static member, broken sequence, lost authorization,
 * failed authentication, unsupported protocol).
 * </p>
 */
public final class KafkaErrors {
    private KafkaErrors() {
    }

    private static final List<Class<? extends Throwable>> FATAL = List.of(
        ProducerFencedException.class,
        FencedInstanceIdException.class,
        OutOfOrderSequenceException.class,
        TransactionalIdAuthorizationException.class,
        ClusterAuthorizationException.class,
        UnsupportedVersionException.class,
        AuthenticationException.class
    );

    // guards against self-referencing cause chains
    private static final int MAX_CAUSE_DEPTH = 16;

    public static boolean isFatal(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            for (Class<? extends Throwable> type : FATAL) {
                if (type.isInstance(current)) {
                    return true;
                }
            }
            if (current instanceof TransportException) {
                return ((TransportException) current).isFatal();
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * @param operation what was being attempted, for the message
     * @param error     error raised by kafka-clients or reactor-kafka
     * @return {@code error} if it already is an adapter failure, otherwise a classified {@link TransportException}
     */
    public static AdapterException translate(String operation, Throwable error) {
        if (error instanceof AdapterException) {
            return (AdapterException) error;
        }
        return new TransportException(operation + " failed: " + error.getMessage(), error, isFatal(error));
    }
}
