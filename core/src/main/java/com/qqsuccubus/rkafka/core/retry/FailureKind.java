package com.qqsuccubus.rkafka.core.retry;

import com.qqsuccubus.rkafka.core.error.CodecException;
import com.qqsuccubus.rkafka.core.error.TransportException;

/**
 * Classification of an operation failure on a live connection.
 */
public enum FailureKind {
    /**
     * Unrecoverable session failure: drop the connection and reconnect.
     */
    FATAL,
    /**
     * Any other transport or adapter failure: report, keep the connection.
     */
    TRANSIENT,
    /**
     * Encode/decode failure: report, keep the connection.
     */
    CODEC;

    public static FailureKind classify(Throwable error) {
        if (error instanceof TransportException && ((TransportException) error).isFatal()) {
            return FATAL;
        }
        if (error instanceof CodecException) {
            return CODEC;
        }
        return TRANSIENT;
    }

    public boolean requiresReconnect() {
        return this == FATAL;
    }
}
