package com.qqsuccubus.rkafka.core.error;

/**
 * Root of every failure surfaced by the resilient consumer and producer.
 */
public class AdapterException extends RuntimeException {

    public AdapterException(String message) {
        super(message);
    }

    public AdapterException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns {@code error} itself if it already is an adapter failure, otherwise wraps it
     * as a transient {@link TransportException}.
     */
    public static AdapterException wrap(Throwable error) {
        if (error instanceof AdapterException) {
            return (AdapterException) error;
        }
        return TransportException.transientError(String.valueOf(error.getMessage()), error);
    }
}
