package com.qqsuccubus.rkafka.core.error;

/**
 * Wraps an error reported by the underlying broker client.
 * <p>
 * <b>Fatal</b> errors mean the current session cannot continue: the connection is torn down
 * and rebuilt, consuming one unit of reconnect budget. <b>Transient</b> errors are surfaced
 * to the caller as-is and leave the connection in place.
 * </p>
 */
public class TransportException extends AdapterException {

    private final boolean fatal;

    public TransportException(String message, Throwable cause, boolean fatal) {
        super(message, cause);
        this.fatal = fatal;
    }

    public static TransportException fatal(String message, Throwable cause) {
        return new TransportException(message, cause, true);
    }

    public static TransportException transientError(String message, Throwable cause) {
        return new TransportException(message, cause, false);
    }

    public boolean isFatal() {
        return fatal;
    }
}
