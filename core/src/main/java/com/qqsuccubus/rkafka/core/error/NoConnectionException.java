package com.qqsuccubus.rkafka.core.error;

/**
 * Raised when a receive or send is attempted before a connection was established.
 */
public class NoConnectionException extends AdapterException {

    public NoConnectionException() {
        super("No connection: attempting to send or receive without an established connection");
    }
}
