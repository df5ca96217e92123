package com.qqsuccubus.rkafka.core.error;

/**
 * Message encode/decode failure. Never retried: the same bytes would fail the same way.
 */
public class CodecException extends AdapterException {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
