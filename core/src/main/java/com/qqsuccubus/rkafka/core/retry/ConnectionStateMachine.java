package com.qqsuccubus.rkafka.core.retry;

import com.qqsuccubus.rkafka.core.error.AdapterException;
import com.qqsuccubus.rkafka.core.error.NoConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

/**
 * Retry-bounded connection state machine shared by the consumer and producer adapters.
 * <p>
 * Owns zero or one live connection handle and a reconnect budget. The budget starts at
 * {@code reconnectCount + 1} (the first attempt is included) and is consumed only by:
 * <ul>
 *   <li>failed connection attempts</li>
 *   <li>fatal transport errors on a live connection</li>
 * </ul>
 * Successful operations, codec errors and non-fatal transport errors leave it untouched.
 * </p>
 * <p>
 * <b>Transitions:</b>
 * <pre>
 * DISCONNECTED --connect fails-->     DISCONNECTED (remaining--, EXHAUSTED at 0)
 * DISCONNECTED --connect succeeds-->  CONNECTED
 * CONNECTED    --operate succeeds-->  CONNECTED
 * CONNECTED    --fatal error-->       DISCONNECTED (handle closed, remaining--, EXHAUSTED at 0)
 * CONNECTED    --other error-->       CONNECTED
 * </pre>
 * </p>
 * <p>
 * Not thread-safe: one adapter drives one machine from a single logical task.
 * </p>
 *
 * @param <H> connection handle type
 */
public final class ConnectionStateMachine<H extends AutoCloseable> {
    private static final Logger log = LoggerFactory.getLogger(ConnectionStateMachine.class);

    private final String name;
    private final int reconnectCount;

    private H handle;
    private long remaining;
    private AdapterException lastError;

    /**
     * @param name           label used in log lines (e.g. "consumer")
     * @param reconnectCount attempts allowed beyond the first one
     */
    public ConnectionStateMachine(String name, int reconnectCount) {
        if (reconnectCount < 0) {
            throw new IllegalArgumentException("reconnectCount must be >= 0, got " + reconnectCount);
        }
        this.name = name;
        this.reconnectCount = reconnectCount;
        this.remaining = reconnectCount + 1L;
    }

    public ConnectionState state() {
        if (remaining <= 0) {
            return ConnectionState.EXHAUSTED;
        }
        return handle != null ? ConnectionState.CONNECTED : ConnectionState.DISCONNECTED;
    }

    public boolean isConnected() {
        return handle != null;
    }

    /**
     * @return the live handle
     * @throws NoConnectionException if no connection is established
     */
    public H handle() {
        if (handle == null) {
            throw new NoConnectionException();
        }
        return handle;
    }

    public long remaining() {
        return remaining;
    }

    public int reconnectCount() {
        return reconnectCount;
    }

    /**
     * @return last connect or fatal error recorded under the current budget
     */
    @Nullable
    public AdapterException lastError() {
        return lastError;
    }

    /**
     * @return true if the next connect attempt is a reconnect after a failure
     */
    public boolean isRecovering() {
        return lastError != null;
    }

    /**
     * Starts a fresh budget for a new stream or send call. A live handle is kept.
     */
    public void resetBudget() {
        remaining = reconnectCount + 1L;
        lastError = null;
    }

    /**
     * DISCONNECTED to CONNECTED. Any previous handle is closed before the new one is installed.
     */
    public void onConnected(H newHandle) {
        if (handle != newHandle) {
            release();
        }
        handle = newHandle;
        log.info("{} connected (remaining attempts={})", name, remaining);
    }

    /**
     * Records a failed connect attempt.
     *
     * @return state after the failure: DISCONNECTED or EXHAUSTED
     */
    public ConnectionState onConnectFailed(AdapterException error) {
        requireNotExhausted();
        release();
        lastError = error;
        remaining--;
        log.warn("{} connect failed (remaining attempts={}): {}", name, remaining, error.getMessage());
        return logIfExhausted();
    }

    /**
     * Records a failure on a live connection. Fatal errors drop the handle and consume budget;
     * anything else leaves state and budget as they are.
     *
     * @return classification of the failure
     */
    public FailureKind onOperationFailed(AdapterException error) {
        FailureKind kind = FailureKind.classify(error);
        if (!kind.requiresReconnect()) {
            log.debug("{} operation failed without reconnect ({}): {}", name, kind, error.getMessage());
            return kind;
        }
        requireNotExhausted();
        release();
        lastError = error;
        remaining--;
        log.warn("{} fatal transport error, dropping connection (remaining attempts={}): {}",
            name, remaining, error.getMessage());
        logIfExhausted();
        return kind;
    }

    /**
     * Closes the live handle, if any. The budget is left as it is.
     */
    public void close() {
        release();
    }

    private ConnectionState logIfExhausted() {
        ConnectionState state = state();
        if (state == ConnectionState.EXHAUSTED) {
            log.error("{} reconnect budget exhausted after {} attempts", name, reconnectCount + 1L,
                lastError);
        }
        return state;
    }

    private void requireNotExhausted() {
        if (remaining <= 0) {
            throw new IllegalStateException(name + " reconnect budget is exhausted");
        }
    }

    private void release() {
        H previous = handle;
        handle = null;
        if (previous == null) {
            return;
        }
        try {
            previous.close();
        } catch (Exception e) {
            log.warn("{} failed to close connection handle: {}", name, e.getMessage(), e);
        }
    }
}
