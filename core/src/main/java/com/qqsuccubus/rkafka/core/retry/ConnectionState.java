package com.qqsuccubus.rkafka.core.retry;

/**
 * States of {@link ConnectionStateMachine}. {@link #EXHAUSTED} is terminal for the current budget.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTED,
    EXHAUSTED
}
