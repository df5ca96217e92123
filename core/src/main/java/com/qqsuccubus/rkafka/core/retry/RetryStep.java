package com.qqsuccubus.rkafka.core.retry;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One iteration of a retry loop driven by {@link ConnectionStateMachine}.
 * <p>
 * A step either produces nothing (a connect attempt, or a fatal error that forces a reconnect),
 * produces an item and lets the loop continue, or produces the final item of the loop.
 * </p>
 *
 * @param <T> item value type
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RetryStep<T> {

    public enum Kind {
        SILENT,
        ITEM,
        TERMINAL
    }

    Kind kind;
    Result<T> result;

    public static <T> RetryStep<T> silent() {
        return new RetryStep<>(Kind.SILENT, null);
    }

    public static <T> RetryStep<T> item(Result<T> result) {
        return new RetryStep<>(Kind.ITEM, result);
    }

    public static <T> RetryStep<T> terminal(Result<T> result) {
        return new RetryStep<>(Kind.TERMINAL, result);
    }

    public boolean hasResult() {
        return kind != Kind.SILENT;
    }

    public boolean isTerminal() {
        return kind == Kind.TERMINAL;
    }
}
