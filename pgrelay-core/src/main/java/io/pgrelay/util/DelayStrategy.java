/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.util;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Encapsulates the logic of determining a delay when some criteria is met.
 *
 * @author Randall Hauch
 */
@FunctionalInterface
public interface DelayStrategy {

    /**
     * Attempt to sleep when the specified criteria is met.
     *
     * @param criteria {@code true} if this method should sleep, or {@code false} if there is no need to sleep
     * @return {@code true} if this invocation caused the thread to sleep, or {@code false} if this method did not sleep
     */
    default boolean sleepWhen(BooleanSupplier criteria) {
        return sleepWhen(criteria.getAsBoolean());
    }

    /**
     * Attempt to sleep when the specified criteria is met.
     *
     * @param criteria {@code true} if this method should sleep, or {@code false} if there is no need to sleep
     * @return {@code true} if this invocation caused the thread to sleep, or {@code false} if this method did not sleep
     */
    boolean sleepWhen(boolean criteria);

    /**
     * Create a delay strategy that never delays.
     *
     * @return the strategy; never null
     */
    static DelayStrategy none() {
        return (criteria) -> false;
    }

    /**
     * Create a delay strategy that applies a constant delay as long as the criteria is met. An interruption while
     * sleeping ends the delay early and leaves the thread's interrupt flag set.
     *
     * @param delay the delay; must be positive
     * @return the strategy; never null
     */
    static DelayStrategy constant(Duration delay) {
        final long delayInMilliseconds = delay.toMillis();
        if (delayInMilliseconds <= 0) {
            throw new IllegalArgumentException("Delay must be positive");
        }
        return (criteria) -> {
            if (!criteria) {
                return false;
            }
            try {
                Thread.sleep(delayInMilliseconds);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return true;
        };
    }
}
