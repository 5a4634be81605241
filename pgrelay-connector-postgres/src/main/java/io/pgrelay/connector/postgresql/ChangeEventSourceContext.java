/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.connector.postgresql;

/**
 * Lets the owner of a change source signal that streaming should stop.
 */
@FunctionalInterface
public interface ChangeEventSourceContext {

    /**
     * @return {@code true} as long as the source should keep producing changes
     */
    boolean isRunning();
}
