/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.pipeline;

import java.util.List;

import io.pgrelay.PgRelayException;

/**
 * Raised when one or more sinks failed to deliver a change. The first failure is the cause; the others are attached
 * as suppressed exceptions.
 */
public class DispatchException extends PgRelayException {

    private static final long serialVersionUID = 1L;

    private final List<String> failedSinks;
    private final int succeeded;

    public DispatchException(String message, List<String> failedSinks, int succeeded, Throwable cause) {
        super(message, cause);
        this.failedSinks = List.copyOf(failedSinks);
        this.succeeded = succeeded;
    }

    /**
     * @return the names of the sinks that failed, in sink order
     */
    public List<String> failedSinks() {
        return failedSinks;
    }

    /**
     * @return the number of sinks that delivered the change
     */
    public int succeeded() {
        return succeeded;
    }
}
