/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgrelay.annotation.NotThreadSafe;
import io.pgrelay.data.Change;
import io.pgrelay.sink.spi.ChangeEventSink;
import io.pgrelay.sink.spi.SinkException;

/**
 * Fans every change out to an ordered list of sinks.
 * <p>
 * All sinks receive the change before any of them is awaited, so slow sinks overlap. A failing sink never prevents
 * the others from receiving the change; failures are collected and reported together once every sink has finished.
 */
@NotThreadSafe
public class ChangeEventDispatcher implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeEventDispatcher.class);

    private final List<ChangeEventSink> sinks;

    public ChangeEventDispatcher(List<ChangeEventSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public List<ChangeEventSink> sinks() {
        return sinks;
    }

    /**
     * Deliver the change to every sink and wait for all deliveries to finish.
     *
     * @param change the change; may not be null
     * @throws DispatchException if at least one sink failed
     * @throws InterruptedException if the thread was interrupted while waiting for the sinks
     */
    public void dispatch(Change change) throws InterruptedException {
        if (sinks.isEmpty()) {
            return;
        }

        final List<CompletableFuture<Void>> deliveries = new ArrayList<>(sinks.size());
        for (ChangeEventSink sink : sinks) {
            deliveries.add(start(sink, change));
        }

        final List<String> failedSinks = new ArrayList<>();
        Throwable firstFailure = null;
        final List<Throwable> otherFailures = new ArrayList<>();
        for (int i = 0; i < sinks.size(); i++) {
            try {
                deliveries.get(i).get();
            }
            catch (ExecutionException e) {
                Throwable failure = e.getCause() != null ? e.getCause() : e;
                String sinkName = sinks.get(i).name();
                LOGGER.error("Sink '{}' failed to deliver {} change", sinkName, change.operation(), failure);
                failedSinks.add(sinkName);
                if (firstFailure == null) {
                    firstFailure = failure;
                }
                else {
                    otherFailures.add(failure);
                }
            }
        }

        if (firstFailure != null) {
            int succeeded = sinks.size() - failedSinks.size();
            DispatchException exception = new DispatchException(
                    String.format("Failed to deliver %s change to sink(s) %s; %d of %d sink(s) succeeded",
                            change.operation(), failedSinks, succeeded, sinks.size()),
                    failedSinks, succeeded, firstFailure);
            otherFailures.forEach(exception::addSuppressed);
            throw exception;
        }
    }

    private CompletableFuture<Void> start(ChangeEventSink sink, Change change) {
        try {
            CompletableFuture<Void> delivery = sink.deliver(change);
            if (delivery == null) {
                return CompletableFuture.failedFuture(new SinkException("Sink '" + sink.name() + "' returned no delivery"));
            }
            return delivery;
        }
        catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e instanceof CompletionException && e.getCause() != null ? e.getCause() : e);
        }
    }

    /**
     * Close every sink. Failures are logged and do not prevent the remaining sinks from being closed.
     */
    @Override
    public void close() {
        for (ChangeEventSink sink : sinks) {
            try {
                sink.close();
                LOGGER.debug("Closed sink '{}'", sink.name());
            }
            catch (RuntimeException e) {
                LOGGER.warn("Failed to close sink '{}'", sink.name(), e);
            }
        }
    }
}
