/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.sink.spi;

import java.util.concurrent.CompletableFuture;

import io.pgrelay.data.Change;

/**
 * A destination for decoded changes. Implementations receive every change in upstream order and may deliver it
 * asynchronously; the dispatcher waits for the returned future before handing over the next change.
 * <p>
 * Implementations must not modify the change.
 */
public interface ChangeEventSink extends AutoCloseable {

    /**
     * Deliver one change.
     *
     * @param change the change to deliver; never null
     * @return a future that completes once the change has been accepted by the destination, or completes
     *         exceptionally with a {@link SinkException} if delivery failed; never null
     */
    CompletableFuture<Void> deliver(Change change);

    /**
     * A short name used in logs and failure reports.
     */
    String name();

    /**
     * Release the resources held by the sink, flushing anything still buffered.
     */
    @Override
    void close();
}
