/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.sink.http;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

import io.pgrelay.annotation.Immutable;
import io.pgrelay.data.Change;

/**
 * Maps table changes to ingestion destinations named {@code <schema>_<table>}.
 * <p>
 * With an allow-list only the listed destinations are routed; without one every table is routed.
 */
@Immutable
public class DestinationRouter {

    private final Set<String> allowedDestinations;

    /**
     * @param allowedDestinations the destinations to route to, or an empty collection to route every table
     */
    public DestinationRouter(Collection<String> allowedDestinations) {
        this.allowedDestinations = Set.copyOf(allowedDestinations);
    }

    public static String destinationFor(Change.TableChange change) {
        return change.schema() + "_" + change.table();
    }

    /**
     * @param change the table change
     * @return the destination of the change, or empty if the change's table is not allowed
     */
    public Optional<String> route(Change.TableChange change) {
        final String destination = destinationFor(change);
        if (allowedDestinations.isEmpty() || allowedDestinations.contains(destination)) {
            return Optional.of(destination);
        }
        return Optional.empty();
    }

    public boolean isDynamic() {
        return allowedDestinations.isEmpty();
    }
}
