/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.util;

/**
 * @author Randall Hauch
 *
 */
public class MockClock implements Clock {

    private long currentTimeInMillis;

    public MockClock() {
    }

    public MockClock(long timeInMillis) {
        currentTimeInMillis = timeInMillis;
    }

    public MockClock increment(long timeInMillis) {
        currentTimeInMillis += timeInMillis;
        return this;
    }

    @Override
    public long currentTimeInMillis() {
        return currentTimeInMillis;
    }
}
