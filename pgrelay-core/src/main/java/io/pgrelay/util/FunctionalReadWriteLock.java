/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.util;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * A read-write lock whose read and write sections are expressed as lambdas, so a lock can never be left held.
 *
 * @author Randall Hauch
 */
public class FunctionalReadWriteLock {

    /**
     * Create a read-write lock that supports reentrancy.
     * @return the functional read-write lock; never null
     */
    public static FunctionalReadWriteLock reentrant() {
        return new FunctionalReadWriteLock(new ReentrantReadWriteLock());
    }

    private final ReadWriteLock lock;

    protected FunctionalReadWriteLock(ReadWriteLock lock) {
        this.lock = lock;
    }

    /**
     * Obtain a read lock, perform the operation, and release the read lock.
     *
     * @param operation the operation to perform while the read lock is held; may not be null
     * @return the result of the operation
     */
    public <T> T read(Supplier<T> operation) {
        lock.readLock().lock();
        try {
            return operation.get();
        }
        finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Obtain an exclusive write lock, perform the operation, and release the lock.
     *
     * @param operation the operation to perform while the write lock is held; may not be null
     */
    public void write(Runnable operation) {
        lock.writeLock().lock();
        try {
            operation.run();
        }
        finally {
            lock.writeLock().unlock();
        }
    }
}
