/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utilities related to threads and threading.
 *
 * @author Randall Hauch
 */
public class Threads {

    private static final Logger LOGGER = LoggerFactory.getLogger(Threads.class);

    private static final String THREAD_NAME_PATTERN = "pgrelay-%s";

    private Threads() {
    }

    /**
     * Returns a thread factory that creates threads conforming to the pattern {@code pgrelay-<name>[-<index>]}.
     *
     * @param name the name of the thread group, e.g. the name of the sink owning the threads
     * @param indexed whether to append a running counter to the thread name
     * @param daemon whether the created threads should be daemon threads
     * @return the thread factory setting the correct name
     */
    public static ThreadFactory threadFactory(String name, boolean indexed, boolean daemon) {
        LOGGER.debug("Requested thread factory for '{}'", name);

        return new ThreadFactory() {
            private final AtomicInteger index = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                StringBuilder threadName = new StringBuilder(String.format(THREAD_NAME_PATTERN, name));
                if (indexed) {
                    threadName.append('-').append(index.getAndIncrement());
                }
                LOGGER.debug("Creating thread {}", threadName);
                final Thread t = new Thread(r, threadName.toString());
                t.setDaemon(daemon);
                return t;
            }
        };
    }

    public static ExecutorService newSingleThreadExecutor(String name) {
        return Executors.newSingleThreadExecutor(threadFactory(name, false, true));
    }
}
