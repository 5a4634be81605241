/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.sink.console;

import java.io.PrintStream;
import java.util.concurrent.CompletableFuture;

import io.pgrelay.annotation.ThreadSafe;
import io.pgrelay.data.Change;
import io.pgrelay.data.ChangeJson;
import io.pgrelay.sink.spi.ChangeEventSink;
import io.pgrelay.sink.spi.SinkException;

/**
 * Writes every change to a print stream, by default the standard output.
 */
@ThreadSafe
public class ConsoleChangeEventSink implements ChangeEventSink {

    private final OutputFormat format;
    private final PrintStream out;

    public ConsoleChangeEventSink(OutputFormat format) {
        this(format, System.out);
    }

    public ConsoleChangeEventSink(OutputFormat format, PrintStream out) {
        this.format = format;
        this.out = out;
    }

    @Override
    public CompletableFuture<Void> deliver(Change change) {
        final String rendered = render(change);
        synchronized (out) {
            out.println(rendered);
            out.flush();
            if (out.checkError()) {
                return CompletableFuture.failedFuture(new SinkException("Failed to write " + change.operation() + " change to the console"));
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    private String render(Change change) {
        switch (format) {
            case JSON_PRETTY:
                return ChangeJson.PRETTY.write(change);
            case TEXT:
                return TextChangeFormatter.format(change);
            case JSON:
            default:
                return ChangeJson.COMPACT.write(change);
        }
    }

    public OutputFormat format() {
        return format;
    }

    @Override
    public String name() {
        return "console";
    }

    @Override
    public void close() {
        out.flush();
    }
}
