/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay;

/**
 * Base exception thrown by the relay when decoding, streaming or delivering changes fails.
 *
 */
public class PgRelayException extends RuntimeException {

    private static final long serialVersionUID = 4310866123711905276L;

    public PgRelayException() {
    }

    public PgRelayException(String message) {
        super(message);
    }

    public PgRelayException(Throwable cause) {
        super(cause);
    }

    public PgRelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
