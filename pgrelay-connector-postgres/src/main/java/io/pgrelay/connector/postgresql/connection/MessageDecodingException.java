/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.connector.postgresql.connection;

import io.pgrelay.PgRelayException;

/**
 * Raised when a pgoutput message cannot be decoded.
 */
public class MessageDecodingException extends PgRelayException {

    private static final long serialVersionUID = 1L;

    public MessageDecodingException(String message) {
        super(message);
    }

    public MessageDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
