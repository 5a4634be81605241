/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.connector.postgresql.connection.pgoutput;

/**
 * The pgoutput logical replication message types, identified by their first byte.
 */
public enum MessageType {
    RELATION('R'),
    BEGIN('B'),
    COMMIT('C'),
    INSERT('I'),
    UPDATE('U'),
    DELETE('D'),
    TYPE('Y'),
    ORIGIN('O'),
    TRUNCATE('T');

    private final char tag;

    MessageType(char tag) {
        this.tag = tag;
    }

    /**
     * Look up the message type for a tag byte.
     *
     * @param type the tag
     * @return the message type, or {@code null} if the tag is not a known message type
     */
    public static MessageType forType(char type) {
        for (MessageType messageType : values()) {
            if (messageType.tag == type) {
                return messageType;
            }
        }
        return null;
    }
}
