/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.connector.postgresql.connection;

import java.util.Objects;

import org.postgresql.replication.LogSequenceNumber;

import io.pgrelay.annotation.Immutable;

/**
 * Abstraction of PostgreSQL log sequence number, adapted from {@link LogSequenceNumber}.
 * <p>
 * The textual form is two upper-case hexadecimal numbers without padding separated by a slash, e.g. {@code 16/3002D50}.
 */
@Immutable
public final class Lsn implements Comparable<Lsn> {

    /**
     * Zero is used in PostgreSQL to mark an invalid position.
     */
    public static final Lsn INVALID_LSN = new Lsn(0);

    private final long value;

    private Lsn(long value) {
        this.value = value;
    }

    /**
     * @param value numeric represent position in the write-ahead log stream
     * @return LSN instance
     */
    public static Lsn valueOf(long value) {
        if (value == 0) {
            return INVALID_LSN;
        }
        return new Lsn(value);
    }

    /**
     * Create LSN instance by string represent LSN.
     *
     * @param strValue string as two hexadecimal numbers of up to 8 digits each, separated by a slash. For example
     *            {@code 16/3002D50}, {@code 0/15D68C50}
     * @return LSN instance; never null
     * @throws IllegalArgumentException if the supplied value is not a valid LSN
     */
    public static Lsn valueOf(String strValue) {
        Objects.requireNonNull(strValue, "LSN");
        final String trimmed = strValue.trim();
        final int slashIndex = trimmed.indexOf('/');
        if (slashIndex <= 0 || slashIndex != trimmed.lastIndexOf('/') || slashIndex == trimmed.length() - 1) {
            throw new IllegalArgumentException("Invalid LSN '" + strValue + "'");
        }
        try {
            long high = Long.parseLong(trimmed.substring(0, slashIndex), 16);
            long low = Long.parseLong(trimmed.substring(slashIndex + 1), 16);
            if (high < 0 || high > 0xFFFFFFFFL || low < 0 || low > 0xFFFFFFFFL) {
                throw new IllegalArgumentException("Invalid LSN '" + strValue + "'");
            }
            return valueOf((high << 32) | low);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid LSN '" + strValue + "'", e);
        }
    }

    /**
     * @return Long represent position in the write-ahead log stream
     */
    public long asLong() {
        return value;
    }

    /**
     * @return PostgreSQL JDBC driver representation of position in the write-ahead log stream
     */
    public LogSequenceNumber asLogSequenceNumber() {
        return LogSequenceNumber.valueOf(value);
    }

    /**
     * @return String represent position in the write-ahead log stream as two hexadecimal numbers of up to 8 digits
     *         each, separated by a slash
     */
    public String asString() {
        return asLogSequenceNumber().asString();
    }

    /**
     * @return true if this is a valid LSN
     */
    public boolean isValid() {
        return this != INVALID_LSN && value != 0;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return value == ((Lsn) obj).value;
    }

    @Override
    public String toString() {
        return "LSN{" + asString() + '}';
    }

    @Override
    public int compareTo(Lsn o) {
        return Long.compareUnsigned(value, o.value);
    }
}
