/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.sink.kafka;

import io.pgrelay.annotation.Immutable;
import io.pgrelay.data.Change;

/**
 * Determines the topic a change is published to.
 * <p>
 * Table changes go to {@code <prefix>.<schema>.<table>.<operation>}, transaction markers to
 * {@code <prefix>.transactions.<begin|commit>.event}. Characters that are not legal in a topic name are replaced
 * with an underscore.
 */
@Immutable
public class SubjectNamingStrategy {

    private static final String DELIMITER = ".";
    private static final char REPLACEMENT_CHAR = '_';

    private final String prefix;

    public SubjectNamingStrategy(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Returns the name of the subject for a given change.
     *
     * @param change the change, never {@code null}
     * @return the name of the subject, never {@code null}
     */
    public String subjectFor(Change change) {
        if (change.isTransactional()) {
            return sanitize(String.join(DELIMITER, prefix, "transactions", change.operation().code(), "event"));
        }
        final Change.TableChange tableChange = (Change.TableChange) change;
        return sanitize(String.join(DELIMITER, prefix, tableChange.schema(), tableChange.table(), change.operation().code()));
    }

    /**
     * Returns the record key for a given change: the qualified table name for table changes, the LSN otherwise.
     */
    public String keyFor(Change change) {
        if (change instanceof Change.TableChange) {
            return ((Change.TableChange) change).qualifiedName();
        }
        return change.lsn().orElse(null);
    }

    public String prefix() {
        return prefix;
    }

    private static String sanitize(String subject) {
        final StringBuilder sanitized = new StringBuilder(subject.length());
        for (int i = 0; i < subject.length(); i++) {
            char c = subject.charAt(i);
            sanitized.append(isValidTopicNameCharacter(c) ? c : REPLACEMENT_CHAR);
        }
        return sanitized.toString();
    }

    private static boolean isValidTopicNameCharacter(char c) {
        return c == '.' || c == '_' || c == '-' || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
    }
}
