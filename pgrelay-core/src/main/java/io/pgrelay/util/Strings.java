/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * String-related utility methods.
 *
 * @author Randall Hauch
 */
public final class Strings {

    private Strings() {
    }

    /**
     * Check if the string is empty or null or consists only of whitespace.
     *
     * @param str the string to check
     * @return {@code true} if the string is empty, null, or blank
     */
    public static boolean isNullOrBlank(String str) {
        return str == null || str.trim().isEmpty();
    }

    /**
     * Split a comma-separated string into its trimmed, non-empty parts.
     *
     * @param value the string to split; may be null
     * @return the list of parts; never null but possibly empty
     */
    public static List<String> splitCommaSeparated(String value) {
        if (isNullOrBlank(value)) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }
}
