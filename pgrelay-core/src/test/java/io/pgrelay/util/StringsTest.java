/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Test;

public class StringsTest {

    @Test
    public void shouldSplitCommaSeparatedValuesAndTrimThem() {
        assertThat(Strings.splitCommaSeparated(" public_users, ,inventory_orders ,")).containsExactly("public_users", "inventory_orders");
    }

    @Test
    public void shouldReturnEmptyListForMissingValue() {
        assertThat(Strings.splitCommaSeparated(null)).isEmpty();
        assertThat(Strings.splitCommaSeparated("   ")).isEmpty();
    }

    @Test
    public void shouldDetectBlankStrings() {
        assertThat(Strings.isNullOrBlank(null)).isTrue();
        assertThat(Strings.isNullOrBlank(" \t")).isTrue();
        assertThat(Strings.isNullOrBlank(" a ")).isFalse();
    }
}
