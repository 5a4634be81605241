/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.sink.console;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Test;

import io.pgrelay.data.ChangeFixtures;

public class TextChangeFormatterTest {

    @Test
    public void shouldRenderTransactionMarkers() {
        assertThat(TextChangeFormatter.format(ChangeFixtures.begin()))
                .isEqualTo("BEGIN [LSN: 0/1234567, XID: 999, Time: 123456789]");
        assertThat(TextChangeFormatter.format(ChangeFixtures.commit()))
                .isEqualTo("COMMIT [LSN: 0/1234600, Time: 123456999]");
    }

    @Test
    public void shouldRenderRelation() {
        assertThat(TextChangeFormatter.format(ChangeFixtures.usersRelation())).isEqualTo(
                "RELATION [public.users (ID: 100)]\n"
                        + "  Columns:\n"
                        + "    - id (type_id: 23, flags: 1)\n"
                        + "    - name (type_id: 25, flags: 0)");
    }

    @Test
    public void shouldRenderInsert() {
        assertThat(TextChangeFormatter.format(ChangeFixtures.insertAlice())).isEqualTo(
                "INSERT into public.users (ID: 100)\n"
                        + "  New values:\n"
                        + "    id: 1\n"
                        + "    name: Alice");
    }

    @Test
    public void shouldRenderUpdateWithAndWithoutOldValues() {
        assertThat(TextChangeFormatter.format(ChangeFixtures.updateAlice())).isEqualTo(
                "UPDATE public.users (ID: 100)\n"
                        + "  Old values:\n"
                        + "    id: 1\n"
                        + "    name: Alice\n"
                        + "  New values:\n"
                        + "    id: 1\n"
                        + "    name: Alicia");
        assertThat(TextChangeFormatter.format(ChangeFixtures.updateWithoutOldTuple())).isEqualTo(
                "UPDATE public.users (ID: 100)\n"
                        + "  New values:\n"
                        + "    id: 1\n"
                        + "    name: NULL");
    }

    @Test
    public void shouldRenderDeleteWithNulls() {
        assertThat(TextChangeFormatter.format(ChangeFixtures.deleteAlice())).isEqualTo(
                "DELETE from public.users (ID: 100)\n"
                        + "  Old values:\n"
                        + "    id: 1\n"
                        + "    name: NULL");
    }
}
