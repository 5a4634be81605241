/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.data;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sample changes shared by the tests of all modules.
 */
public final class ChangeFixtures {

    public static final long USERS_RELATION_ID = 100L;

    private ChangeFixtures() {
    }

    public static Change.Begin begin() {
        return new Change.Begin("0/1234567", 123456789L, 999L);
    }

    public static Change.Commit commit() {
        return new Change.Commit("0/1234600", 123456999L);
    }

    public static Change.Relation usersRelation() {
        return new Change.Relation(USERS_RELATION_ID, "public", "users", Arrays.asList(
                new Column("id", 23L, 1),
                new Column("name", 25L, 0)));
    }

    public static Change.Insert insertAlice() {
        return new Change.Insert(USERS_RELATION_ID, "public", "users", tuple("id", "1", "name", "Alice"));
    }

    public static Change.Update updateAlice() {
        return new Change.Update(USERS_RELATION_ID, "public", "users",
                tuple("id", "1", "name", "Alice"),
                tuple("id", "1", "name", "Alicia"));
    }

    public static Change.Update updateWithoutOldTuple() {
        return new Change.Update(USERS_RELATION_ID, "public", "users", null, tuple("id", "1", "name", null));
    }

    public static Change.Delete deleteAlice() {
        return new Change.Delete(USERS_RELATION_ID, "public", "users", tuple("id", "1", "name", null));
    }

    /**
     * Build an ordered tuple from alternating column names and values.
     */
    public static Map<String, String> tuple(String... namesAndValues) {
        Map<String, String> tuple = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            tuple.put(namesAndValues[i], namesAndValues[i + 1]);
        }
        return tuple;
    }
}
