/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.connector.postgresql.connection;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import io.pgrelay.data.Column;

public class RelationCatalogTest {

    private static final List<Column> COLUMNS = Arrays.asList(new Column("id", 23L, 1), new Column("name", 25L, 0));

    @Test
    public void shouldReturnStoredDefinition() {
        RelationCatalog catalog = new RelationCatalog();
        catalog.put(100L, "public", "users", COLUMNS);

        RelationDefinition definition = catalog.get(100L).get();
        assertThat(definition.schema()).isEqualTo("public");
        assertThat(definition.table()).isEqualTo("users");
        assertThat(definition.columns()).isEqualTo(COLUMNS);
        assertThat(definition.columnName(1)).isEqualTo("name");
        assertThat(definition.columnName(2)).isEqualTo("column_2");
    }

    @Test
    public void shouldReturnEmptyForUnknownRelation() {
        assertThat(new RelationCatalog().get(1L)).isEmpty();
    }

    @Test
    public void shouldReplaceDefinitionOnUpsert() {
        RelationCatalog catalog = new RelationCatalog();
        catalog.put(100L, "public", "users", COLUMNS);
        catalog.put(100L, "public", "people", Arrays.asList(new Column("id", 20L, 1)));

        assertThat(catalog.size()).isEqualTo(1);
        assertThat(catalog.get(100L).get().table()).isEqualTo("people");
    }

    @Test
    public void shouldKeepCatalogsIndependent() {
        RelationCatalog first = new RelationCatalog();
        RelationCatalog second = new RelationCatalog();
        first.put(1L, "s", "t", COLUMNS);
        assertThat(second.get(1L)).isEmpty();
    }

    @Test
    public void shouldAlwaysExposeCompleteDefinitionsToConcurrentReaders() throws Exception {
        RelationCatalog catalog = new RelationCatalog();
        List<Column> one = Arrays.asList(new Column("a", 23L, 1));
        List<Column> three = Arrays.asList(new Column("a", 23L, 1), new Column("b", 25L, 0), new Column("c", 25L, 0));
        catalog.put(1L, "s", "t", one);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> writer = executor.submit(() -> {
                start.await();
                for (int i = 0; i < 10_000; i++) {
                    catalog.put(1L, "s", "t", i % 2 == 0 ? three : one);
                }
                return null;
            });
            Future<Boolean> reader = executor.submit(() -> {
                start.await();
                for (int i = 0; i < 10_000; i++) {
                    int size = catalog.get(1L).get().columns().size();
                    if (size != 1 && size != 3) {
                        return false;
                    }
                }
                return true;
            });
            start.countDown();
            writer.get(30, TimeUnit.SECONDS);
            assertThat(reader.get(30, TimeUnit.SECONDS)).isTrue();
        }
        finally {
            executor.shutdownNow();
        }
    }
}
