package io.github.esdoc.store.jdbc;

/*-
 * #%L
 * esdoc
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.esdoc.store.AutoCreate;
import io.github.esdoc.store.StoreException;
import org.junit.After;
import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;


public class SchemaManagerTest extends JdbcTest {
    private SchemaManager manager;

    private SchemaManager manager(String prefix) {
        manager = new SchemaManager(ds, new DefaultJdbcSchema(prefix));
        return manager;
    }

    @After
    public void dropTables() throws StoreException {
        if (manager != null) {
            manager.dropAll();
        }
    }

    private void assertColumns(int expected, String table) {
        assertDb(expected, "select count(*) from information_schema.columns where upper(table_name) = upper(?)",
            table);
    }

    @Test
    public void none_leaves_database_untouched() throws StoreException {
        manager("none_").apply(AutoCreate.NONE);
        assertThat(manager.missingTables(), containsInAnyOrder("none_streams", "none_events", "none_documents",
            "none_document_index"));
    }

    @Test
    public void create_only_creates_missing_tables() throws StoreException {
        manager("co_").apply(AutoCreate.CREATE_ONLY);
        assertThat(manager.missingTables(), empty());
        assertColumns(7, "co_events");
    }

    @Test
    public void create_only_keeps_existing_tables() throws StoreException {
        template.execute("create table keep_streams (STREAM_ID varchar(250) primary key, VERSION bigint)");
        manager("keep_").apply(AutoCreate.CREATE_ONLY);
        assertColumns(2, "keep_streams");
    }

    @Test
    public void create_or_update_adds_missing_columns() throws StoreException {
        template.execute("create table cu_streams (STREAM_ID varchar(250) primary key, VERSION bigint)");
        template.update("insert into cu_streams (STREAM_ID, VERSION) values ('s', 3)");
        manager("cu_").apply(AutoCreate.CREATE_OR_UPDATE);
        assertColumns(5, "cu_streams");
        assertDb(3, "select version from cu_streams where stream_id = 's'");
    }

    @Test
    public void all_recreates_tables_of_different_shape() throws StoreException {
        template.execute("create table all_streams (STREAM_ID varchar(250) primary key, VERSION bigint, "
                + "LEGACY varchar(10))");
        template.update("insert into all_streams (STREAM_ID, VERSION) values ('s', 3)");
        manager("all_").apply(AutoCreate.ALL);
        assertColumns(5, "all_streams");
        assertDb(0, "select count(*) from all_streams");
    }

    @Test
    public void applying_twice_changes_nothing() throws StoreException {
        manager("twice_").apply(AutoCreate.ALL);
        template.update("insert into twice_streams (STREAM_ID, VERSION, CREATED_AT, UPDATED_AT) "
                + "values ('s', 1, current_timestamp, current_timestamp)");
        manager.apply(AutoCreate.ALL);
        assertDb(1, "select count(*) from twice_streams");
    }

    @Test
    public void drop_all_removes_tables() throws StoreException {
        manager("drop_").apply(AutoCreate.CREATE_ONLY);
        manager.dropAll();
        assertEquals(4, manager.missingTables().size());
    }

    @Test
    public void cleaner_recreates_schema() throws StoreException {
        store.events().startStream(name(), "Counter", new TestEvents.Created(name()));
        store.cleaner().completelyRemoveAll();
        assertEquals(Arrays.asList("es_streams", "es_events", "es_documents", "es_document_index"),
            store.schema().missingTables());
        store.cleaner().applyAllConfiguredChanges();
        assertThat(store.schema().missingTables(), empty());
        assertDb(0, "select count(*) from es_events");
    }
}
