package io.github.esdoc.projection;

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

import io.github.esdoc.document.Document;
import io.github.esdoc.document.Filter;
import io.github.esdoc.event.ExpectedVersion;
import io.github.esdoc.store.StoreException;
import io.github.esdoc.store.jdbc.Counter;
import io.github.esdoc.store.jdbc.JdbcTest;
import io.github.esdoc.store.jdbc.TagCount;
import io.github.esdoc.store.jdbc.TestEvents;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;


public class InlineProjectionTest extends JdbcTest {

    Counter counter(String id) throws StoreException {
        return store.documents().load(Counter.class, id).get().getValue();
    }

    @Test
    public void projection_reflects_every_append() throws StoreException {
        store.events().startStream(name(), "Counter", new TestEvents.Created("first"));
        assertEquals(new Counter(name(), "first", 0, 1), counter(name()));
        store.events().append(name(), ExpectedVersion.exact(1), new TestEvents.Incremented(5),
            new TestEvents.Incremented(3));
        assertEquals(new Counter(name(), "first", 8, 3), counter(name()));
        store.events().append(name(), ExpectedVersion.exact(3), new TestEvents.Renamed("second"));
        assertEquals(new Counter(name(), "second", 8, 4), counter(name()));
    }

    @Test
    public void unhandled_event_leaves_document_untouched() throws StoreException {
        store.events().startStream(name(), "Counter", new TestEvents.Created("first"), new TestEvents.Incremented(2));
        Document<Counter> before = store.documents().load(Counter.class, name()).get();
        store.events().append(name(), ExpectedVersion.exact(2), new TestEvents.Noted("just a note"));
        Document<Counter> after = store.documents().load(Counter.class, name()).get();
        assertEquals(before.getValue(), after.getValue());
        assertEquals(before.getVersionToken(), after.getVersionToken());
    }

    @Test
    public void update_before_creation_is_ignored() throws StoreException {
        store.events().append(name(), ExpectedVersion.any(), new TestEvents.Incremented(2));
        assertFalse(store.documents().load(Counter.class, name()).isPresent());
    }

    @Test
    public void delete_rule_removes_document() throws StoreException {
        store.events().startStream(name(), "Counter", new TestEvents.Created("first"));
        store.events().append(name(), ExpectedVersion.exact(1), new TestEvents.Archived("done"));
        assertFalse(store.documents().load(Counter.class, name()).isPresent());
        assertDb(2, "select count(*) from es_events where stream_id = ?", name());
    }

    @Test
    public void multi_stream_projection_counts_across_streams() throws StoreException {
        store.events().startStream(name() + "-1", "Counter", new TestEvents.Created("one"),
            new TestEvents.Tagged(name()));
        store.events().startStream(name() + "-2", "Counter", new TestEvents.Created("two"),
            new TestEvents.Tagged(name()), new TestEvents.Tagged("other"));
        assertEquals(2, store.documents().load(TagCount.class, name()).get().getValue().getCount());
        assertEquals(1, store.documents().load(TagCount.class, "other").get().getValue().getCount());
    }

    @Test
    public void failing_projection_leaves_documents_unchanged() throws StoreException {
        store.events().startStream(name(), "Counter", new TestEvents.Created("first"));
        String token = store.documents().load(Counter.class, name()).get().getVersionToken();
        try {
            store.events().append(name(), ExpectedVersion.exact(1), new TestEvents.Incremented(1),
                new TestEvents.Tagged(name()), new TestEvents.Renamed(""));
            fail("should have failed");
        } catch (StoreException e) {
            assertEquals(StoreException.Fault.PROJECTION_FAILED, e.getFault());
        }
        assertEquals(token, store.documents().load(Counter.class, name()).get().getVersionToken());
        assertFalse(store.documents().load(TagCount.class, name()).isPresent());
    }

    @Test
    public void rebuild_restores_projection_from_the_log() throws StoreException {
        store.events().startStream(name() + "-1", "Counter", new TestEvents.Created("one"),
            new TestEvents.Incremented(4));
        store.events().startStream(name() + "-2", "Counter", new TestEvents.Created("two"),
            new TestEvents.Archived("gone"));
        Counter expected = counter(name() + "-1");
        template.update("delete from es_documents where doc_type = 'Counter'");

        assertEquals(4, store.rebuildProjection(Counter.class));
        assertEquals(expected, counter(name() + "-1"));
        assertFalse(store.documents().load(Counter.class, name() + "-2").isPresent());
    }

    @Test
    public void rebuild_is_idempotent() throws StoreException {
        store.events().startStream(name(), "Counter", new TestEvents.Created("one"), new TestEvents.Tagged("x"),
            new TestEvents.Incremented(4), new TestEvents.Tagged("x"));
        Counter counter = counter(name());
        int tags = store.documents().load(TagCount.class, "x").get().getValue().getCount();

        store.rebuildProjection(Counter.class);
        store.rebuildProjection(TagCount.class);
        store.rebuildProjection(Counter.class);
        store.rebuildProjection(TagCount.class);

        assertEquals(counter, counter(name()));
        assertEquals(tags, store.documents().load(TagCount.class, "x").get().getValue().getCount());
    }

    @Test
    public void rebuild_of_unprojected_document_fails() throws StoreException {
        try {
            store.rebuildProjection(String.class);
            fail("should have failed");
        } catch (StoreException e) {
            assertEquals(StoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
        }
    }

    @Test
    public void projection_documents_survive_stream_deletion() throws StoreException {
        store.events().startStream(name(), "Counter", new TestEvents.Created("one"), new TestEvents.Incremented(1));
        Counter before = counter(name());
        assertTrue(store.cleaner().deleteStream(name()));
        assertFalse(store.streams().streamState(name()).isPresent());
        assertEquals(before, counter(name()));
        assertNotEquals(0, store.documents().count(Counter.class, Filter.all()));
    }
}
