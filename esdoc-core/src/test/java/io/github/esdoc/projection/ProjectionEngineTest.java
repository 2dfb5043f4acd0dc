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
import io.github.esdoc.document.DocumentSession;
import io.github.esdoc.event.EventTypes;
import io.github.esdoc.event.RecordedEvent;
import io.github.esdoc.store.StoreException;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;


public class ProjectionEngineTest {
    static class Opened {
        final String owner;

        Opened(String owner) {
            this.owner = owner;
        }
    }

    static class Paid {
        final int amount;
        final String category;

        Paid(int amount, String category) {
            this.amount = amount;
            this.category = category;
        }
    }

    static class Closed {
    }

    static class Summary {
        final String owner;
        final int total;

        Summary(String owner, int total) {
            this.owner = owner;
            this.total = total;
        }
    }

    static class CategoryTotal {
        final int total;

        CategoryTotal(int total) {
            this.total = total;
        }
    }

    /**
     * Session over a map, recording writes.
     */
    static class MapSession implements DocumentSession {
        final Map<String, Document<?>> documents = new HashMap<>();
        final List<String> writes = new ArrayList<>();
        private int tokens;

        @Override
        public <T> Optional<Document<T>> load(Class<T> documentClass, String id) {
            Document<?> found = documents.get(documentClass.getSimpleName() + "/" + id);
            if (found == null) {
                return Optional.empty();
            }
            return Optional.of(new Document<>(found.getType(), id, documentClass.cast(found.getValue()),
                    found.getVersionToken(), found.getLastModified()));
        }

        <T> Optional<T> value(Class<T> documentClass, String id) {
            return load(documentClass, id).map(Document::getValue);
        }

        @Override
        public <T> String insert(Class<T> documentClass, String id, T document) throws StoreException {
            String key = documentClass.getSimpleName() + "/" + id;
            if (documents.containsKey(key)) {
                throw StoreException.documentExists(documentClass.getSimpleName(), id, null);
            }
            writes.add("insert " + key);
            return put(key, documentClass, id, document);
        }

        @Override
        public <T> String replace(Class<T> documentClass, String id, T document, String expectedToken)
                throws StoreException {
            String key = documentClass.getSimpleName() + "/" + id;
            checkToken(key, documentClass, id, expectedToken);
            writes.add("replace " + key);
            return put(key, documentClass, id, document);
        }

        @Override
        public void delete(Class<?> documentClass, String id, String expectedToken) throws StoreException {
            String key = documentClass.getSimpleName() + "/" + id;
            checkToken(key, documentClass, id, expectedToken);
            writes.add("delete " + key);
            documents.remove(key);
        }

        private void checkToken(String key, Class<?> documentClass, String id, String expectedToken)
                throws StoreException {
            Document<?> current = documents.get(key);
            if (current == null || !current.getVersionToken().equals(expectedToken)) {
                throw StoreException.documentConflict(documentClass.getSimpleName(), id, expectedToken);
            }
        }

        private String put(String key, Class<?> documentClass, String id, Object document) {
            String token = "token-" + (++tokens);
            documents.put(key, new Document<>(documentClass.getSimpleName(), id, document, token, Instant.now()));
            return token;
        }
    }

    private EventTypes eventTypes;
    private ProjectionEngine engine;
    private MapSession session;
    private long sequence;

    @Before
    public void setUp() {
        eventTypes = new EventTypes().register(Opened.class).register(Paid.class).register(Closed.class);
        Projection<Summary> summary = Projection.singleStream(Summary.class)
                .createOn(Opened.class, e -> new Summary(e.owner, 0))
                .applyOn(Paid.class, (s, e) -> {
                    if (e.amount < 0) {
                        throw new IllegalArgumentException("Negative payment");
                    }
                    return new Summary(s.owner, s.total + e.amount);
                })
                .deleteOn(Closed.class)
                .build();
        Projection<CategoryTotal> categories = Projection.multiStream(CategoryTotal.class)
                .identity(Paid.class, e -> e.category)
                .createOn(Paid.class, e -> new CategoryTotal(e.amount))
                .applyOn(Paid.class, (c, e) -> new CategoryTotal(c.total + e.amount))
                .build();
        engine = new ProjectionEngine(Arrays.asList(summary, categories), eventTypes);
        session = new MapSession();
    }

    private List<RecordedEvent<?>> events(String streamId, long fromVersion, Object... data) {
        List<RecordedEvent<?>> result = new ArrayList<>();
        long version = fromVersion;
        for (Object event : data) {
            result.add(new RecordedEvent<>(++sequence, streamId, version++,
                    eventTypes.nameOf(event.getClass()).get(), event, Instant.now()));
        }
        return result;
    }

    @Test
    public void creation_and_updates_are_applied_in_order() throws StoreException {
        engine.apply(events("acc-1", 1, new Opened("ann"), new Paid(10, "food"), new Paid(5, "food")), session);
        Summary summary = session.value(Summary.class, "acc-1").get();
        assertEquals("ann", summary.owner);
        assertEquals(15, summary.total);
    }

    @Test
    public void touched_document_is_written_once_per_batch() throws StoreException {
        engine.apply(events("acc-1", 1, new Opened("ann"), new Paid(10, "food"), new Paid(5, "rent")), session);
        assertEquals(Arrays.asList("insert Summary/acc-1", "insert CategoryTotal/food", "insert CategoryTotal/rent"),
            session.writes);
    }

    @Test
    public void update_before_creation_is_ignored() throws StoreException {
        engine.apply(events("acc-1", 1, new Paid(10, "food")), session);
        assertFalse(session.value(Summary.class, "acc-1").isPresent());
        assertEquals(10, session.value(CategoryTotal.class, "food").get().total);
    }

    @Test
    public void multi_stream_projection_folds_events_of_many_streams() throws StoreException {
        engine.apply(events("acc-1", 1, new Opened("ann"), new Paid(10, "food")), session);
        engine.apply(events("acc-2", 1, new Opened("bob"), new Paid(7, "food")), session);
        assertEquals(17, session.value(CategoryTotal.class, "food").get().total);
    }

    @Test
    public void delete_rule_removes_document() throws StoreException {
        engine.apply(events("acc-1", 1, new Opened("ann"), new Paid(10, "food")), session);
        engine.apply(events("acc-1", 3, new Closed()), session);
        assertFalse(session.value(Summary.class, "acc-1").isPresent());
        assertTrue(session.value(CategoryTotal.class, "food").isPresent());
    }

    @Test
    public void document_created_and_deleted_in_one_batch_is_never_written() throws StoreException {
        engine.apply(events("acc-1", 1, new Opened("ann"), new Closed()), session);
        assertEquals(Collections.emptyList(), session.writes);
    }

    @Test
    public void failing_rule_is_reported_as_projection_failure() throws StoreException {
        engine.apply(events("acc-1", 1, new Opened("ann")), session);
        session.writes.clear();
        try {
            engine.apply(events("acc-1", 2, new Paid(5, "food"), new Paid(-1, "food")), session);
            fail("should have failed");
        } catch (StoreException e) {
            assertEquals(StoreException.Fault.PROJECTION_FAILED, e.getFault());
            assertEquals("acc-1", e.getKey());
        }
        assertEquals(Collections.emptyList(), session.writes);
    }

    @Test
    public void unregistered_event_class_is_rejected_at_startup() {
        Projection<Summary> projection = Projection.singleStream(Summary.class)
                .createOn(String.class, s -> new Summary(s, 0))
                .build();
        try {
            new ProjectionEngine(Collections.singletonList(projection), eventTypes);
            fail("should have failed");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    @Test
    public void existing_document_is_replaced_at_loaded_version() throws StoreException {
        engine.apply(events("acc-1", 1, new Opened("ann"), new Paid(10, "food")), session);
        session.writes.clear();
        engine.apply(events("acc-2", 1, new Paid(7, "food")), session);
        assertEquals(Collections.singletonList("replace CategoryTotal/food"), session.writes);
    }

    @Test
    public void document_changed_after_load_is_a_conflict() throws StoreException {
        engine.apply(events("acc-1", 1, new Opened("ann"), new Paid(10, "food")), session);
        MapSession stale = new MapSession() {
            @Override
            public <T> Optional<Document<T>> load(Class<T> documentClass, String id) {
                Optional<Document<T>> loaded = session.load(documentClass, id);
                if (CategoryTotal.class.equals(documentClass)) {
                    // another writer commits between load and write
                    session.documents.put("CategoryTotal/" + id, new Document<>("CategoryTotal", id,
                            new CategoryTotal(99), "other", Instant.now()));
                }
                return loaded;
            }

            @Override
            public <T> String replace(Class<T> documentClass, String id, T document, String expectedToken)
                    throws StoreException {
                return session.replace(documentClass, id, document, expectedToken);
            }
        };
        try {
            engine.apply(events("acc-2", 1, new Paid(7, "food")), stale);
            fail("should have failed");
        } catch (StoreException e) {
            assertEquals(StoreException.Fault.CONCURRENCY_CONFLICT, e.getFault());
        }
        assertEquals(99, session.value(CategoryTotal.class, "food").get().total);
    }

    @Test
    public void restricted_engine_only_runs_selected_projection() throws StoreException {
        ProjectionEngine summaries = engine.restrictedTo(Summary.class, eventTypes);
        summaries.apply(events("acc-1", 1, new Opened("ann"), new Paid(10, "food")), session);
        assertTrue(session.value(Summary.class, "acc-1").isPresent());
        assertFalse(session.value(CategoryTotal.class, "food").isPresent());
    }
}
