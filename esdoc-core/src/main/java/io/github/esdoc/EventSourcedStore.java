package io.github.esdoc;

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

import io.github.esdoc.aggregate.AggregateRebuilder;
import io.github.esdoc.document.DocumentStore;
import io.github.esdoc.event.EventLog;
import io.github.esdoc.event.EventStore;
import io.github.esdoc.event.StreamRegistry;
import io.github.esdoc.projection.ProjectionEngine;
import io.github.esdoc.store.StoreException;
import io.github.esdoc.store.jackson.JacksonEventSerialization;
import io.github.esdoc.store.jdbc.DatabaseCleaner;
import io.github.esdoc.store.jdbc.JdbcDocumentStore;
import io.github.esdoc.store.jdbc.JdbcEventLog;
import io.github.esdoc.store.jdbc.JdbcEventStore;
import io.github.esdoc.store.jdbc.SchemaManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-lived handle to the event log, document store and projections sharing one database. Create it once at start
 * and pass it to the code that needs it; all its components are thread safe.
 *
 * <p>The handle does not own the {@link javax.sql.DataSource}, closing it only marks the handle as closed.</p>
 */
public class EventSourcedStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventSourcedStore.class);

    private final StoreOptions options;
    private final SchemaManager schemaManager;
    private final JdbcEventLog eventLog;
    private final JdbcDocumentStore documents;
    private final JdbcEventStore events;
    private final ProjectionEngine projections;
    private final AggregateRebuilder aggregates;
    private final DatabaseCleaner cleaner;
    private volatile boolean closed;

    protected EventSourcedStore(StoreOptions options) {
        this.options = options;
        JacksonEventSerialization serialization = new JacksonEventSerialization(options.getObjectMapper(),
                options.getEventTypes());
        this.schemaManager = new SchemaManager(options.getDataSource(), options.getSchema());
        this.eventLog = new JdbcEventLog(options.getDataSource(), options.getSchema(), serialization,
                options.isStrictReads());
        this.documents = new JdbcDocumentStore(options.getDataSource(), options.getSchema(),
                options.getDocumentMappings(), options.getObjectMapper(), options.getTxHandler());
        this.projections = new ProjectionEngine(options.getProjections(), options.getEventTypes());
        this.events = new JdbcEventStore(options.getDataSource(), options.getSchema(), serialization, eventLog,
                documents, projections, options.getEventTypes(), options.getTxHandler());
        this.aggregates = new AggregateRebuilder(eventLog, options.getEventTypes());
        this.cleaner = new DatabaseCleaner(options.getDataSource(), options.getSchema(), schemaManager, documents,
                options.getTxHandler());
    }

    /**
     * Create the store and apply configured schema changes.
     * @param options the options
     * @return the store
     * @throws StoreException when schema cannot be inspected or changed
     * @throws IllegalStateException when a projection refers to unregistered event class
     */
    public static EventSourcedStore create(StoreOptions options) throws StoreException {
        EventSourcedStore store = new EventSourcedStore(options);
        store.schemaManager.apply(options.getAutoCreate());
        logger.info("Event sourced store started with {} event types, {} document types and {} projections",
            options.getEventTypes().names().size(), options.getDocumentMappings().all().size(),
            options.getProjections().size());
        return store;
    }

    public EventStore events() {
        checkOpen();
        return events;
    }

    public EventLog eventLog() {
        checkOpen();
        return eventLog;
    }

    public StreamRegistry streams() {
        checkOpen();
        return eventLog;
    }

    public DocumentStore documents() {
        checkOpen();
        return documents;
    }

    public AggregateRebuilder aggregates() {
        checkOpen();
        return aggregates;
    }

    public ProjectionEngine projections() {
        checkOpen();
        return projections;
    }

    public DatabaseCleaner cleaner() {
        checkOpen();
        return cleaner;
    }

    public SchemaManager schema() {
        checkOpen();
        return schemaManager;
    }

    public StoreOptions options() {
        return options;
    }

    /**
     * Rebuild documents of a projection from the whole event log.
     * @param documentClass document class maintained by the projection
     * @return number of replayed events
     * @throws StoreException when replay fails
     */
    public long rebuildProjection(Class<?> documentClass) throws StoreException {
        checkOpen();
        return events.rebuildProjection(documentClass);
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Store is closed");
        }
    }

    @Override
    public void close() {
        closed = true;
        logger.info("Event sourced store closed");
    }
}
