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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Applies inline projections to appended events.
 *
 * <p>The projections are resolved against registered event types when the engine is created, so dispatch of an event
 * is a single lookup by its type name. For a batch of events the engine keeps the touched documents in memory, applies
 * the events strictly in the order given, and writes every changed document once at the end through the
 * {@link DocumentSession} of the append transaction. A document that existed is replaced only if it still carries
 * the version token it was loaded with, a new one is inserted only if nobody created it meanwhile.</p>
 *
 * <p>Any exception thrown by a projection rule is reported as {@link StoreException.Fault#PROJECTION_FAILED}, which
 * makes the event store roll back the whole append.</p>
 */
public class ProjectionEngine {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionEngine.class);

    private final List<Projection<?>> projections;
    private final Map<String, List<Binding<?>>> bindings;

    /**
     * Resolve projections against event types.
     * @param projections registered projections
     * @param eventTypes registered event types
     * @throws IllegalStateException if a projection handles event class that is not registered
     */
    public ProjectionEngine(Collection<? extends Projection<?>> projections, EventTypes eventTypes) {
        this.projections = Collections.unmodifiableList(new ArrayList<>(projections));
        Map<String, List<Binding<?>>> resolved = new HashMap<>();
        for (Projection<?> projection : this.projections) {
            for (Class<?> eventClass : projection.handledEventClasses()) {
                String type = eventTypes.nameOf(eventClass).orElseThrow(() -> new IllegalStateException(
                    "Projection " + projection.getName() + " handles unregistered event class "
                            + eventClass.getName()));
                resolved.computeIfAbsent(type, t -> new ArrayList<>()).add(new Binding<>(projection, eventClass));
            }
        }
        this.bindings = resolved;
    }

    public List<Projection<?>> getProjections() {
        return projections;
    }

    public boolean isEmpty() {
        return projections.isEmpty();
    }

    /**
     * Engine that only runs projections maintaining given document class.
     * @param documentClass document class
     * @param eventTypes registered event types
     * @return restricted engine
     */
    public ProjectionEngine restrictedTo(Class<?> documentClass, EventTypes eventTypes) {
        List<Projection<?>> selected = new ArrayList<>();
        for (Projection<?> projection : projections) {
            if (projection.getDocumentClass().equals(documentClass)) {
                selected.add(projection);
            }
        }
        return new ProjectionEngine(selected, eventTypes);
    }

    /**
     * Apply events to all interested projections and write resulting documents.
     * @param events events in order they were appended
     * @param session document session of the current transaction
     * @throws StoreException when a projection fails or documents cannot be written
     */
    public void apply(List<? extends RecordedEvent<?>> events, DocumentSession session) throws StoreException {
        if (bindings.isEmpty() || events.isEmpty()) {
            return;
        }
        Map<DocumentKey, WorkingDocument> working = new LinkedHashMap<>();
        for (RecordedEvent<?> event : events) {
            List<Binding<?>> interested = bindings.get(event.getType());
            if (interested == null) {
                continue;
            }
            for (Binding<?> binding : interested) {
                process(binding, event, working, session);
            }
        }
        for (WorkingDocument document : working.values()) {
            document.flush(session);
        }
    }

    private <D> void process(Binding<D> binding, RecordedEvent<?> event, Map<DocumentKey, WorkingDocument> working,
            DocumentSession session) throws StoreException {
        Projection<D> projection = binding.projection;
        Class<?> eventClass = binding.eventClass;
        String id;
        try {
            id = projection.documentId(eventClass, event);
        } catch (RuntimeException e) {
            throw StoreException.projectionFailed(projection.getName(), event.getStreamId(), event.getVersion(), e);
        }
        if (id == null) {
            return;
        }
        DocumentKey key = new DocumentKey(projection.getDocumentClass(), id);
        WorkingDocument document = working.get(key);
        if (document == null) {
            document = new WorkingDocument(projection.getDocumentClass(), id,
                    session.load(projection.getDocumentClass(), id).orElse(null));
            working.put(key, document);
        }
        D current = projection.getDocumentClass().cast(document.value);
        try {
            if (projection.deletes(eventClass)) {
                document.delete();
            } else if (current == null) {
                Function<RecordedEvent<?>, D> creator = projection.creator(eventClass);
                if (creator != null) {
                    document.replace(requireResult(creator.apply(event), projection, event));
                }
            } else {
                BiFunction<D, RecordedEvent<?>, D> updater = projection.updater(eventClass);
                if (updater != null) {
                    document.replace(requireResult(updater.apply(current, event), projection, event));
                }
            }
        } catch (RuntimeException e) {
            throw StoreException.projectionFailed(projection.getName(), event.getStreamId(), event.getVersion(), e);
        }
    }

    private static <D> D requireResult(D result, Projection<D> projection, RecordedEvent<?> event) {
        if (result == null) {
            throw new IllegalStateException("Rule of " + projection.getName() + " returned no document for "
                    + event.getType());
        }
        return result;
    }

    private static final class Binding<D> {
        private final Projection<D> projection;
        private final Class<?> eventClass;

        Binding(Projection<D> projection, Class<?> eventClass) {
            this.projection = projection;
            this.eventClass = eventClass;
        }
    }

    private static final class DocumentKey {
        private final Class<?> documentClass;
        private final String id;

        DocumentKey(Class<?> documentClass, String id) {
            this.documentClass = documentClass;
            this.id = id;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof DocumentKey))
                return false;
            DocumentKey that = (DocumentKey) o;
            return documentClass.equals(that.documentClass) && id.equals(that.id);
        }

        @Override
        public int hashCode() {
            return Objects.hash(documentClass, id);
        }
    }

    /**
     * Document state during one batch. Writes are conditional on the version token seen at load, so a concurrent
     * append that projected into the same document makes this one fail with a concurrency conflict.
     */
    private static final class WorkingDocument {
        private final Class<?> documentClass;
        private final String id;
        private final String loadedToken;
        private Object value;
        private boolean changed;

        WorkingDocument(Class<?> documentClass, String id, Document<?> loaded) {
            this.documentClass = documentClass;
            this.id = id;
            this.loadedToken = loaded == null ? null : loaded.getVersionToken();
            this.value = loaded == null ? null : loaded.getValue();
        }

        void replace(Object newValue) {
            this.value = newValue;
            this.changed = true;
        }

        void delete() {
            if (value != null) {
                this.value = null;
                this.changed = true;
            }
        }

        void flush(DocumentSession session) throws StoreException {
            if (!changed) {
                return;
            }
            if (value == null) {
                if (loadedToken != null) {
                    session.delete(documentClass, id, loadedToken);
                    logger.debug("Projection deleted {} {}", documentClass.getSimpleName(), id);
                }
            } else {
                write(session, documentClass);
                logger.debug("Projected {} {}", documentClass.getSimpleName(), id);
            }
        }

        private <D> void write(DocumentSession session, Class<D> type) throws StoreException {
            D document = type.cast(value);
            if (loadedToken == null) {
                session.insert(type, id, document);
            } else {
                session.replace(type, id, document, loadedToken);
            }
        }
    }
}
