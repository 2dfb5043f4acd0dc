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

import io.github.esdoc.event.RecordedEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Registration of a projection: how events create, update and delete a document of one type.
 *
 * <p>A single-stream projection keeps one document per stream, keyed by the stream id. A multi-stream projection
 * declares for every event type which document the event belongs to, so that events of many streams can fold into
 * one document.</p>
 * <pre>
 * Projection.singleStream(AccountBalance.class)
 *         .createOn(AccountOpened.class, e -&gt; AccountBalance.of(e))
 *         .applyOn(MoneyDeposited.class, (view, e) -&gt; view.withBalance(view.getBalance().add(e.getAmount())))
 *         .build();
 * </pre>
 * Event types with no rule are ignored by the projection.
 *
 * @param <D> document type
 */
public final class Projection<D> {
    private final String name;
    private final Class<D> documentClass;
    private final boolean multiStream;
    private final Map<Class<?>, Function<RecordedEvent<?>, String>> identities;
    private final Map<Class<?>, Function<RecordedEvent<?>, D>> creators;
    private final Map<Class<?>, BiFunction<D, RecordedEvent<?>, D>> updaters;
    private final Set<Class<?>> deleters;

    private Projection(Builder<D> b) {
        this.name = b.name;
        this.documentClass = b.documentClass;
        this.multiStream = b.multiStream;
        this.identities = Collections.unmodifiableMap(new LinkedHashMap<>(b.identities));
        this.creators = Collections.unmodifiableMap(new LinkedHashMap<>(b.creators));
        this.updaters = Collections.unmodifiableMap(new LinkedHashMap<>(b.updaters));
        this.deleters = Collections.unmodifiableSet(new LinkedHashSet<>(b.deleters));
    }

    /**
     * Projection with one document per stream, the document id is the stream id.
     * @param documentClass the document type
     * @param <D> the document type
     * @return builder
     */
    public static <D> Builder<D> singleStream(Class<D> documentClass) {
        return new Builder<>(documentClass, false);
    }

    /**
     * Projection whose documents are identified from the events. Every event class the projection handles needs an
     * {@linkplain Builder#identity(Class, Function) identity rule}.
     * @param documentClass the document type
     * @param <D> the document type
     * @return builder
     */
    public static <D> Builder<D> multiStream(Class<D> documentClass) {
        return new Builder<>(documentClass, true);
    }

    public String getName() {
        return name;
    }

    public Class<D> getDocumentClass() {
        return documentClass;
    }

    public boolean isMultiStream() {
        return multiStream;
    }

    /**
     * Every event class this projection has a rule for.
     * @return the classes
     */
    public Set<Class<?>> handledEventClasses() {
        Set<Class<?>> result = new LinkedHashSet<>();
        result.addAll(creators.keySet());
        result.addAll(updaters.keySet());
        result.addAll(deleters);
        return result;
    }

    Function<RecordedEvent<?>, D> creator(Class<?> eventClass) {
        return creators.get(eventClass);
    }

    BiFunction<D, RecordedEvent<?>, D> updater(Class<?> eventClass) {
        return updaters.get(eventClass);
    }

    boolean deletes(Class<?> eventClass) {
        return deleters.contains(eventClass);
    }

    /**
     * Determine the document an event belongs to.
     * @param eventClass registered class of the event
     * @param event the event
     * @return the document id, null when the event does not concern any document of this projection
     */
    String documentId(Class<?> eventClass, RecordedEvent<?> event) {
        if (!multiStream) {
            return event.getStreamId();
        }
        Function<RecordedEvent<?>, String> identity = identities.get(eventClass);
        return identity == null ? null : identity.apply(event);
    }

    @Override
    public String toString() {
        return "Projection{" + name + '}';
    }

    public static class Builder<D> {
        private final Class<D> documentClass;
        private final boolean multiStream;
        private String name;
        private final Map<Class<?>, Function<RecordedEvent<?>, String>> identities = new LinkedHashMap<>();
        private final Map<Class<?>, Function<RecordedEvent<?>, D>> creators = new LinkedHashMap<>();
        private final Map<Class<?>, BiFunction<D, RecordedEvent<?>, D>> updaters = new LinkedHashMap<>();
        private final Set<Class<?>> deleters = new LinkedHashSet<>();

        Builder(Class<D> documentClass, boolean multiStream) {
            this.documentClass = Objects.requireNonNull(documentClass, "Document class cannot be null");
            this.multiStream = multiStream;
            this.name = documentClass.getSimpleName() + "Projection";
        }

        public Builder<D> name(String name) {
            this.name = Objects.requireNonNull(name);
            return this;
        }

        /**
         * Create the document when this event arrives and the document does not exist yet.
         * @param eventClass the event class
         * @param creator the creation rule
         * @param <E> the event class
         * @return this
         */
        public <E> Builder<D> createOn(Class<E> eventClass, Function<? super E, ? extends D> creator) {
            Objects.requireNonNull(creator, "Creator cannot be null");
            return createOnRecorded(eventClass, recorded -> creator.apply(recorded.getData()));
        }

        /**
         * Same as {@link #createOn(Class, Function)}, with access to stream id, version and timestamp of the event.
         * @param eventClass the event class
         * @param creator the creation rule
         * @param <E> the event class
         * @return this
         */
        public <E> Builder<D> createOnRecorded(Class<E> eventClass,
                Function<? super RecordedEvent<E>, ? extends D> creator) {
            Objects.requireNonNull(creator, "Creator cannot be null");
            checkNew(creators, eventClass);
            creators.put(eventClass, recorded -> creator.apply(recorded.as(eventClass)));
            return this;
        }

        /**
         * Update an existing document when this event arrives. The rule returns the new value of the document, which
         * may be the same instance.
         * @param eventClass the event class
         * @param updater the update rule
         * @param <E> the event class
         * @return this
         */
        public <E> Builder<D> applyOn(Class<E> eventClass, BiFunction<D, ? super E, ? extends D> updater) {
            Objects.requireNonNull(updater, "Updater cannot be null");
            return applyOnRecorded(eventClass, (view, recorded) -> updater.apply(view, recorded.getData()));
        }

        public <E> Builder<D> applyOnRecorded(Class<E> eventClass,
                BiFunction<D, ? super RecordedEvent<E>, ? extends D> updater) {
            Objects.requireNonNull(updater, "Updater cannot be null");
            checkNew(updaters, eventClass);
            updaters.put(eventClass, (view, recorded) -> updater.apply(view, recorded.as(eventClass)));
            return this;
        }

        /**
         * Delete the document when this event arrives.
         * @param eventClass the event class
         * @return this
         */
        public Builder<D> deleteOn(Class<?> eventClass) {
            if (!deleters.add(Objects.requireNonNull(eventClass))) {
                throw new IllegalArgumentException("Delete rule for " + eventClass.getName() + " already defined");
            }
            return this;
        }

        /**
         * Identity rule of a multi-stream projection.
         * @param eventClass the event class
         * @param identity function returning id of the document the event belongs to
         * @param <E> the event class
         * @return this
         */
        public <E> Builder<D> identity(Class<E> eventClass, Function<? super E, String> identity) {
            if (!multiStream) {
                throw new IllegalStateException("Single stream projection " + name + " is keyed by stream id");
            }
            Objects.requireNonNull(identity, "Identity cannot be null");
            checkNew(identities, eventClass);
            identities.put(eventClass, recorded -> identity.apply(recorded.as(eventClass).getData()));
            return this;
        }

        public Projection<D> build() {
            if (creators.isEmpty()) {
                throw new IllegalStateException("Projection " + name + " has no creation rule");
            }
            if (multiStream) {
                Set<Class<?>> handled = new LinkedHashSet<>(creators.keySet());
                handled.addAll(updaters.keySet());
                handled.addAll(deleters);
                handled.removeAll(identities.keySet());
                if (!handled.isEmpty()) {
                    throw new IllegalStateException("Projection " + name + " has no identity rule for " + handled);
                }
            }
            return new Projection<>(this);
        }

        private void checkNew(Map<Class<?>, ?> rules, Class<?> eventClass) {
            if (rules.containsKey(Objects.requireNonNull(eventClass, "Event class cannot be null"))) {
                throw new IllegalArgumentException("Rule for " + eventClass.getName() + " already defined in "
                        + name);
            }
        }
    }
}
