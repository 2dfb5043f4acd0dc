package io.github.esdoc.event;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of event classes and their type names. Every class that is appended to a stream must be registered, the
 * type name is what is stored in the event log and what projections and aggregators dispatch on.
 *
 * <p>A registered class also covers its implementations, so registering an abstract value type makes its generated
 * implementation class known as well.</p>
 */
public class EventTypes {
    private final Map<String, Class<?>> classesByName = new LinkedHashMap<>();
    private final Map<Class<?>, Optional<String>> namesByClass = new ConcurrentHashMap<>();

    /**
     * Register event class under its {@linkplain EventType#defaultTypeName(Class) default name}.
     * @param eventClass the class
     * @return this
     */
    public EventTypes register(Class<?> eventClass) {
        return register(EventType.defaultTypeName(eventClass), eventClass);
    }

    public synchronized EventTypes register(String typeName, Class<?> eventClass) {
        Objects.requireNonNull(typeName, "Type name cannot be null");
        Objects.requireNonNull(eventClass, "Event class cannot be null");
        Class<?> existing = classesByName.get(typeName);
        if (existing != null && !existing.equals(eventClass)) {
            throw new IllegalArgumentException("Event type " + typeName + " is already registered for "
                    + existing.getName());
        }
        classesByName.put(typeName, eventClass);
        namesByClass.clear();
        return this;
    }

    /**
     * Find the type name for given class, either registered directly, or through one of its supertypes.
     * @param eventClass class of an event instance
     * @return the type name, or empty if class is not registered
     */
    public Optional<String> nameOf(Class<?> eventClass) {
        Optional<String> name = namesByClass.get(eventClass);
        if (name == null) {
            name = lookupName(eventClass);
            namesByClass.put(eventClass, name);
        }
        return name;
    }

    public synchronized Optional<Class<?>> classOf(String typeName) {
        return Optional.ofNullable(classesByName.get(typeName));
    }

    public synchronized Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(classesByName.keySet()));
    }

    private synchronized Optional<String> lookupName(Class<?> eventClass) {
        for (Map.Entry<String, Class<?>> entry : classesByName.entrySet()) {
            if (entry.getValue().equals(eventClass)) {
                return Optional.of(entry.getKey());
            }
        }
        for (Map.Entry<String, Class<?>> entry : classesByName.entrySet()) {
            if (entry.getValue().isAssignableFrom(eventClass)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }
}
