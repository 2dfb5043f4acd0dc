package io.github.esdoc.document;

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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered document mappings. A mapping registered for a class also applies to its subclasses, so mapping an
 * abstract value type covers its generated implementation.
 */
public class DocumentMappings {
    private final Map<Class<?>, DocumentMapping<?>> byClass = new LinkedHashMap<>();
    private final Map<Class<?>, Optional<DocumentMapping<?>>> resolved = new ConcurrentHashMap<>();

    public synchronized DocumentMappings register(DocumentMapping<?> mapping) {
        for (DocumentMapping<?> existing : byClass.values()) {
            if (existing.getTypeName().equals(mapping.getTypeName())
                    && !existing.getDocumentClass().equals(mapping.getDocumentClass())) {
                throw new IllegalArgumentException("Document type " + mapping.getTypeName()
                        + " is already mapped to " + existing.getDocumentClass().getName());
            }
        }
        byClass.put(mapping.getDocumentClass(), mapping);
        resolved.clear();
        return this;
    }

    /**
     * Find mapping for a class, or the closest of its supertypes.
     * @param documentClass class of the document
     * @param <T> type of the document
     * @return the mapping, or empty if class is not mapped
     */
    public <T> Optional<DocumentMapping<? super T>> mappingFor(Class<T> documentClass) {
        Optional<DocumentMapping<?>> mapping = resolved.get(documentClass);
        if (mapping == null) {
            mapping = lookup(documentClass);
            resolved.put(documentClass, mapping);
        }
        return mapping.map(m -> (DocumentMapping<? super T>) m);
    }

    public synchronized Collection<DocumentMapping<?>> all() {
        return Collections.unmodifiableList(new ArrayList<>(byClass.values()));
    }

    private synchronized Optional<DocumentMapping<?>> lookup(Class<?> documentClass) {
        DocumentMapping<?> direct = byClass.get(documentClass);
        if (direct != null) {
            return Optional.of(direct);
        }
        List<DocumentMapping<?>> candidates = new ArrayList<>();
        for (DocumentMapping<?> mapping : byClass.values()) {
            if (mapping.getDocumentClass().isAssignableFrom(documentClass)) {
                candidates.add(mapping);
            }
        }
        DocumentMapping<?> closest = null;
        for (DocumentMapping<?> candidate : candidates) {
            if (closest == null || closest.getDocumentClass().isAssignableFrom(candidate.getDocumentClass())) {
                closest = candidate;
            }
        }
        return Optional.ofNullable(closest);
    }
}
