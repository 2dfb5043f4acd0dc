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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Describes how a document class is stored: under which type tag, how to obtain its identity and which of its fields
 * are indexed for querying.
 * <pre>
 * DocumentMapping.builder(User.class, User::getId)
 *         .index("email", IndexedField.Kind.TEXT, User::getEmail)
 *         .build();
 * </pre>
 *
 * @param <T> the document class
 */
public final class DocumentMapping<T> {
    private final Class<T> documentClass;
    private final String typeName;
    private final Function<? super T, String> identity;
    private final Map<String, IndexedField<T>> indexes;

    private DocumentMapping(Builder<T> b) {
        this.documentClass = b.documentClass;
        this.typeName = b.typeName;
        this.identity = b.identity;
        this.indexes = Collections.unmodifiableMap(new LinkedHashMap<>(b.indexes));
    }

    public static <T> Builder<T> builder(Class<T> documentClass, Function<? super T, String> identity) {
        return new Builder<>(documentClass, identity);
    }

    public Class<T> getDocumentClass() {
        return documentClass;
    }

    /**
     * Type tag stored with every document of this class.
     * @return the tag
     */
    public String getTypeName() {
        return typeName;
    }

    public String idOf(T document) {
        String id = identity.apply(document);
        if (id == null) {
            throw new IllegalArgumentException("Document of type " + typeName + " has no identity: " + document);
        }
        return id;
    }

    public Collection<IndexedField<T>> getIndexes() {
        return indexes.values();
    }

    public Optional<IndexedField<T>> index(String fieldName) {
        return Optional.ofNullable(indexes.get(fieldName));
    }

    /**
     * Look up an indexed field that a filter or sort refers to.
     * @param fieldName name of the field
     * @return the field
     * @throws IllegalArgumentException if the field is not indexed
     */
    public IndexedField<T> requireIndex(String fieldName) {
        return index(fieldName).orElseThrow(() -> new IllegalArgumentException("Field " + fieldName
                + " is not indexed for documents of type " + typeName));
    }

    public T cast(Object document) {
        return documentClass.cast(document);
    }

    @Override
    public String toString() {
        return "DocumentMapping{" + typeName + ", indexes=" + indexes.keySet() + '}';
    }

    public static class Builder<T> {
        private final Class<T> documentClass;
        private final Function<? super T, String> identity;
        private String typeName;
        private final Map<String, IndexedField<T>> indexes = new LinkedHashMap<>();

        Builder(Class<T> documentClass, Function<? super T, String> identity) {
            this.documentClass = Objects.requireNonNull(documentClass, "Document class cannot be null");
            this.identity = Objects.requireNonNull(identity, "Identity cannot be null");
            this.typeName = documentClass.getSimpleName();
        }

        public Builder<T> typeName(String typeName) {
            this.typeName = Objects.requireNonNull(typeName);
            return this;
        }

        public Builder<T> index(String fieldName, IndexedField.Kind kind, Function<? super T, ?> accessor) {
            if (indexes.containsKey(fieldName)) {
                throw new IllegalArgumentException("Field " + fieldName + " is already indexed");
            }
            indexes.put(fieldName, new IndexedField<>(fieldName, kind, accessor));
            return this;
        }

        public DocumentMapping<T> build() {
            return new DocumentMapping<>(this);
        }
    }
}
