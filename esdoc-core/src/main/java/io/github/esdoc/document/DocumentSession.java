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

import io.github.esdoc.store.StoreException;

import java.util.Optional;

/**
 * Document operations bound to an open transaction. Inline projections write through a session that belongs to the
 * append transaction, so their documents are committed or rolled back together with the events.
 */
public interface DocumentSession {

    <T> Optional<Document<T>> load(Class<T> documentClass, String id) throws StoreException;

    /**
     * Store a document that must not exist yet.
     * @param documentClass type of the document
     * @param id identity to store the document under
     * @param document the document
     * @param <T> type of the document
     * @return new version token
     * @throws StoreException with fault {@link StoreException.Fault#CONCURRENCY_CONFLICT} when a document with the
     *     same id was stored meanwhile
     */
    <T> String insert(Class<T> documentClass, String id, T document) throws StoreException;

    /**
     * Replace a document only when it is still at the version that was loaded.
     * @param documentClass type of the document
     * @param id identity of the document
     * @param document new content
     * @param expectedToken version token obtained by {@link #load(Class, String)}
     * @param <T> type of the document
     * @return new version token
     * @throws StoreException with fault {@link StoreException.Fault#CONCURRENCY_CONFLICT} when the document changed
     *     or disappeared since it was loaded
     */
    <T> String replace(Class<T> documentClass, String id, T document, String expectedToken) throws StoreException;

    void delete(Class<?> documentClass, String id, String expectedToken) throws StoreException;
}
