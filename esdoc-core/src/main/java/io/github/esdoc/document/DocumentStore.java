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

import java.util.List;
import java.util.Optional;

/**
 * Key-addressed storage of current-state documents with optimistic concurrency.
 *
 * <p>Every document class must have a {@link DocumentMapping}. Writes replace the whole document and generate a new
 * version token. A write that presents a version token only succeeds if the stored token still equals it, which is how
 * two writers that read the same version detect each other: exactly one of them wins, the other one gets
 * {@link StoreException.Fault#CONCURRENCY_CONFLICT}. The store never retries such write on its own.</p>
 */
public interface DocumentStore {

    /**
     * Load a document.
     * @param documentClass type of the document
     * @param id identity of the document
     * @param <T> type of the document
     * @return the document, or empty if it was never stored or was deleted
     * @throws StoreException when storage fails, or stored payload cannot be read
     */
    <T> Optional<Document<T>> load(Class<T> documentClass, String id) throws StoreException;

    /**
     * Store a document, overwriting whatever is stored under its id.
     * @param document the document
     * @return new version token
     * @throws StoreException when storage fails
     */
    String store(Object document) throws StoreException;

    /**
     * Store a document only if it was not changed since it was read with given version token.
     * @param document the document
     * @param expectedToken version token obtained when the document was read
     * @return new version token
     * @throws StoreException with {@link StoreException.Fault#CONCURRENCY_CONFLICT} if token does not match, or the
     *                        document no longer exists
     */
    String store(Object document, String expectedToken) throws StoreException;

    /**
     * Store a document that must not exist yet.
     * @param document the document
     * @return version token
     * @throws StoreException with {@link StoreException.Fault#CONCURRENCY_CONFLICT} if document exists
     */
    String insert(Object document) throws StoreException;

    /**
     * Store several documents in a single transaction, overwriting existing ones.
     * @param documents the documents
     * @throws StoreException when storage fails, nothing is stored then
     */
    void storeAll(Iterable<?> documents) throws StoreException;

    /**
     * Delete a document.
     * @param documentClass type of the document
     * @param id identity of the document
     * @return true if document existed
     * @throws StoreException when storage fails
     */
    boolean delete(Class<?> documentClass, String id) throws StoreException;

    /**
     * Bulk delete of documents, meant for maintenance and reset rather than normal lifecycle.
     * @param documentClass type of documents
     * @param filter which documents to delete, {@link Filter#all()} for all of them
     * @return number of deleted documents
     * @throws StoreException when storage fails
     */
    int deleteWhere(Class<?> documentClass, Filter filter) throws StoreException;

    /**
     * Find documents.
     * @param query the query
     * @param <T> type of documents
     * @return matching documents in requested order
     * @throws StoreException when storage fails, or stored payload cannot be read
     */
    <T> List<Document<T>> query(Query<T> query) throws StoreException;

    /**
     * Count documents.
     * @param documentClass type of documents
     * @param filter the filter
     * @return number of matching documents
     * @throws StoreException when storage fails
     */
    long count(Class<?> documentClass, Filter filter) throws StoreException;
}
