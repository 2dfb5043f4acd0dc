package io.github.esdoc.store;

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

/**
 * Exception generated when an operation against the event log or the document store fails.
 *
 * <p>Every instance carries a {@link Fault} and the key of the stream or document involved, so that callers can decide
 * whether to reload and retry, report the problem, or give up.</p>
 */
public class StoreException extends Exception {
    private final Fault fault;
    private final String key;

    public enum Fault {
        /**
         * Expected stream version or document version token did not match the stored one.
         */
        CONCURRENCY_CONFLICT,
        /**
         * Append required an existing stream, but there is none.
         */
        STREAM_NOT_FOUND,
        /**
         * Append required a new stream, but the stream already has events.
         */
        STREAM_ALREADY_EXISTS,
        /**
         * The database could not be reached or failed to execute a statement.
         */
        STORAGE_UNAVAILABLE,
        /**
         * Stored payload cannot be turned into an object, or an object cannot be serialized.
         */
        SERIALIZATION_ERROR,
        /**
         * An inline projection threw while applying an appended event.
         */
        PROJECTION_FAILED,
        /**
         * The call itself was invalid.
         */
        PROGRAMMATIC_ERROR
    }

    protected StoreException(Fault fault, String key, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
        this.key = key;
    }

    public Fault getFault() {
        return fault;
    }

    /**
     * Identity of the stream or document the failure relates to.
     * @return stream id, or document type and id joined by {@code /}
     */
    public String getKey() {
        return key;
    }

    /**
     * Only storage failures require the caller to stop. All other faults leave the store in a usable state.
     * @return false for {@link Fault#STORAGE_UNAVAILABLE}
     */
    public boolean isRecoverable() {
        return fault != Fault.STORAGE_UNAVAILABLE;
    }

    public static String documentKey(String documentType, String id) {
        return documentType + "/" + id;
    }

    public static StoreException streamVersionConflict(String streamId, long expectedVersion, long actualVersion) {
        return new StoreException(Fault.CONCURRENCY_CONFLICT, streamId, "Stream " + streamId + " expected at version "
                + expectedVersion + " but is at version " + actualVersion, null);
    }

    public static StoreException concurrentAppend(String streamId, long startVersion, Throwable cause) {
        return new StoreException(Fault.CONCURRENCY_CONFLICT, streamId, "Stream " + streamId
                + " was modified concurrently after version " + startVersion, cause);
    }

    public static StoreException streamNotFound(String streamId) {
        return new StoreException(Fault.STREAM_NOT_FOUND, streamId, "Stream " + streamId + " does not exist", null);
    }

    public static StoreException streamAlreadyExists(String streamId, long version) {
        return new StoreException(Fault.STREAM_ALREADY_EXISTS, streamId, "Stream " + streamId
                + " already exists at version " + version, null);
    }

    public static StoreException documentConflict(String documentType, String id, String expectedToken) {
        String key = documentKey(documentType, id);
        return new StoreException(Fault.CONCURRENCY_CONFLICT, key, "Document " + key
                + " was changed or removed since version " + expectedToken, null);
    }

    public static StoreException documentExists(String documentType, String id, Throwable cause) {
        String key = documentKey(documentType, id);
        return new StoreException(Fault.CONCURRENCY_CONFLICT, key, "Document " + key + " already exists", cause);
    }

    public static StoreException concurrentModification(String key, Throwable cause) {
        return new StoreException(Fault.CONCURRENCY_CONFLICT, key, key + " was modified concurrently", cause);
    }

    public static StoreException storeFailed(String key, Throwable cause) {
        return new StoreException(Fault.STORAGE_UNAVAILABLE, key, "Store operation on " + key + " failed. "
                + cause.getMessage(), cause);
    }

    public static StoreException undecodable(String key, String detail, Throwable cause) {
        return new StoreException(Fault.SERIALIZATION_ERROR, key, "Cannot deserialize " + key + ": " + detail, cause);
    }

    public static StoreException unencodable(String key, Object value, Throwable cause) {
        return new StoreException(Fault.SERIALIZATION_ERROR, key, "Cannot serialize " + value + " for " + key, cause);
    }

    public static StoreException projectionFailed(String projection, String streamId, long version, Throwable cause) {
        return new StoreException(Fault.PROJECTION_FAILED, streamId, "Projection " + projection
                + " failed on event " + version + " of stream " + streamId + ": " + cause.getMessage(), cause);
    }

    public static StoreException unsupported(String key, Object event) {
        return new StoreException(Fault.PROGRAMMATIC_ERROR, key, "Unsupported event type: " + event, null);
    }

    public static StoreException unmapped(Class<?> documentClass) {
        return new StoreException(Fault.PROGRAMMATIC_ERROR, documentClass.getName(), "No document mapping for "
                + documentClass.getName(), null);
    }

    public static StoreException invalid(String key, String message) {
        return new StoreException(Fault.PROGRAMMATIC_ERROR, key, message, null);
    }

    @Override
    public String toString() {
        return "StoreException{" + "fault=" + fault + ", key=" + key + ", message=" + getMessage() + '}';
    }
}
