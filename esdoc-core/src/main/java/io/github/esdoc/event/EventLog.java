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

import io.github.esdoc.store.StoreException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Reads persisted events.
 */
public interface EventLog {
    /**
     * Read events of a stream within version range.
     * @param streamId the id of a stream
     * @param fromVersion first version to return, 1 for the entire history
     * @param toVersion last version to return inclusive, {@link Long#MAX_VALUE} for all
     * @return accessor for the events in order they appeared in history
     * @throws StoreException when storage is not available
     */
    StoredEvents readEvents(String streamId, long fromVersion, long toVersion) throws StoreException;

    default StoredEvents readEvents(String streamId) throws StoreException {
        return readEvents(streamId, 1, Long.MAX_VALUE);
    }

    /**
     * Read events of all streams in order of their global sequence.
     * @param afterSequence return events with sequence greater than this, 0 for the beginning of the log
     * @param limit maximum number of events
     * @return the events
     * @throws StoreException when storage is not available, or an event cannot be deserialized in strict mode
     */
    List<RecordedEvent<Object>> readAll(long afterSequence, int limit) throws StoreException;

    /**
     * Accessor that enables single iteration over found events.
     * The events need not be materialized at once, the accessor may wrap a JDBC ResultSet. This also means that only
     * one of methods foreach, reduce and toList may be called on single instance, and only once. To read the stream
     * again, request new accessor.
     */
    interface StoredEvents extends AutoCloseable {
        /**
         * Iterate over all found events. Consumer may call {@link #stop()} to stop the iteration.
         * @param consumer consumer that will receive the events
         * @throws StoreException when reading fails
         */
        void foreach(Consumer<? super RecordedEvent<Object>> consumer) throws StoreException;

        /**
         * Perform a reduction over all found events. Reducer may call {@link #stop()} to stop the process.
         * @param initial Initial value for reduction
         * @param reducer the reducer function
         * @param <R> type of result
         * @return result of reduction.
         * @throws StoreException when reading fails
         */
        <R> R reduce(R initial, BiFunction<R, ? super RecordedEvent<Object>, R> reducer) throws StoreException;

        /**
         * Materialize remaining events.
         * @return the events
         * @throws StoreException when reading fails
         */
        default List<RecordedEvent<Object>> toList() throws StoreException {
            List<RecordedEvent<Object>> result = new ArrayList<>();
            foreach(result::add);
            return result;
        }

        /**
         * Can be called from within the lambda functions to stop the iteration after current step.
         */
        void stop();

        // will not throw exception
        @Override
        void close();
    }
}
