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

import java.util.Arrays;
import java.util.List;

/**
 * Storage for streams of events.
 *
 * <p>Appending events constitutes a single transaction: the events are stored, the stream version is advanced,
 * and all inline projections interested in the events update their documents. Either all of it is committed, or
 * nothing is.</p>
 * <p>Event store guarantees the consistency of a stream across processes by checking the version of the stream
 * on every append. A conflicting append fails with {@link StoreException.Fault#CONCURRENCY_CONFLICT} and it is up
 * to the caller to reload and retry, or give up.</p>
 */
public interface EventStore {

    /**
     * Append events to a stream.
     * @param streamId the stream
     * @param aggregateType tag recorded when the stream is created, may be null
     * @param expectedVersion precondition on current state of the stream
     * @param events domain events, in order
     * @return version of the stream after the append
     * @throws StoreException when precondition is not met, storing fails, or a projection fails
     */
    long append(String streamId, String aggregateType, ExpectedVersion expectedVersion, List<?> events)
            throws StoreException;

    default long append(String streamId, ExpectedVersion expectedVersion, Object... events) throws StoreException {
        return append(streamId, null, expectedVersion, Arrays.asList(events));
    }

    /**
     * Start a new stream. Fails with {@link StoreException.Fault#STREAM_ALREADY_EXISTS} if the stream has events.
     * @param streamId the stream
     * @param aggregateType tag of the stream
     * @param events first events of the stream
     * @return version of the stream after the append
     * @throws StoreException when stream exists, or storing fails
     */
    default long startStream(String streamId, String aggregateType, Object... events) throws StoreException {
        return append(streamId, aggregateType, ExpectedVersion.noStream(), Arrays.asList(events));
    }
}
