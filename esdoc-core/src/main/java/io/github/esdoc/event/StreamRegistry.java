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

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Cheap lookups of stream existence and version, without reading the events. The registry is maintained by
 * {@link EventStore} within the append transaction and never written independently.
 */
public interface StreamRegistry {

    /**
     * Header of a stream.
     * @param streamId the stream
     * @return the state, or empty if no event was ever appended to the stream
     * @throws StoreException when storage is not available
     */
    Optional<StreamState> streamState(String streamId) throws StoreException;

    /**
     * Current version of a stream.
     * @param streamId the stream
     * @return number of events in the stream, or empty if stream does not exist
     * @throws StoreException when storage is not available
     */
    default OptionalLong version(String streamId) throws StoreException {
        Optional<StreamState> state = streamState(streamId);
        return state.isPresent() ? OptionalLong.of(state.get().getVersion()) : OptionalLong.empty();
    }
}
