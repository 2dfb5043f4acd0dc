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

import java.time.Instant;

/**
 * Header data of a stream as kept by the {@link StreamRegistry}.
 */
public final class StreamState {
    private final String streamId;
    private final String aggregateType;
    private final long version;
    private final Instant createdAt;
    private final Instant updatedAt;

    public StreamState(String streamId, String aggregateType, long version, Instant createdAt, Instant updatedAt) {
        this.streamId = streamId;
        this.aggregateType = aggregateType;
        this.version = version;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public String getStreamId() {
        return streamId;
    }

    /**
     * Tag given when the stream was started, may be null.
     * @return the aggregate type
     */
    public String getAggregateType() {
        return aggregateType;
    }

    /**
     * Number of events in the stream.
     * @return current version
     */
    public long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "StreamState{" + "streamId=" + streamId + ", aggregateType=" + aggregateType + ", version=" + version
                + ", createdAt=" + createdAt + ", updatedAt=" + updatedAt + '}';
    }
}
