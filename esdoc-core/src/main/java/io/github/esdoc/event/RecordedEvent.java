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
import java.util.Objects;

/**
 * Immutable fact as it is stored in the event log: the domain event together with its position in the stream and in
 * the global log.
 *
 * @param <E> type of the domain event
 */
public final class RecordedEvent<E> {
    private final long sequence;
    private final String streamId;
    private final long version;
    private final String type;
    private final E data;
    private final Instant recordedAt;

    public RecordedEvent(long sequence, String streamId, long version, String type, E data, Instant recordedAt) {
        this.sequence = sequence;
        this.streamId = Objects.requireNonNull(streamId);
        this.version = version;
        this.type = Objects.requireNonNull(type);
        this.data = Objects.requireNonNull(data);
        this.recordedAt = Objects.requireNonNull(recordedAt);
    }

    /**
     * Global position in the event log. Increases with every appended event, across all streams.
     * @return the sequence number
     */
    public long getSequence() {
        return sequence;
    }

    public String getStreamId() {
        return streamId;
    }

    /**
     * Version of the stream after this event. First event of a stream has version 1.
     * @return the stream version
     */
    public long getVersion() {
        return version;
    }

    public String getType() {
        return type;
    }

    public E getData() {
        return data;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    public <T> RecordedEvent<T> as(Class<T> dataType) {
        if (!dataType.isInstance(data)) {
            throw new ClassCastException("Event " + type + " carries " + data.getClass().getName() + ", not "
                    + dataType.getName());
        }
        return new RecordedEvent<>(sequence, streamId, version, type, dataType.cast(data), recordedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;

        RecordedEvent<?> that = (RecordedEvent<?>) o;

        if (sequence != that.sequence)
            return false;
        if (version != that.version)
            return false;
        if (!streamId.equals(that.streamId))
            return false;
        return data.equals(that.data);
    }

    @Override
    public int hashCode() {
        int result = streamId.hashCode();
        result = 31 * result + (int) (version ^ (version >>> 32));
        return result;
    }

    @Override
    public String toString() {
        return "RecordedEvent{" + "sequence=" + sequence + ", streamId=" + streamId + ", version=" + version
                + ", type=" + type + ", data=" + data + ", recordedAt=" + recordedAt + '}';
    }
}
