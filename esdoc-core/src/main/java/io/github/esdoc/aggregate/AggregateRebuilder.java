package io.github.esdoc.aggregate;

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

import io.github.esdoc.event.EventLog;
import io.github.esdoc.event.EventTypes;
import io.github.esdoc.event.RecordedEvent;
import io.github.esdoc.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Reconstructs current state of a stream by replaying all its events through an {@link Aggregator}.
 *
 * <p>This is the slow but always consistent read path: nothing is cached, every call reads the stream from the
 * beginning. Calling it twice on an unchanged stream yields equal state.</p>
 */
public class AggregateRebuilder {
    private static final Logger logger = LoggerFactory.getLogger(AggregateRebuilder.class);

    private final EventLog eventLog;
    private final EventTypes eventTypes;

    public AggregateRebuilder(EventLog eventLog, EventTypes eventTypes) {
        this.eventLog = eventLog;
        this.eventTypes = eventTypes;
    }

    /**
     * Rebuild current state of a stream.
     * @param streamId the stream
     * @param aggregator the fold
     * @param <S> type of state
     * @return state after all events, or empty if the stream has no events
     * @throws StoreException when events cannot be read or deserialized
     */
    public <S> Optional<S> rebuild(String streamId, Aggregator<S> aggregator) throws StoreException {
        return rebuild(streamId, aggregator, Long.MAX_VALUE);
    }

    /**
     * Rebuild state of a stream as it was at given version.
     * @param streamId the stream
     * @param aggregator the fold
     * @param toVersion last version to apply
     * @param <S> type of state
     * @return state after events up to the version, or empty if the stream has no events
     * @throws StoreException when events cannot be read or deserialized
     */
    public <S> Optional<S> rebuild(String streamId, Aggregator<S> aggregator, long toVersion) throws StoreException {
        Map<String, BiFunction<S, RecordedEvent<?>, S>> transitions = resolve(aggregator);
        Replay<S> replay = new Replay<>(aggregator.initialState());
        try (EventLog.StoredEvents events = eventLog.readEvents(streamId, 1, toVersion)) {
            events.foreach(event -> replay.apply(transitions.get(event.getType()), event));
        }
        if (replay.count == 0) {
            return Optional.empty();
        }
        logger.debug("Rebuilt {} from {} events", streamId, replay.count);
        return Optional.of(replay.state);
    }

    private <S> Map<String, BiFunction<S, RecordedEvent<?>, S>> resolve(Aggregator<S> aggregator) {
        Map<String, BiFunction<S, RecordedEvent<?>, S>> resolved = new HashMap<>();
        aggregator.getTransitions().forEach((eventClass, transition) -> resolved.put(
            eventTypes.nameOf(eventClass).orElseThrow(() -> new IllegalStateException(
                "Aggregator handles unregistered event class " + eventClass.getName())),
            transition));
        return resolved;
    }

    private static final class Replay<S> {
        private S state;
        private long count;

        Replay(S initial) {
            this.state = initial;
        }

        void apply(BiFunction<S, RecordedEvent<?>, S> transition, RecordedEvent<?> event) {
            count++;
            if (transition != null) {
                state = transition.apply(state, event);
            }
        }
    }
}
