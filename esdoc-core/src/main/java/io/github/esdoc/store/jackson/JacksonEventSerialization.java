package io.github.esdoc.store.jackson;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.esdoc.event.EventTypes;
import io.github.esdoc.store.Serialization;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;

/**
 * JSON serialization of events. The type discriminator is the name the event class is registered under in
 * {@link EventTypes}, the payload is the JSON of the event object itself.
 *
 * <p>Payload version is 1 for all events. Subclasses that need to read older payloads override
 * {@link #payloadVersion(Object)} and {@link #readPayload(int, String, Class)}.</p>
 */
public class JacksonEventSerialization implements Serialization<Object> {
    public static final int CURRENT_PAYLOAD_VERSION = 1;

    private final ObjectMapper mapper;
    private final EventTypes eventTypes;

    public JacksonEventSerialization(ObjectMapper mapper, EventTypes eventTypes) {
        this.mapper = Objects.requireNonNull(mapper);
        this.eventTypes = Objects.requireNonNull(eventTypes);
    }

    @Override
    public int payloadVersion(Object object) {
        return CURRENT_PAYLOAD_VERSION;
    }

    @Override
    public String typeName(Object object) {
        return eventTypes.nameOf(object.getClass()).orElseThrow(() -> new IllegalArgumentException(
            "Event class is not registered: " + object.getClass().getName()));
    }

    @Override
    public String serialize(Object object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + object, e);
        }
    }

    @Override
    public Object deserialize(int payloadVersion, String payload, String type) {
        Optional<Class<?>> eventClass = eventTypes.classOf(type);
        if (!eventClass.isPresent()) {
            return null;
        }
        try {
            return readPayload(payloadVersion, payload, eventClass.get());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read payload of " + type, e);
        }
    }

    protected Object readPayload(int payloadVersion, String payload, Class<?> eventClass) throws IOException {
        if (payloadVersion != CURRENT_PAYLOAD_VERSION) {
            throw new IOException("Unsupported payload version " + payloadVersion + " of "
                    + eventClass.getSimpleName());
        }
        return mapper.readValue(payload, eventClass);
    }

    @Override
    public Object toSerializable(Object o) {
        return o != null && eventTypes.nameOf(o.getClass()).isPresent() ? o : null;
    }
}
