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

import java.time.Instant;
import java.util.Objects;

/**
 * A stored document together with its concurrency token.
 *
 * @param <T> type of the document value
 */
public final class Document<T> {
    private final String type;
    private final String id;
    private final T value;
    private final String versionToken;
    private final Instant lastModified;

    public Document(String type, String id, T value, String versionToken, Instant lastModified) {
        this.type = Objects.requireNonNull(type);
        this.id = Objects.requireNonNull(id);
        this.value = Objects.requireNonNull(value);
        this.versionToken = Objects.requireNonNull(versionToken);
        this.lastModified = lastModified;
    }

    public String getType() {
        return type;
    }

    public String getId() {
        return id;
    }

    public T getValue() {
        return value;
    }

    /**
     * Opaque token that changes on every write. Pass it to {@link DocumentStore#store(Object, String)} to make sure
     * the document was not changed since it was read.
     * @return the version token
     */
    public String getVersionToken() {
        return versionToken;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    @Override
    public String toString() {
        return "Document{" + "type=" + type + ", id=" + id + ", versionToken=" + versionToken + ", value=" + value
                + '}';
    }
}
