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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * A document field that is copied into the index table on every write, so that documents can be filtered and sorted
 * by it.
 *
 * @param <T> type of the document
 */
public final class IndexedField<T> {
    /**
     * Longer text values are indexed by their prefix of this length.
     */
    public static final int MAX_TEXT_LENGTH = 1000;

    public enum Kind {
        /**
         * Strings and enums, compared as text.
         */
        TEXT,
        /**
         * Any {@link Number}, compared numerically.
         */
        NUMBER,
        /**
         * {@link Instant}, compared by time.
         */
        TIMESTAMP,
        /**
         * Booleans, only meaningful for equality.
         */
        BOOLEAN;

        public boolean isNumeric() {
            return this == NUMBER || this == TIMESTAMP;
        }
    }

    private final String name;
    private final Kind kind;
    private final Function<? super T, ?> accessor;

    IndexedField(String name, Kind kind, Function<? super T, ?> accessor) {
        this.name = Objects.requireNonNull(name);
        this.kind = Objects.requireNonNull(kind);
        this.accessor = Objects.requireNonNull(accessor);
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Extract the indexed value of a document.
     * @param document the document
     * @return value in its index representation, or null when the document has no value for the field
     */
    public Object indexValueOf(T document) {
        return toIndexValue(accessor.apply(document));
    }

    /**
     * Convert a value to the representation stored in the index: {@link String} for text and boolean kinds,
     * {@link BigDecimal} for numbers and timestamps (epoch millis).
     * @param value the value
     * @return the index representation, or null for null value
     */
    public Object toIndexValue(Object value) {
        if (value == null) {
            return null;
        }
        switch (kind) {
            case TEXT:
                String text = value instanceof Enum ? ((Enum<?>) value).name() : value.toString();
                return text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) : text;
            case BOOLEAN:
                if (!(value instanceof Boolean)) {
                    throw new IllegalArgumentException("Field " + name + " expects boolean, got " + value);
                }
                return value.toString();
            case NUMBER:
                if (value instanceof BigDecimal) {
                    return value;
                } else if (value instanceof Long || value instanceof Integer || value instanceof Short
                        || value instanceof Byte) {
                    return BigDecimal.valueOf(((Number) value).longValue());
                } else if (value instanceof Number) {
                    return new BigDecimal(value.toString());
                }
                throw new IllegalArgumentException("Field " + name + " expects a number, got " + value);
            case TIMESTAMP:
                if (value instanceof Instant) {
                    return BigDecimal.valueOf(((Instant) value).toEpochMilli());
                }
                throw new IllegalArgumentException("Field " + name + " expects an instant, got " + value);
            default:
                throw new IllegalStateException("Unknown kind " + kind);
        }
    }

    @Override
    public String toString() {
        return "IndexedField{" + name + ", " + kind + '}';
    }
}
