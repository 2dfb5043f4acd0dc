package io.github.esdoc.store.jdbc;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.esdoc.StoreOptions;

import java.util.Objects;

/**
 * Events of a named counter, used across store tests.
 */
public final class TestEvents {
    private TestEvents() {

    }

    public static StoreOptions.Builder register(StoreOptions.Builder options) {
        return options.events(Created.class, Incremented.class, Renamed.class, Archived.class, Tagged.class,
            Noted.class);
    }

    public static final class Created {
        private final String name;

        @JsonCreator
        public Created(@JsonProperty("name") String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Created && Objects.equals(name, ((Created) o).name);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(name);
        }
    }

    public static final class Incremented {
        private final int by;

        @JsonCreator
        public Incremented(@JsonProperty("by") int by) {
            this.by = by;
        }

        public int getBy() {
            return by;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Incremented && by == ((Incremented) o).by;
        }

        @Override
        public int hashCode() {
            return by;
        }
    }

    public static final class Renamed {
        private final String name;

        @JsonCreator
        public Renamed(@JsonProperty("name") String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    public static final class Archived {
        private final String reason;

        @JsonCreator
        public Archived(@JsonProperty("reason") String reason) {
            this.reason = reason;
        }

        public String getReason() {
            return reason;
        }
    }

    public static final class Tagged {
        private final String tag;

        @JsonCreator
        public Tagged(@JsonProperty("tag") String tag) {
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }
    }

    /**
     * Not handled by any projection.
     */
    public static final class Noted {
        private final String text;

        @JsonCreator
        public Noted(@JsonProperty("text") String text) {
            this.text = text;
        }

        public String getText() {
            return text;
        }
    }
}
