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

/**
 * Precondition on the state of a stream that an append requires.
 */
public final class ExpectedVersion {
    private static final long ANY_VERSION = -1;
    private static final long NO_STREAM_VERSION = -2;
    private static final long STREAM_EXISTS_VERSION = -3;

    private static final ExpectedVersion ANY = new ExpectedVersion(ANY_VERSION);
    private static final ExpectedVersion NO_STREAM = new ExpectedVersion(NO_STREAM_VERSION);
    private static final ExpectedVersion STREAM_EXISTS = new ExpectedVersion(STREAM_EXISTS_VERSION);

    private final long version;

    private ExpectedVersion(long version) {
        this.version = version;
    }

    /**
     * Append regardless of the state of the stream.
     * @return the precondition
     */
    public static ExpectedVersion any() {
        return ANY;
    }

    /**
     * Stream must not have any events yet.
     * @return the precondition
     */
    public static ExpectedVersion noStream() {
        return NO_STREAM;
    }

    /**
     * Stream must have at least one event.
     * @return the precondition
     */
    public static ExpectedVersion streamExists() {
        return STREAM_EXISTS;
    }

    /**
     * Stream must be exactly at given version. Version 0 is a stream without events.
     * @param version the version the caller has seen
     * @return the precondition
     */
    public static ExpectedVersion exact(long version) {
        if (version < 0) {
            throw new IllegalArgumentException("Stream version cannot be negative: " + version);
        }
        return new ExpectedVersion(version);
    }

    public boolean isAny() {
        return version == ANY_VERSION;
    }

    public boolean isNoStream() {
        return version == NO_STREAM_VERSION;
    }

    public boolean isStreamExists() {
        return version == STREAM_EXISTS_VERSION;
    }

    public boolean isExact() {
        return version >= 0;
    }

    /**
     * @return the exact version expected
     * @throws IllegalStateException if this is not an exact precondition
     */
    public long getVersion() {
        if (!isExact()) {
            throw new IllegalStateException(this + " does not carry a version");
        }
        return version;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExpectedVersion && ((ExpectedVersion) o).version == version;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(version);
    }

    @Override
    public String toString() {
        if (isAny()) {
            return "ExpectedVersion{any}";
        } else if (isNoStream()) {
            return "ExpectedVersion{no-stream}";
        } else if (isStreamExists()) {
            return "ExpectedVersion{stream-exists}";
        }
        return "ExpectedVersion{" + version + '}';
    }
}
