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

import io.github.esdoc.event.ExpectedVersion;
import io.github.esdoc.store.StoreException;
import io.github.esdoc.store.jdbc.Counter;
import io.github.esdoc.store.jdbc.JdbcTest;
import io.github.esdoc.store.jdbc.TestEvents;
import org.junit.Test;

import java.util.Objects;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;


public class AggregateRebuilderTest extends JdbcTest {

    static final class Tally {
        final String name;
        final int total;
        final int notes;

        Tally(String name, int total, int notes) {
            this.name = name;
            this.total = total;
            this.notes = notes;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Tally))
                return false;
            Tally other = (Tally) o;
            return total == other.total && notes == other.notes && Objects.equals(name, other.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, total, notes);
        }

        @Override
        public String toString() {
            return "Tally{" + name + ", " + total + ", " + notes + '}';
        }
    }

    static final Aggregator<Tally> TALLY = Aggregator.startingWith(() -> new Tally(null, 0, 0))
            .on(TestEvents.Created.class, (t, e) -> new Tally(e.getName(), 0, 0))
            .on(TestEvents.Incremented.class, (t, e) -> new Tally(t.name, t.total + e.getBy(), t.notes))
            .on(TestEvents.Noted.class, (t, e) -> new Tally(t.name, t.total, t.notes + 1))
            .build();

    @Test
    public void state_is_folded_from_all_events() throws StoreException {
        store.events().startStream(name(), "Tally", new TestEvents.Created("a"), new TestEvents.Incremented(2),
            new TestEvents.Incremented(5));
        assertEquals(new Tally("a", 7, 0), store.aggregates().rebuild(name(), TALLY).get());
    }

    @Test
    public void missing_stream_has_no_state() throws StoreException {
        assertFalse(store.aggregates().rebuild(name(), TALLY).isPresent());
    }

    @Test
    public void historical_state_stops_at_version() throws StoreException {
        store.events().startStream(name(), "Tally", new TestEvents.Created("a"), new TestEvents.Incremented(2),
            new TestEvents.Incremented(5));
        assertEquals(new Tally("a", 2, 0), store.aggregates().rebuild(name(), TALLY, 2).get());
    }

    @Test
    public void events_without_transition_are_skipped() throws StoreException {
        store.events().startStream(name(), "Tally", new TestEvents.Created("a"), new TestEvents.Renamed("b"),
            new TestEvents.Tagged("t"), new TestEvents.Incremented(1));
        assertEquals(new Tally("a", 1, 0), store.aggregates().rebuild(name(), TALLY).get());
    }

    @Test
    public void fold_sees_events_the_projection_ignores() throws StoreException {
        store.events().startStream(name(), "Tally", new TestEvents.Created("a"), new TestEvents.Incremented(3));
        store.events().append(name(), ExpectedVersion.exact(2), new TestEvents.Noted("n"), new TestEvents.Noted("m"));
        assertEquals(new Tally("a", 3, 2), store.aggregates().rebuild(name(), TALLY).get());
        assertEquals(3, store.documents().load(Counter.class, name()).get().getValue()
                .getTotal());
    }

    @Test
    public void rebuilding_twice_yields_equal_state() throws StoreException {
        store.events().startStream(name(), "Tally", new TestEvents.Created("a"), new TestEvents.Incremented(3),
            new TestEvents.Noted("n"));
        Optional<Tally> first = store.aggregates().rebuild(name(), TALLY);
        Optional<Tally> second = store.aggregates().rebuild(name(), TALLY);
        assertEquals(first, second);
    }

    @Test
    public void aggregator_with_unregistered_event_class_fails() throws StoreException {
        store.events().startStream(name(), "Tally", new TestEvents.Created("a"));
        Aggregator<Tally> broken = Aggregator.startingWith(() -> new Tally(null, 0, 0))
                .on(String.class, (t, e) -> t)
                .build();
        try {
            store.aggregates().rebuild(name(), broken);
            fail("should have failed");
        } catch (IllegalStateException e) {
            // expected
        }
    }
}
