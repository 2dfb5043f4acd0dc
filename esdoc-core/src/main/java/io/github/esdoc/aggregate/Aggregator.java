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

import io.github.esdoc.event.RecordedEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Fold of a stream into current state. Starts from an initial state and applies a transition for every event whose
 * class has one; other events are skipped. Transitions return the next state, the previous one is left untouched.
 * <pre>
 * Aggregator.startingWith(BankAccount::empty)
 *         .on(AccountOpened.class, BankAccount::opened)
 *         .on(MoneyDeposited.class, BankAccount::deposited)
 *         .build();
 * </pre>
 *
 * @param <S> state type
 */
public final class Aggregator<S> {
    private final Supplier<? extends S> initial;
    private final Map<Class<?>, BiFunction<S, RecordedEvent<?>, S>> transitions;

    private Aggregator(Builder<S> b) {
        this.initial = b.initial;
        this.transitions = Collections.unmodifiableMap(new LinkedHashMap<>(b.transitions));
    }

    public static <S> Builder<S> startingWith(Supplier<? extends S> initial) {
        return new Builder<>(initial);
    }

    public S initialState() {
        return Objects.requireNonNull(initial.get(), "Initial state cannot be null");
    }

    public Map<Class<?>, BiFunction<S, RecordedEvent<?>, S>> getTransitions() {
        return transitions;
    }

    public static class Builder<S> {
        private final Supplier<? extends S> initial;
        private final Map<Class<?>, BiFunction<S, RecordedEvent<?>, S>> transitions = new LinkedHashMap<>();

        Builder(Supplier<? extends S> initial) {
            this.initial = Objects.requireNonNull(initial, "Initial state supplier cannot be null");
        }

        public <E> Builder<S> on(Class<E> eventClass, BiFunction<? super S, ? super E, ? extends S> transition) {
            Objects.requireNonNull(transition, "Transition cannot be null");
            return onRecorded(eventClass, (state, recorded) -> transition.apply(state, recorded.getData()));
        }

        /**
         * Transition with access to the metadata of the event.
         * @param eventClass the event class
         * @param transition the transition
         * @param <E> the event class
         * @return this
         */
        public <E> Builder<S> onRecorded(Class<E> eventClass,
                BiFunction<? super S, ? super RecordedEvent<E>, ? extends S> transition) {
            Objects.requireNonNull(eventClass, "Event class cannot be null");
            Objects.requireNonNull(transition, "Transition cannot be null");
            if (transitions.containsKey(eventClass)) {
                throw new IllegalArgumentException("Transition for " + eventClass.getName() + " already defined");
            }
            transitions.put(eventClass, (state, recorded) -> transition.apply(state, recorded.as(eventClass)));
            return this;
        }

        public Aggregator<S> build() {
            return new Aggregator<>(this);
        }
    }
}
