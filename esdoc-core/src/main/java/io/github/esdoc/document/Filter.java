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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Predicate over indexed document fields. Filters are combined with {@link #and(Filter)}; there is no disjunction.
 */
public abstract class Filter {

    public enum Operator {
        EQ("="), GT(">"), GE(">="), LT("<"), LE("<=");

        private final String sql;

        Operator(String sql) {
            this.sql = sql;
        }

        public String sql() {
            return sql;
        }
    }

    private Filter() {

    }

    /**
     * Matches every document of a type.
     * @return the filter
     */
    public static Filter all() {
        return All.INSTANCE;
    }

    public static Filter eq(String field, Object value) {
        return new Comparison(field, Operator.EQ, value);
    }

    public static Filter gt(String field, Object value) {
        return new Comparison(field, Operator.GT, value);
    }

    public static Filter ge(String field, Object value) {
        return new Comparison(field, Operator.GE, value);
    }

    public static Filter lt(String field, Object value) {
        return new Comparison(field, Operator.LT, value);
    }

    public static Filter le(String field, Object value) {
        return new Comparison(field, Operator.LE, value);
    }

    /**
     * Inclusive range.
     * @param field the field
     * @param from lower bound
     * @param to upper bound
     * @return the filter
     */
    public static Filter between(String field, Object from, Object to) {
        return ge(field, from).and(le(field, to));
    }

    public Filter and(Filter other) {
        List<Comparison> combined = new ArrayList<>(comparisons());
        combined.addAll(other.comparisons());
        return combined.isEmpty() ? all() : new And(combined);
    }

    /**
     * The conjunction of comparisons this filter consists of. Empty for {@link #all()}.
     * @return the comparisons
     */
    public abstract List<Comparison> comparisons();

    static final class All extends Filter {
        static final All INSTANCE = new All();

        @Override
        public List<Comparison> comparisons() {
            return Collections.emptyList();
        }

        @Override
        public String toString() {
            return "all";
        }
    }

    static final class And extends Filter {
        private final List<Comparison> comparisons;

        And(List<Comparison> comparisons) {
            this.comparisons = Collections.unmodifiableList(comparisons);
        }

        @Override
        public List<Comparison> comparisons() {
            return comparisons;
        }

        @Override
        public String toString() {
            return comparisons.toString();
        }
    }

    public static final class Comparison extends Filter {
        private final String field;
        private final Operator operator;
        private final Object value;

        Comparison(String field, Operator operator, Object value) {
            this.field = Objects.requireNonNull(field, "Field cannot be null");
            this.operator = Objects.requireNonNull(operator);
            this.value = Objects.requireNonNull(value, "Comparison against null is not supported");
        }

        public String getField() {
            return field;
        }

        public Operator getOperator() {
            return operator;
        }

        public Object getValue() {
            return value;
        }

        @Override
        public List<Comparison> comparisons() {
            return Arrays.asList(this);
        }

        @Override
        public String toString() {
            return field + " " + operator.sql() + " " + value;
        }
    }
}
