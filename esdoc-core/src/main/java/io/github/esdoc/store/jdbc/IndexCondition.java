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

import io.github.esdoc.document.Filter;

/**
 * A comparison on an index table column, with the value already converted to its index representation.
 */
public final class IndexCondition {
    private final String field;
    private final Filter.Operator operator;
    private final boolean numeric;
    private final Object value;

    public IndexCondition(String field, Filter.Operator operator, boolean numeric, Object value) {
        this.field = field;
        this.operator = operator;
        this.numeric = numeric;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public Filter.Operator getOperator() {
        return operator;
    }

    /**
     * @return true when the value is compared in numeric column, false for text column
     */
    public boolean isNumeric() {
        return numeric;
    }

    public Object getValue() {
        return value;
    }
}
