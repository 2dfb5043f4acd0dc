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

/**
 * Sorting on an indexed field.
 */
public final class IndexOrder {
    private final String field;
    private final boolean numeric;
    private final boolean descending;

    public IndexOrder(String field, boolean numeric, boolean descending) {
        this.field = field;
        this.numeric = numeric;
        this.descending = descending;
    }

    public String getField() {
        return field;
    }

    public boolean isNumeric() {
        return numeric;
    }

    public boolean isDescending() {
        return descending;
    }
}
