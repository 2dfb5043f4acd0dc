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

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Query over documents of a single type: filter on indexed fields, order by an indexed field, page with limit and
 * offset. Documents with equal sort value are ordered by their id, so that paging is stable.
 *
 * @param <T> type of documents
 */
public final class Query<T> {
    private final Class<T> documentClass;
    private final Filter filter;
    private final String orderBy;
    private final boolean descending;
    private final Integer limit;
    private final int offset;

    private Query(Class<T> documentClass, Filter filter, String orderBy, boolean descending, Integer limit,
            int offset) {
        this.documentClass = documentClass;
        this.filter = filter;
        this.orderBy = orderBy;
        this.descending = descending;
        this.limit = limit;
        this.offset = offset;
    }

    public static <T> Query<T> of(Class<T> documentClass) {
        return new Query<>(Objects.requireNonNull(documentClass), Filter.all(), null, false, null, 0);
    }

    public Query<T> where(Filter filter) {
        return new Query<>(documentClass, this.filter.and(filter), orderBy, descending, limit, offset);
    }

    public Query<T> orderBy(String field) {
        return new Query<>(documentClass, filter, Objects.requireNonNull(field), false, limit, offset);
    }

    public Query<T> orderByDescending(String field) {
        return new Query<>(documentClass, filter, Objects.requireNonNull(field), true, limit, offset);
    }

    public Query<T> limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative");
        }
        return new Query<>(documentClass, filter, orderBy, descending, limit, offset);
    }

    public Query<T> offset(int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative");
        }
        return new Query<>(documentClass, filter, orderBy, descending, limit, offset);
    }

    public Class<T> getDocumentClass() {
        return documentClass;
    }

    public Filter getFilter() {
        return filter;
    }

    /**
     * @return indexed field to order by, null when ordering only by id
     */
    public String getOrderBy() {
        return orderBy;
    }

    public boolean isDescending() {
        return descending;
    }

    public OptionalInt getLimit() {
        return limit == null ? OptionalInt.empty() : OptionalInt.of(limit);
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return "Query{" + documentClass.getSimpleName() + " where " + filter + ", orderBy=" + orderBy
                + (descending ? " desc" : "") + ", limit=" + limit + ", offset=" + offset + '}';
    }
}
