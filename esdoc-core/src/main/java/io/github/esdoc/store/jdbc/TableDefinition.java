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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expected shape of a table, used to create it and to detect missing columns.
 */
public final class TableDefinition {
    private final String name;
    private final Map<String, String> columns;
    private final List<String> constraints;
    private final List<String> indexes;

    private TableDefinition(Builder b) {
        this.name = b.name;
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(b.columns));
        this.constraints = Collections.unmodifiableList(new ArrayList<>(b.constraints));
        this.indexes = Collections.unmodifiableList(new ArrayList<>(b.indexes));
    }

    public static Builder table(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    /**
     * @return column names mapped to their type and constraints, in declaration order
     */
    public Map<String, String> getColumns() {
        return columns;
    }

    public String createTable() {
        StringBuilder sql = new StringBuilder("CREATE TABLE IF NOT EXISTS ").append(name).append(" (");
        List<String> parts = new ArrayList<>();
        columns.forEach((column, definition) -> parts.add(column + " " + definition));
        parts.addAll(constraints);
        return sql.append(String.join(", ", parts)).append(")").toString();
    }

    public List<String> createIndexes() {
        return indexes;
    }

    /**
     * Statement adding a column to an existing table. Added columns are nullable, existing rows have no value.
     * @param column the column
     * @return the statement
     */
    public String addColumn(String column) {
        String definition = columns.get(column).replace(" NOT NULL", "").replace(" PRIMARY KEY", "");
        return "ALTER TABLE " + name + " ADD COLUMN " + column + " " + definition;
    }

    public String dropTable() {
        return "DROP TABLE IF EXISTS " + name;
    }

    public static class Builder {
        private final String name;
        private final Map<String, String> columns = new LinkedHashMap<>();
        private final List<String> constraints = new ArrayList<>();
        private final List<String> indexes = new ArrayList<>();

        Builder(String name) {
            this.name = name;
        }

        public Builder column(String column, String definition) {
            columns.put(column, definition);
            return this;
        }

        public Builder constraint(String constraint) {
            constraints.add(constraint);
            return this;
        }

        public Builder index(String indexName, String columnList) {
            indexes.add("CREATE INDEX IF NOT EXISTS " + indexName + " ON " + name + " (" + columnList + ")");
            return this;
        }

        public TableDefinition build() {
            return new TableDefinition(this);
        }
    }
}
