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

import io.github.esdoc.store.AutoCreate;
import io.github.esdoc.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Creates and updates the tables of a {@link JdbcSchema}.
 */
public class SchemaManager {
    private static final Logger logger = LoggerFactory.getLogger(SchemaManager.class);

    private final DataSource dataSource;
    private final JdbcSchema schema;

    public SchemaManager(DataSource dataSource, JdbcSchema schema) {
        this.dataSource = dataSource;
        this.schema = schema;
    }

    /**
     * Bring the database to the expected shape as far as the mode allows.
     * @param mode the mode
     * @throws StoreException when database cannot be inspected or changed
     */
    public void apply(AutoCreate mode) throws StoreException {
        try (Connection connection = dataSource.getConnection()) {
            Map<TableDefinition, Optional<Set<String>>> existing = inspect(connection);
            List<String> statements = new ArrayList<>();
            for (Map.Entry<TableDefinition, Optional<Set<String>>> entry : existing.entrySet()) {
                TableDefinition table = entry.getKey();
                if (!entry.getValue().isPresent()) {
                    if (mode == AutoCreate.NONE) {
                        logger.warn("Table {} does not exist and schema changes are disabled", table.getName());
                    } else {
                        statements.add(table.createTable());
                        statements.addAll(table.createIndexes());
                    }
                    continue;
                }
                Set<String> columns = entry.getValue().get();
                List<String> missing = missingColumns(table, columns);
                if (mode == AutoCreate.ALL && (!missing.isEmpty() || columns.size() != table.getColumns().size())) {
                    logger.warn("Table {} differs from expected shape, recreating it", table.getName());
                    statements.add(table.dropTable());
                    statements.add(table.createTable());
                    statements.addAll(table.createIndexes());
                } else if (mode == AutoCreate.CREATE_OR_UPDATE) {
                    for (String column : missing) {
                        statements.add(table.addColumn(column));
                    }
                } else if (!missing.isEmpty()) {
                    logger.warn("Table {} misses columns {}", table.getName(), missing);
                }
            }
            execute(connection, statements);
        } catch (SQLException e) {
            throw StoreException.storeFailed("schema", e);
        }
    }

    /**
     * Drop all tables of the schema.
     * @throws StoreException when database fails
     */
    public void dropAll() throws StoreException {
        List<TableDefinition> tables = new ArrayList<>(schema.tables());
        Collections.reverse(tables);
        List<String> statements = new ArrayList<>();
        for (TableDefinition table : tables) {
            statements.add(table.dropTable());
        }
        try (Connection connection = dataSource.getConnection()) {
            execute(connection, statements);
        } catch (SQLException e) {
            throw StoreException.storeFailed("schema", e);
        }
    }

    /**
     * Names of expected tables that do not exist.
     * @return missing table names
     * @throws StoreException when database cannot be inspected
     */
    public List<String> missingTables() throws StoreException {
        try (Connection connection = dataSource.getConnection()) {
            List<String> result = new ArrayList<>();
            inspect(connection).forEach((table, columns) -> {
                if (!columns.isPresent()) {
                    result.add(table.getName());
                }
            });
            return result;
        } catch (SQLException e) {
            throw StoreException.storeFailed("schema", e);
        }
    }

    private Map<TableDefinition, Optional<Set<String>>> inspect(Connection connection) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        String currentSchema = connection.getSchema();
        Map<String, String> actualNames = new LinkedHashMap<>();
        try (ResultSet rs = metaData.getTables(null, currentSchema, null, new String[] { "TABLE" })) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                actualNames.put(name.toUpperCase(Locale.ROOT), name);
            }
        }
        Map<TableDefinition, Optional<Set<String>>> result = new LinkedHashMap<>();
        for (TableDefinition table : schema.tables()) {
            String actual = actualNames.get(table.getName().toUpperCase(Locale.ROOT));
            if (actual == null) {
                result.put(table, Optional.empty());
                continue;
            }
            Set<String> columns = new TreeSet<>();
            try (ResultSet rs = metaData.getColumns(null, currentSchema, actual, null)) {
                while (rs.next()) {
                    columns.add(rs.getString("COLUMN_NAME").toUpperCase(Locale.ROOT));
                }
            }
            result.put(table, Optional.of(columns));
        }
        return result;
    }

    private static List<String> missingColumns(TableDefinition table, Set<String> columns) {
        List<String> missing = new ArrayList<>();
        for (String column : table.getColumns().keySet()) {
            if (!columns.contains(column.toUpperCase(Locale.ROOT))) {
                missing.add(column);
            }
        }
        return missing;
    }

    private static void execute(Connection connection, List<String> statements) throws SQLException {
        try (Statement st = connection.createStatement()) {
            for (String sql : statements) {
                logger.info("Executing {}", sql);
                st.execute(sql);
            }
        }
    }
}
