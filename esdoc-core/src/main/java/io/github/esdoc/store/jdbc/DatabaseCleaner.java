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
import io.github.esdoc.store.AutoCreate;
import io.github.esdoc.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;

/**
 * Administrative removal of stored data. None of these operations are part of normal event sourced lifecycle, where
 * events are never deleted; they exist for resetting development and test databases.
 */
public class DatabaseCleaner extends JdbcSupport {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseCleaner.class);

    private final SchemaManager schemaManager;
    private final JdbcDocumentStore documents;

    public DatabaseCleaner(DataSource dataSource, JdbcSchema schema, SchemaManager schemaManager,
            JdbcDocumentStore documents, TxHandler txHandler) {
        super(dataSource, schema, txHandler);
        this.schemaManager = schemaManager;
        this.documents = documents;
    }

    /**
     * Delete all events and streams. Documents, including projected ones, are kept.
     * @throws StoreException when database fails
     */
    public void deleteAllEventData() throws StoreException {
        clear(Arrays.asList(schema.eventTable(), schema.streamTable()));
        logger.info("All event data deleted");
    }

    /**
     * Delete all documents of all types.
     * @throws StoreException when database fails
     */
    public void deleteAllDocuments() throws StoreException {
        clear(Arrays.asList(schema.indexTable(), schema.documentTable()));
        logger.info("All documents deleted");
    }

    public int deleteDocumentsOfType(Class<?> documentClass) throws StoreException {
        return documents.deleteWhere(documentClass, Filter.all());
    }

    /**
     * Hard delete of a stream with all its events. Documents projected from the stream are not touched.
     * @param streamId the stream
     * @return true if stream existed
     * @throws StoreException when database fails
     */
    public boolean deleteStream(String streamId) throws StoreException {
        return inTransaction(streamId, connection -> {
            try (PreparedStatement events = schema.deleteStreamEvents(connection, streamId);
                    PreparedStatement stream = schema.deleteStream(connection, streamId)) {
                int deletedEvents = events.executeUpdate();
                boolean existed = stream.executeUpdate() > 0;
                logger.info("Deleted stream {} with {} events", streamId, deletedEvents);
                return existed;
            }
        });
    }

    /**
     * Delete all data, keeping the tables.
     * @throws StoreException when database fails
     */
    public void deleteAllData() throws StoreException {
        deleteAllEventData();
        deleteAllDocuments();
    }

    /**
     * Drop all tables.
     * @throws StoreException when database fails
     */
    public void completelyRemoveAll() throws StoreException {
        schemaManager.dropAll();
        logger.info("All tables dropped");
    }

    /**
     * Create all missing tables and columns, regardless of configured {@link AutoCreate} mode.
     * @throws StoreException when database fails
     */
    public void applyAllConfiguredChanges() throws StoreException {
        schemaManager.apply(AutoCreate.CREATE_OR_UPDATE);
    }

    private void clear(List<TableDefinition> tables) throws StoreException {
        inTransaction("*", connection -> {
            try (Statement st = connection.createStatement()) {
                for (String sql : schema.clearTables(tables)) {
                    st.executeUpdate(sql);
                }
            }
            return null;
        });
    }
}
