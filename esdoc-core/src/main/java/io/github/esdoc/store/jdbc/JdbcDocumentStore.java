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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.esdoc.document.Document;
import io.github.esdoc.document.DocumentMapping;
import io.github.esdoc.document.DocumentMappings;
import io.github.esdoc.document.DocumentSession;
import io.github.esdoc.document.DocumentStore;
import io.github.esdoc.document.Filter;
import io.github.esdoc.document.IndexedField;
import io.github.esdoc.document.Query;
import io.github.esdoc.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Document store keeping JSON documents in a single table, with indexed fields copied to an index table.
 *
 * <p>Every write generates a new random version token. Writes with expected token are compare-and-swap updates on the
 * token column, so of two writers presenting the same token exactly one updates the row.</p>
 */
public class JdbcDocumentStore extends JdbcSupport implements DocumentStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcDocumentStore.class);

    private final DocumentMappings mappings;
    private final ObjectMapper mapper;

    private enum WriteMode {
        OVERWRITE, EXPECT_TOKEN, INSERT
    }

    public JdbcDocumentStore(DataSource dataSource, JdbcSchema schema, DocumentMappings mappings, ObjectMapper mapper,
            TxHandler txHandler) {
        super(dataSource, schema, txHandler);
        this.mappings = Objects.requireNonNull(mappings);
        this.mapper = Objects.requireNonNull(mapper);
    }

    @Override
    public <T> Optional<Document<T>> load(Class<T> documentClass, String id) throws StoreException {
        DocumentMapping<Object> mapping = mappingOf(documentClass);
        String key = StoreException.documentKey(mapping.getTypeName(), id);
        return withConnection(key, connection -> load(connection, mapping, documentClass, id));
    }

    @Override
    public String store(Object document) throws StoreException {
        return write(document, WriteMode.OVERWRITE, null);
    }

    @Override
    public String store(Object document, String expectedToken) throws StoreException {
        Objects.requireNonNull(expectedToken, "Expected version token cannot be null");
        return write(document, WriteMode.EXPECT_TOKEN, expectedToken);
    }

    @Override
    public String insert(Object document) throws StoreException {
        return write(document, WriteMode.INSERT, null);
    }

    @Override
    public void storeAll(Iterable<?> documents) throws StoreException {
        inTransaction("*", connection -> {
            int count = 0;
            for (Object document : documents) {
                DocumentMapping<Object> mapping = mappingOf(document.getClass());
                write(connection, mapping, mapping.idOf(document), document, WriteMode.OVERWRITE, null);
                count++;
            }
            logger.debug("Stored {} documents", count);
            return count;
        });
    }

    @Override
    public boolean delete(Class<?> documentClass, String id) throws StoreException {
        DocumentMapping<Object> mapping = mappingOf(documentClass);
        return inTransaction(StoreException.documentKey(mapping.getTypeName(), id),
            connection -> delete(connection, mapping, id));
    }

    @Override
    public int deleteWhere(Class<?> documentClass, Filter filter) throws StoreException {
        DocumentMapping<Object> mapping = mappingOf(documentClass);
        List<IndexCondition> conditions = conditions(mapping, filter);
        return inTransaction(mapping.getTypeName(), connection -> {
            int deleted;
            if (conditions.isEmpty()) {
                deleted = deleteAllOfType(connection, mapping.getTypeName());
            } else {
                List<String> ids = new ArrayList<>();
                try (PreparedStatement st = schema.selectDocumentIds(connection, mapping.getTypeName(), conditions);
                        ResultSet rs = st.executeQuery()) {
                    while (rs.next()) {
                        ids.add(rs.getString(1));
                    }
                }
                deleted = 0;
                for (String id : ids) {
                    if (delete(connection, mapping, id)) {
                        deleted++;
                    }
                }
            }
            logger.debug("Deleted {} documents of type {} matching {}", deleted, mapping.getTypeName(), filter);
            return deleted;
        });
    }

    @Override
    public <T> List<Document<T>> query(Query<T> query) throws StoreException {
        DocumentMapping<Object> mapping = mappingOf(query.getDocumentClass());
        List<IndexCondition> conditions = conditions(mapping, query.getFilter());
        IndexOrder order = null;
        if (query.getOrderBy() != null) {
            IndexedField<Object> field = mapping.requireIndex(query.getOrderBy());
            order = new IndexOrder(field.getName(), field.getKind().isNumeric(), query.isDescending());
        }
        IndexOrder sort = order;
        return withConnection(mapping.getTypeName(), connection -> {
            List<Document<T>> result = new ArrayList<>();
            try (PreparedStatement st = schema.selectDocuments(connection, mapping.getTypeName(), conditions, sort,
                query.getLimit(), query.getOffset());
                    ResultSet rs = st.executeQuery()) {
                while (rs.next()) {
                    result.add(readDocument(rs, mapping, query.getDocumentClass()));
                }
            }
            return result;
        });
    }

    @Override
    public long count(Class<?> documentClass, Filter filter) throws StoreException {
        DocumentMapping<Object> mapping = mappingOf(documentClass);
        List<IndexCondition> conditions = conditions(mapping, filter);
        return withConnection(mapping.getTypeName(), connection -> {
            try (PreparedStatement st = schema.countDocuments(connection, mapping.getTypeName(), conditions);
                    ResultSet rs = st.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        });
    }

    /**
     * Document operations on a connection of an ongoing transaction.
     * @param connection the connection
     * @return session that does not commit
     */
    public DocumentSession session(Connection connection) {
        return new JdbcDocumentSession(connection);
    }

    int deleteAllOfType(Connection connection, String type) throws SQLException {
        try (PreparedStatement index = schema.deleteIndexEntriesOfType(connection, type);
                PreparedStatement documents = schema.deleteDocumentsOfType(connection, type)) {
            index.executeUpdate();
            return documents.executeUpdate();
        }
    }

    int deleteAllOfType(Connection connection, Class<?> documentClass) throws SQLException, StoreException {
        return deleteAllOfType(connection, mappingOf(documentClass).getTypeName());
    }

    private DocumentMapping<Object> mappingOf(Class<?> documentClass) throws StoreException {
        Optional<? extends DocumentMapping<?>> mapping = mappings.mappingFor(documentClass);
        if (!mapping.isPresent()) {
            throw StoreException.unmapped(documentClass);
        }
        return (DocumentMapping<Object>) mapping.get();
    }

    private String write(Object document, WriteMode mode, String expectedToken) throws StoreException {
        Objects.requireNonNull(document, "Document cannot be null");
        DocumentMapping<Object> mapping = mappingOf(document.getClass());
        String id = mapping.idOf(document);
        return inTransaction(StoreException.documentKey(mapping.getTypeName(), id),
            connection -> write(connection, mapping, id, document, mode, expectedToken));
    }

    private String write(Connection connection, DocumentMapping<Object> mapping, String id, Object document,
            WriteMode mode, String expectedToken) throws SQLException, StoreException {
        String type = mapping.getTypeName();
        String data = serialize(mapping, id, document);
        String token = UUID.randomUUID().toString();
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        switch (mode) {
            case OVERWRITE:
                if (executeUpdate(schema.updateDocument(connection, type, id, data, token, now)) == 0) {
                    insert(connection, type, id, data, token, now);
                }
                break;
            case EXPECT_TOKEN:
                if (executeUpdate(schema.updateDocumentChecked(connection, type, id, data, token, expectedToken,
                    now)) == 0) {
                    throw StoreException.documentConflict(type, id, expectedToken);
                }
                break;
            case INSERT:
                insert(connection, type, id, data, token, now);
                break;
            default:
                throw new IllegalStateException("Unknown write mode " + mode);
        }
        replaceIndex(connection, mapping, id, document);
        logger.debug("Stored {} {} as version {}", type, id, token);
        return token;
    }

    private void insert(Connection connection, String type, String id, String data, String token, Instant now)
            throws SQLException, StoreException {
        try {
            executeUpdate(schema.insertDocument(connection, type, id, data, token, now));
        } catch (SQLException e) {
            if (SqlStates.isConflict(e)) {
                throw StoreException.documentExists(type, id, e);
            }
            throw e;
        }
    }

    private void replaceIndex(Connection connection, DocumentMapping<Object> mapping, String id, Object document)
            throws SQLException {
        String type = mapping.getTypeName();
        executeUpdate(schema.deleteIndexEntries(connection, type, id));
        if (mapping.getIndexes().isEmpty()) {
            return;
        }
        try (PreparedStatement insert = schema.insertIndexEntry(connection)) {
            boolean any = false;
            for (IndexedField<Object> field : mapping.getIndexes()) {
                Object value = field.indexValueOf(document);
                if (value == null) {
                    continue;
                }
                if (field.getKind().isNumeric()) {
                    schema.prepareIndexInsert(insert, type, id, field.getName(), null, (BigDecimal) value);
                } else {
                    schema.prepareIndexInsert(insert, type, id, field.getName(), (String) value, null);
                }
                insert.addBatch();
                any = true;
            }
            if (any) {
                insert.executeBatch();
            }
        }
    }

    private boolean delete(Connection connection, DocumentMapping<Object> mapping, String id) throws SQLException {
        executeUpdate(schema.deleteIndexEntries(connection, mapping.getTypeName(), id));
        boolean deleted = executeUpdate(schema.deleteDocument(connection, mapping.getTypeName(), id)) > 0;
        if (deleted) {
            logger.debug("Deleted {} {}", mapping.getTypeName(), id);
        }
        return deleted;
    }

    private <T> Optional<Document<T>> load(Connection connection, DocumentMapping<Object> mapping,
            Class<T> documentClass, String id) throws SQLException, StoreException {
        try (PreparedStatement st = schema.selectDocument(connection, mapping.getTypeName(), id);
                ResultSet rs = st.executeQuery()) {
            if (rs.next()) {
                return Optional.of(readDocument(rs, mapping, documentClass));
            } else {
                return Optional.empty();
            }
        }
    }

    private <T> Document<T> readDocument(ResultSet rs, DocumentMapping<Object> mapping, Class<T> documentClass)
            throws SQLException, StoreException {
        String id = schema.readDocumentId(rs);
        String data = schema.readDocumentData(rs);
        T value;
        try {
            value = mapper.readValue(data, documentClass);
        } catch (JsonProcessingException e) {
            throw StoreException.undecodable(StoreException.documentKey(mapping.getTypeName(), id),
                e.getOriginalMessage(), e);
        }
        return new Document<>(mapping.getTypeName(), id, value, schema.readDocumentVersionToken(rs),
                schema.readDocumentLastModified(rs));
    }

    private String serialize(DocumentMapping<Object> mapping, String id, Object document) throws StoreException {
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw StoreException.unencodable(StoreException.documentKey(mapping.getTypeName(), id), document, e);
        }
    }

    private List<IndexCondition> conditions(DocumentMapping<Object> mapping, Filter filter) {
        List<IndexCondition> result = new ArrayList<>();
        for (Filter.Comparison comparison : filter.comparisons()) {
            IndexedField<Object> field = mapping.requireIndex(comparison.getField());
            result.add(new IndexCondition(field.getName(), comparison.getOperator(), field.getKind().isNumeric(),
                    field.toIndexValue(comparison.getValue())));
        }
        return result;
    }

    private static int executeUpdate(PreparedStatement statement) throws SQLException {
        try (PreparedStatement st = statement) {
            return st.executeUpdate();
        }
    }

    @Override
    protected StoreException translate(String key, SQLException e) {
        if (SqlStates.isConflict(e)) {
            return StoreException.concurrentModification(key, e);
        }
        return super.translate(key, e);
    }

    private class JdbcDocumentSession implements DocumentSession {
        private final Connection connection;

        JdbcDocumentSession(Connection connection) {
            this.connection = connection;
        }

        @Override
        public <T> Optional<Document<T>> load(Class<T> documentClass, String id) throws StoreException {
            DocumentMapping<Object> mapping = mappingOf(documentClass);
            try {
                return JdbcDocumentStore.this.load(connection, mapping, documentClass, id);
            } catch (SQLException e) {
                throw translate(StoreException.documentKey(mapping.getTypeName(), id), e);
            }
        }

        @Override
        public <T> String insert(Class<T> documentClass, String id, T document) throws StoreException {
            return write(documentClass, id, document, WriteMode.INSERT, null);
        }

        @Override
        public <T> String replace(Class<T> documentClass, String id, T document, String expectedToken)
                throws StoreException {
            Objects.requireNonNull(expectedToken, "Expected version token cannot be null");
            return write(documentClass, id, document, WriteMode.EXPECT_TOKEN, expectedToken);
        }

        private String write(Class<?> documentClass, String id, Object document, WriteMode mode,
                String expectedToken) throws StoreException {
            DocumentMapping<Object> mapping = mappingOf(documentClass);
            try {
                return JdbcDocumentStore.this.write(connection, mapping, id, document, mode, expectedToken);
            } catch (SQLException e) {
                throw translate(StoreException.documentKey(mapping.getTypeName(), id), e);
            }
        }

        @Override
        public void delete(Class<?> documentClass, String id, String expectedToken) throws StoreException {
            Objects.requireNonNull(expectedToken, "Expected version token cannot be null");
            DocumentMapping<Object> mapping = mappingOf(documentClass);
            String type = mapping.getTypeName();
            try {
                if (executeUpdate(schema.deleteDocumentChecked(connection, type, id, expectedToken)) == 0) {
                    throw StoreException.documentConflict(type, id, expectedToken);
                }
                executeUpdate(schema.deleteIndexEntries(connection, type, id));
                logger.debug("Deleted {} {} at version {}", type, id, expectedToken);
            } catch (SQLException e) {
                throw translate(StoreException.documentKey(type, id), e);
            }
        }
    }
}
