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

import io.github.esdoc.event.StreamState;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * JDBC schema of four tables sharing a common prefix. With default prefix {@code es_} following tables are used:
 * <ul>
 * <li><em>es_streams</em>(STREAM_ID, AGGREGATE_TYPE, VERSION, CREATED_AT, UPDATED_AT) primary key (STREAM_ID)</li>
 * <li><em>es_events</em>(SEQ_ID, STREAM_ID, VERSION, EVENT_TYPE, PAYLOAD_VERSION, PAYLOAD, RECORDED_AT) primary key
 * (SEQ_ID), unique (STREAM_ID, VERSION)</li>
 * <li><em>es_documents</em>(DOC_TYPE, ID, DATA, VERSION_TOKEN, LAST_MODIFIED) primary key (DOC_TYPE, ID)</li>
 * <li><em>es_document_index</em>(DOC_TYPE, ID, FIELD_NAME, TEXT_VALUE, NUM_VALUE) primary key
 * (DOC_TYPE, ID, FIELD_NAME)</li>
 * </ul>
 * The statements work on PostgreSQL and on H2.
 */
public class DefaultJdbcSchema extends JdbcSchema {
    public static final String DEFAULT_PREFIX = "es_";

    private final String prefix;
    private final TableDefinition streamTable;
    private final TableDefinition eventTable;
    private final TableDefinition documentTable;
    private final TableDefinition indexTable;

    public DefaultJdbcSchema() {
        this(DEFAULT_PREFIX);
    }

    public DefaultJdbcSchema(String prefix) {
        if (!prefix.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("Invalid table prefix: " + prefix);
        }
        this.prefix = prefix;
        this.streamTable = TableDefinition.table(prefix + "streams")
                .column("STREAM_ID", "VARCHAR(250) NOT NULL PRIMARY KEY")
                .column("AGGREGATE_TYPE", "VARCHAR(250)")
                .column("VERSION", "BIGINT NOT NULL")
                .column("CREATED_AT", "TIMESTAMP NOT NULL")
                .column("UPDATED_AT", "TIMESTAMP NOT NULL")
                .build();
        this.eventTable = TableDefinition.table(prefix + "events")
                .column("SEQ_ID", "BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY")
                .column("STREAM_ID", "VARCHAR(250) NOT NULL")
                .column("VERSION", "BIGINT NOT NULL")
                .column("EVENT_TYPE", "VARCHAR(250) NOT NULL")
                .column("PAYLOAD_VERSION", "INT NOT NULL")
                .column("PAYLOAD", "VARCHAR NOT NULL")
                .column("RECORDED_AT", "TIMESTAMP NOT NULL")
                .constraint("CONSTRAINT " + prefix + "events_stream_version UNIQUE (STREAM_ID, VERSION)")
                .build();
        this.documentTable = TableDefinition.table(prefix + "documents")
                .column("DOC_TYPE", "VARCHAR(250) NOT NULL")
                .column("ID", "VARCHAR(250) NOT NULL")
                .column("DATA", "VARCHAR NOT NULL")
                .column("VERSION_TOKEN", "VARCHAR(64) NOT NULL")
                .column("LAST_MODIFIED", "TIMESTAMP NOT NULL")
                .constraint("CONSTRAINT " + prefix + "documents_pk PRIMARY KEY (DOC_TYPE, ID)")
                .build();
        this.indexTable = TableDefinition.table(prefix + "document_index")
                .column("DOC_TYPE", "VARCHAR(250) NOT NULL")
                .column("ID", "VARCHAR(250) NOT NULL")
                .column("FIELD_NAME", "VARCHAR(250) NOT NULL")
                .column("TEXT_VALUE", "VARCHAR(1000)")
                .column("NUM_VALUE", "DECIMAL(38,10)")
                .constraint("CONSTRAINT " + prefix + "document_index_pk PRIMARY KEY (DOC_TYPE, ID, FIELD_NAME)")
                .index(prefix + "document_index_text", "DOC_TYPE, FIELD_NAME, TEXT_VALUE")
                .index(prefix + "document_index_num", "DOC_TYPE, FIELD_NAME, NUM_VALUE")
                .build();
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public List<TableDefinition> tables() {
        return Collections.unmodifiableList(Arrays.asList(streamTable, eventTable, documentTable, indexTable));
    }

    @Override
    public TableDefinition streamTable() {
        return streamTable;
    }

    @Override
    public TableDefinition eventTable() {
        return eventTable;
    }

    @Override
    public TableDefinition documentTable() {
        return documentTable;
    }

    @Override
    public TableDefinition indexTable() {
        return indexTable;
    }

    @Override
    protected List<String> clearTables(List<TableDefinition> tables) {
        List<String> result = new ArrayList<>();
        for (TableDefinition table : tables) {
            result.add("DELETE FROM " + table.getName());
        }
        return result;
    }

    // streams

    @Override
    protected PreparedStatement selectStream(Connection connection, String streamId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT STREAM_ID, AGGREGATE_TYPE, VERSION, CREATED_AT, "
                + "UPDATED_AT FROM " + streamTable.getName() + " WHERE STREAM_ID=?");
        st.setString(1, streamId);
        return st;
    }

    @Override
    protected StreamState readStreamState(ResultSet rs) throws SQLException {
        return new StreamState(rs.getString(1), rs.getString(2), rs.getLong(3), toInstant(rs.getTimestamp(4)),
            toInstant(rs.getTimestamp(5)));
    }

    @Override
    protected PreparedStatement insertStream(Connection connection, String streamId, String aggregateType,
            Instant createdAt) throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + streamTable.getName()
                + " (STREAM_ID, AGGREGATE_TYPE, VERSION, CREATED_AT, UPDATED_AT) VALUES (?, ?, 0, ?, ?)");
        st.setString(1, streamId);
        if (aggregateType == null) {
            st.setNull(2, Types.VARCHAR);
        } else {
            st.setString(2, aggregateType);
        }
        st.setTimestamp(3, Timestamp.from(createdAt));
        st.setTimestamp(4, Timestamp.from(createdAt));
        return st;
    }

    @Override
    protected PreparedStatement updateStreamVersion(Connection connection, String streamId, long startVersion,
            long endVersion, Instant updatedAt) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + streamTable.getName()
                + " SET VERSION=?, UPDATED_AT=? WHERE STREAM_ID=? AND VERSION=?");
        st.setLong(1, endVersion);
        st.setTimestamp(2, Timestamp.from(updatedAt));
        st.setString(3, streamId);
        st.setLong(4, startVersion);
        return st;
    }

    @Override
    protected PreparedStatement deleteStream(Connection connection, String streamId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + streamTable.getName()
                + " WHERE STREAM_ID=?");
        st.setString(1, streamId);
        return st;
    }

    // events

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + eventTable.getName()
                + " (STREAM_ID, VERSION, EVENT_TYPE, PAYLOAD_VERSION, PAYLOAD, RECORDED_AT) VALUES (?,?,?,?,?,?)",
            Statement.RETURN_GENERATED_KEYS);
    }

    @Override
    protected void prepareEventInsert(PreparedStatement insertEvent, String streamId, long version, String type,
            int payloadVersion, String payload, Instant recordedAt) throws SQLException {
        insertEvent.setString(1, streamId);
        insertEvent.setLong(2, version);
        insertEvent.setString(3, type);
        insertEvent.setInt(4, payloadVersion);
        insertEvent.setString(5, payload);
        insertEvent.setTimestamp(6, Timestamp.from(recordedAt));
    }

    @Override
    protected long readGeneratedSequence(ResultSet generatedKeys) throws SQLException {
        // SEQ_ID is the first column of the table, PostgreSQL returns all columns
        return generatedKeys.getLong(1);
    }

    private String eventColumns() {
        return "SELECT SEQ_ID, STREAM_ID, VERSION, EVENT_TYPE, PAYLOAD_VERSION, PAYLOAD, RECORDED_AT FROM "
                + eventTable.getName();
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, String streamId, long fromVersion,
            long toVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement(eventColumns()
                + " WHERE STREAM_ID=? AND VERSION >= ? AND VERSION <= ? ORDER BY VERSION");
        st.setString(1, streamId);
        st.setLong(2, fromVersion);
        st.setLong(3, toVersion);
        return st;
    }

    @Override
    protected PreparedStatement selectAllEvents(Connection connection, long afterSequence, int limit)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement(eventColumns()
                + " WHERE SEQ_ID > ? ORDER BY SEQ_ID FETCH FIRST ? ROWS ONLY");
        st.setLong(1, afterSequence);
        st.setInt(2, limit);
        return st;
    }

    @Override
    protected PreparedStatement deleteStreamEvents(Connection connection, String streamId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + eventTable.getName()
                + " WHERE STREAM_ID=?");
        st.setString(1, streamId);
        return st;
    }

    @Override
    protected long readEventSequence(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected String readEventStreamId(ResultSet rs) throws SQLException {
        return rs.getString(2);
    }

    @Override
    protected long readEventVersion(ResultSet rs) throws SQLException {
        return rs.getLong(3);
    }

    @Override
    protected String readEventType(ResultSet rs) throws SQLException {
        return rs.getString(4);
    }

    @Override
    protected int readEventPayloadVersion(ResultSet rs) throws SQLException {
        return rs.getInt(5);
    }

    @Override
    protected String readEventPayload(ResultSet rs) throws SQLException {
        return rs.getString(6);
    }

    @Override
    protected Instant readEventRecordedAt(ResultSet rs) throws SQLException {
        return toInstant(rs.getTimestamp(7));
    }

    // documents

    @Override
    protected PreparedStatement selectDocument(Connection connection, String type, String id) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT d.ID, d.DATA, d.VERSION_TOKEN, d.LAST_MODIFIED FROM "
                + documentTable.getName() + " d WHERE d.DOC_TYPE=? AND d.ID=?");
        st.setString(1, type);
        st.setString(2, id);
        return st;
    }

    @Override
    protected PreparedStatement insertDocument(Connection connection, String type, String id, String data,
            String versionToken, Instant lastModified) throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + documentTable.getName()
                + " (DOC_TYPE, ID, DATA, VERSION_TOKEN, LAST_MODIFIED) VALUES (?, ?, ?, ?, ?)");
        st.setString(1, type);
        st.setString(2, id);
        st.setString(3, data);
        st.setString(4, versionToken);
        st.setTimestamp(5, Timestamp.from(lastModified));
        return st;
    }

    @Override
    protected PreparedStatement updateDocument(Connection connection, String type, String id, String data,
            String versionToken, Instant lastModified) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + documentTable.getName()
                + " SET DATA=?, VERSION_TOKEN=?, LAST_MODIFIED=? WHERE DOC_TYPE=? AND ID=?");
        st.setString(1, data);
        st.setString(2, versionToken);
        st.setTimestamp(3, Timestamp.from(lastModified));
        st.setString(4, type);
        st.setString(5, id);
        return st;
    }

    @Override
    protected PreparedStatement updateDocumentChecked(Connection connection, String type, String id, String data,
            String versionToken, String expectedToken, Instant lastModified) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + documentTable.getName()
                + " SET DATA=?, VERSION_TOKEN=?, LAST_MODIFIED=? WHERE DOC_TYPE=? AND ID=? AND VERSION_TOKEN=?");
        st.setString(1, data);
        st.setString(2, versionToken);
        st.setTimestamp(3, Timestamp.from(lastModified));
        st.setString(4, type);
        st.setString(5, id);
        st.setString(6, expectedToken);
        return st;
    }

    @Override
    protected PreparedStatement deleteDocument(Connection connection, String type, String id) throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + documentTable.getName()
                + " WHERE DOC_TYPE=? AND ID=?");
        st.setString(1, type);
        st.setString(2, id);
        return st;
    }

    @Override
    protected PreparedStatement deleteDocumentChecked(Connection connection, String type, String id,
            String expectedToken) throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + documentTable.getName()
                + " WHERE DOC_TYPE=? AND ID=? AND VERSION_TOKEN=?");
        st.setString(1, type);
        st.setString(2, id);
        st.setString(3, expectedToken);
        return st;
    }

    @Override
    protected PreparedStatement deleteDocumentsOfType(Connection connection, String type) throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + documentTable.getName()
                + " WHERE DOC_TYPE=?");
        st.setString(1, type);
        return st;
    }

    @Override
    protected PreparedStatement selectDocuments(Connection connection, String type, List<IndexCondition> conditions,
            IndexOrder order, OptionalInt limit, int offset) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT d.ID, d.DATA, d.VERSION_TOKEN, d.LAST_MODIFIED");
        List<Object> params = new ArrayList<>();
        appendFromAndJoins(sql, params, conditions);
        if (order != null) {
            sql.append(" LEFT JOIN ").append(indexTable.getName())
                    .append(" o ON o.DOC_TYPE = d.DOC_TYPE AND o.ID = d.ID AND o.FIELD_NAME = ?");
            params.add(order.getField());
        }
        appendWhere(sql, params, type, conditions);
        sql.append(" ORDER BY ");
        if (order != null) {
            sql.append(order.isNumeric() ? "o.NUM_VALUE" : "o.TEXT_VALUE")
                    .append(order.isDescending() ? " DESC" : " ASC")
                    .append(" NULLS LAST, ");
        }
        sql.append("d.ID");
        if (offset > 0 || limit.isPresent()) {
            sql.append(" OFFSET ? ROWS");
            params.add(offset);
        }
        if (limit.isPresent()) {
            sql.append(" FETCH FIRST ? ROWS ONLY");
            params.add(limit.getAsInt());
        }
        return prepare(connection, sql.toString(), params);
    }

    @Override
    protected PreparedStatement selectDocumentIds(Connection connection, String type, List<IndexCondition> conditions)
            throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT d.ID");
        List<Object> params = new ArrayList<>();
        appendFromAndJoins(sql, params, conditions);
        appendWhere(sql, params, type, conditions);
        return prepare(connection, sql.toString(), params);
    }

    @Override
    protected PreparedStatement countDocuments(Connection connection, String type, List<IndexCondition> conditions)
            throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*)");
        List<Object> params = new ArrayList<>();
        appendFromAndJoins(sql, params, conditions);
        appendWhere(sql, params, type, conditions);
        return prepare(connection, sql.toString(), params);
    }

    private void appendFromAndJoins(StringBuilder sql, List<Object> params, List<IndexCondition> conditions) {
        sql.append(" FROM ").append(documentTable.getName()).append(" d");
        for (int i = 0; i < conditions.size(); i++) {
            String alias = "c" + i;
            sql.append(" JOIN ").append(indexTable.getName()).append(' ').append(alias)
                    .append(" ON ").append(alias).append(".DOC_TYPE = d.DOC_TYPE AND ")
                    .append(alias).append(".ID = d.ID AND ")
                    .append(alias).append(".FIELD_NAME = ?");
            params.add(conditions.get(i).getField());
        }
    }

    private void appendWhere(StringBuilder sql, List<Object> params, String type, List<IndexCondition> conditions) {
        sql.append(" WHERE d.DOC_TYPE = ?");
        params.add(type);
        for (int i = 0; i < conditions.size(); i++) {
            IndexCondition condition = conditions.get(i);
            sql.append(" AND c").append(i).append(condition.isNumeric() ? ".NUM_VALUE " : ".TEXT_VALUE ")
                    .append(condition.getOperator().sql()).append(" ?");
            params.add(condition.getValue());
        }
    }

    private PreparedStatement prepare(Connection connection, String sql, List<Object> params) throws SQLException {
        PreparedStatement st = connection.prepareStatement(sql);
        try {
            for (int i = 0; i < params.size(); i++) {
                Object param = params.get(i);
                if (param instanceof BigDecimal) {
                    st.setBigDecimal(i + 1, (BigDecimal) param);
                } else if (param instanceof Integer) {
                    st.setInt(i + 1, (Integer) param);
                } else {
                    st.setString(i + 1, String.valueOf(param));
                }
            }
            return st;
        } catch (SQLException | RuntimeException e) {
            st.close();
            throw e;
        }
    }

    @Override
    protected String readDocumentId(ResultSet rs) throws SQLException {
        return rs.getString(1);
    }

    @Override
    protected String readDocumentData(ResultSet rs) throws SQLException {
        return rs.getString(2);
    }

    @Override
    protected String readDocumentVersionToken(ResultSet rs) throws SQLException {
        return rs.getString(3);
    }

    @Override
    protected Instant readDocumentLastModified(ResultSet rs) throws SQLException {
        return toInstant(rs.getTimestamp(4));
    }

    // document index

    @Override
    protected PreparedStatement insertIndexEntry(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + indexTable.getName()
                + " (DOC_TYPE, ID, FIELD_NAME, TEXT_VALUE, NUM_VALUE) VALUES (?, ?, ?, ?, ?)");
    }

    @Override
    protected void prepareIndexInsert(PreparedStatement insertIndexEntry, String type, String id, String field,
            String textValue, BigDecimal numberValue) throws SQLException {
        insertIndexEntry.setString(1, type);
        insertIndexEntry.setString(2, id);
        insertIndexEntry.setString(3, field);
        if (textValue == null) {
            insertIndexEntry.setNull(4, Types.VARCHAR);
        } else {
            insertIndexEntry.setString(4, textValue);
        }
        if (numberValue == null) {
            insertIndexEntry.setNull(5, Types.DECIMAL);
        } else {
            insertIndexEntry.setBigDecimal(5, numberValue);
        }
    }

    @Override
    protected PreparedStatement deleteIndexEntries(Connection connection, String type, String id) throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + indexTable.getName()
                + " WHERE DOC_TYPE=? AND ID=?");
        st.setString(1, type);
        st.setString(2, id);
        return st;
    }

    @Override
    protected PreparedStatement deleteIndexEntriesOfType(Connection connection, String type) throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + indexTable.getName()
                + " WHERE DOC_TYPE=?");
        st.setString(1, type);
        return st;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
