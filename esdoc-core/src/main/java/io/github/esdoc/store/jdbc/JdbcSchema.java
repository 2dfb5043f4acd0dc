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
import java.time.Instant;
import java.util.List;
import java.util.OptionalInt;

/**
 * Abstraction of the database layout. JDBC stores only know the statements this class prepares and the columns it
 * reads, so a different layout or dialect is supported by overriding it.
 *
 * <p>Each {@code select*} method returns a statement whose result set is read by the matching {@code read*}
 * methods.</p>
 */
public abstract class JdbcSchema {

    // streams

    protected abstract PreparedStatement selectStream(Connection connection, String streamId) throws SQLException;

    protected abstract StreamState readStreamState(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement insertStream(Connection connection, String streamId, String aggregateType,
            Instant createdAt) throws SQLException;

    /**
     * Update version of a stream, provided it is still at {@code startVersion}.
     * @return statement that updates exactly one row when no other writer advanced the stream
     */
    protected abstract PreparedStatement updateStreamVersion(Connection connection, String streamId,
            long startVersion, long endVersion, Instant updatedAt) throws SQLException;

    protected abstract PreparedStatement deleteStream(Connection connection, String streamId) throws SQLException;

    // events

    /**
     * Statement for inserting single event, that returns generated sequence number.
     */
    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    protected abstract void prepareEventInsert(PreparedStatement insertEvent, String streamId, long version,
            String type, int payloadVersion, String payload, Instant recordedAt) throws SQLException;

    protected abstract long readGeneratedSequence(ResultSet generatedKeys) throws SQLException;

    protected abstract PreparedStatement selectEvents(Connection connection, String streamId, long fromVersion,
            long toVersion) throws SQLException;

    protected abstract PreparedStatement selectAllEvents(Connection connection, long afterSequence, int limit)
            throws SQLException;

    protected abstract PreparedStatement deleteStreamEvents(Connection connection, String streamId)
            throws SQLException;

    protected abstract long readEventSequence(ResultSet rs) throws SQLException;

    protected abstract String readEventStreamId(ResultSet rs) throws SQLException;

    protected abstract long readEventVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventType(ResultSet rs) throws SQLException;

    protected abstract int readEventPayloadVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventPayload(ResultSet rs) throws SQLException;

    protected abstract Instant readEventRecordedAt(ResultSet rs) throws SQLException;

    // documents

    protected abstract PreparedStatement selectDocument(Connection connection, String type, String id)
            throws SQLException;

    protected abstract PreparedStatement insertDocument(Connection connection, String type, String id, String data,
            String versionToken, Instant lastModified) throws SQLException;

    protected abstract PreparedStatement updateDocument(Connection connection, String type, String id, String data,
            String versionToken, Instant lastModified) throws SQLException;

    /**
     * Update a document only when its stored version token equals {@code expectedToken}.
     */
    protected abstract PreparedStatement updateDocumentChecked(Connection connection, String type, String id,
            String data, String versionToken, String expectedToken, Instant lastModified) throws SQLException;

    protected abstract PreparedStatement deleteDocument(Connection connection, String type, String id)
            throws SQLException;

    /**
     * Delete a document only when its stored version token equals {@code expectedToken}.
     */
    protected abstract PreparedStatement deleteDocumentChecked(Connection connection, String type, String id,
            String expectedToken) throws SQLException;

    protected abstract PreparedStatement deleteDocumentsOfType(Connection connection, String type)
            throws SQLException;

    protected abstract PreparedStatement selectDocuments(Connection connection, String type,
            List<IndexCondition> conditions, IndexOrder order, OptionalInt limit, int offset) throws SQLException;

    protected abstract PreparedStatement selectDocumentIds(Connection connection, String type,
            List<IndexCondition> conditions) throws SQLException;

    protected abstract PreparedStatement countDocuments(Connection connection, String type,
            List<IndexCondition> conditions) throws SQLException;

    protected abstract String readDocumentId(ResultSet rs) throws SQLException;

    protected abstract String readDocumentData(ResultSet rs) throws SQLException;

    protected abstract String readDocumentVersionToken(ResultSet rs) throws SQLException;

    protected abstract Instant readDocumentLastModified(ResultSet rs) throws SQLException;

    // document index

    protected abstract PreparedStatement insertIndexEntry(Connection connection) throws SQLException;

    /**
     * Bind one index value. Exactly one of {@code textValue} and {@code numberValue} is not null.
     */
    protected abstract void prepareIndexInsert(PreparedStatement insertIndexEntry, String type, String id,
            String field, String textValue, BigDecimal numberValue) throws SQLException;

    protected abstract PreparedStatement deleteIndexEntries(Connection connection, String type, String id)
            throws SQLException;

    protected abstract PreparedStatement deleteIndexEntriesOfType(Connection connection, String type)
            throws SQLException;

    // maintenance

    /**
     * Tables in order of creation.
     * @return table definitions
     */
    public abstract List<TableDefinition> tables();

    public abstract TableDefinition streamTable();

    public abstract TableDefinition eventTable();

    public abstract TableDefinition documentTable();

    public abstract TableDefinition indexTable();

    /**
     * Statements removing all rows of given tables, leaving the tables in place.
     * @param tables tables to clear
     * @return the statements, to be executed in order
     */
    protected abstract List<String> clearTables(List<TableDefinition> tables);
}
