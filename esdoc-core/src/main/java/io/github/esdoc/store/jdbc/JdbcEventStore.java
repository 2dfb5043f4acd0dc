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

import io.github.esdoc.event.EventStore;
import io.github.esdoc.event.EventTypes;
import io.github.esdoc.event.ExpectedVersion;
import io.github.esdoc.event.RecordedEvent;
import io.github.esdoc.projection.ProjectionEngine;
import io.github.esdoc.store.Serialization;
import io.github.esdoc.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Event store appending to the event table and applying inline projections in the same transaction.
 *
 * <p>An append reads the stream row, checks the expected version, inserts the events with consecutive versions, and
 * moves the stream version with a compare-and-swap update. A concurrent writer that appended in between makes either
 * the version update or the unique key on stream and version fail, which is reported as
 * {@link StoreException.Fault#CONCURRENCY_CONFLICT}. Projections see the events with their sequence numbers assigned,
 * and write their documents on the same connection before commit.</p>
 */
public class JdbcEventStore extends JdbcSupport implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);
    static final int REPLAY_BATCH = 500;

    private final Serialization<Object> serialization;
    private final JdbcEventLog eventLog;
    private final JdbcDocumentStore documents;
    private final ProjectionEngine projections;
    private final EventTypes eventTypes;

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<Object> serialization,
            JdbcEventLog eventLog, JdbcDocumentStore documents, ProjectionEngine projections, EventTypes eventTypes,
            TxHandler handler) {
        super(dataSource, schema, handler);
        this.serialization = Objects.requireNonNull(serialization);
        this.eventLog = Objects.requireNonNull(eventLog);
        this.documents = Objects.requireNonNull(documents);
        this.projections = Objects.requireNonNull(projections);
        this.eventTypes = Objects.requireNonNull(eventTypes);
    }

    protected Object checkCast(String streamId, Object event) throws StoreException {
        Object cast = event == null ? null : serialization.toSerializable(event);
        if (cast == null) {
            throw StoreException.unsupported(streamId, event);
        } else {
            return cast;
        }
    }

    @Override
    public long append(String streamId, String aggregateType, ExpectedVersion expectedVersion, List<?> events)
            throws StoreException {
        Objects.requireNonNull(streamId, "Stream id cannot be null");
        Objects.requireNonNull(expectedVersion, "Expected version cannot be null");
        PersistTemplate template = createTemplate(streamId, aggregateType, expectedVersion);
        for (Object event : events) {
            template.addEvent(event);
        }
        return template.persist();
    }

    /**
     * Delete all documents maintained by projections of given document class and rebuild them by replaying the whole
     * event log, in a single transaction.
     * @param documentClass document class of the projection
     * @return number of replayed events
     * @throws StoreException when replay or storage fails, existing documents are kept then
     */
    public long rebuildProjection(Class<?> documentClass) throws StoreException {
        ProjectionEngine engine = projections.restrictedTo(documentClass, eventTypes);
        if (engine.isEmpty()) {
            throw StoreException.invalid(documentClass.getName(), "No projection maintains "
                    + documentClass.getName());
        }
        return inTransaction(documentClass.getSimpleName(), connection -> {
            int deleted = documents.deleteAllOfType(connection, documentClass);
            long replayed = 0;
            long after = 0;
            List<RecordedEvent<Object>> batch;
            do {
                batch = eventLog.readAll(connection, after, REPLAY_BATCH);
                if (!batch.isEmpty()) {
                    engine.apply(batch, documents.session(connection));
                    after = batch.get(batch.size() - 1).getSequence();
                    replayed += batch.size();
                }
            } while (batch.size() == REPLAY_BATCH);
            logger.info("Rebuilt {}: removed {} documents, replayed {} events", documentClass.getSimpleName(),
                deleted, replayed);
            return replayed;
        });
    }

    protected PersistTemplate createTemplate(String streamId, String aggregateType, ExpectedVersion expectedVersion) {
        return new PersistTemplate(streamId, aggregateType, expectedVersion);
    }

    protected class PersistTemplate {
        private final String streamId;
        private final String aggregateType;
        private final ExpectedVersion expectedVersion;
        private final List<PendingEvent> events = new ArrayList<>();
        private long startVersion;

        PersistTemplate(String streamId, String aggregateType, ExpectedVersion expectedVersion) {
            this.streamId = streamId;
            this.aggregateType = aggregateType;
            this.expectedVersion = expectedVersion;
        }

        void addEvent(Object event) throws StoreException {
            Object serializable = checkCast(streamId, event);
            String payload;
            try {
                payload = serialization.serialize(serializable);
            } catch (RuntimeException e) {
                throw StoreException.unencodable(streamId, event, e);
            }
            events.add(new PendingEvent(serializable, serialization.typeName(serializable),
                    serialization.payloadVersion(serializable), payload));
        }

        public long persist() throws StoreException {
            if (events.isEmpty()) {
                return withConnection(streamId, this::checkCurrentVersion);
            }
            try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
                try {
                    startVersion = checkSourceVersion(connection);
                    Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
                    List<RecordedEvent<Object>> recorded = storeEvents(connection, now);
                    long endVersion = startVersion + events.size();
                    updateVersion(connection, endVersion, now);
                    projections.apply(recorded, documents.session(connection));
                    txHandler.commit(connection);
                    logger.debug("Appended {} events to {}, now at version {}", events.size(), streamId, endVersion);
                    return endVersion;
                } catch (SQLException | StoreException | RuntimeException e) {
                    rollback(connection, e);
                    throw e;
                }
            } catch (SQLException ex) {
                if (SqlStates.isConflict(ex)) {
                    throw StoreException.concurrentAppend(streamId, startVersion, ex);
                }
                throw StoreException.storeFailed(streamId, ex);
            }
        }

        private long checkSourceVersion(Connection connection) throws SQLException, StoreException {
            try (PreparedStatement selectStream = schema.selectStream(connection, streamId);
                    ResultSet rs = selectStream.executeQuery()) {
                if (!rs.next()) {
                    checkMissingStream();
                    // no stream yet - create it at version 0.
                    try (PreparedStatement createStream = schema.insertStream(connection, streamId, aggregateType,
                        Instant.now().truncatedTo(ChronoUnit.MILLIS))) {
                        createStream.executeUpdate();
                    }
                    return 0;
                }
                long version = schema.readStreamState(rs).getVersion();
                checkExistingStream(version);
                return version;
            }
        }

        // appending nothing still has to satisfy the expected version
        private long checkCurrentVersion(Connection connection) throws SQLException, StoreException {
            try (PreparedStatement selectStream = schema.selectStream(connection, streamId);
                    ResultSet rs = selectStream.executeQuery()) {
                if (!rs.next()) {
                    checkMissingStream();
                    return 0;
                }
                long version = schema.readStreamState(rs).getVersion();
                checkExistingStream(version);
                return version;
            }
        }

        private void checkMissingStream() throws StoreException {
            if (expectedVersion.isStreamExists()) {
                throw StoreException.streamNotFound(streamId);
            }
            if (expectedVersion.isExact() && expectedVersion.getVersion() != 0) {
                throw StoreException.streamVersionConflict(streamId, expectedVersion.getVersion(), 0);
            }
        }

        private void checkExistingStream(long version) throws StoreException {
            if (expectedVersion.isNoStream() && version > 0) {
                throw StoreException.streamAlreadyExists(streamId, version);
            }
            if (expectedVersion.isExact() && expectedVersion.getVersion() != version) {
                throw StoreException.streamVersionConflict(streamId, expectedVersion.getVersion(), version);
            }
        }

        private List<RecordedEvent<Object>> storeEvents(Connection connection, Instant recordedAt)
                throws SQLException {
            List<RecordedEvent<Object>> recorded = new ArrayList<>(events.size());
            try (PreparedStatement insertEvent = schema.insertEvent(connection)) {
                long version = startVersion;
                for (PendingEvent event : events) {
                    version++;
                    schema.prepareEventInsert(insertEvent, streamId, version, event.type, event.payloadVersion,
                        event.payload, recordedAt);
                    insertEvent.executeUpdate();
                    long sequence;
                    try (ResultSet keys = insertEvent.getGeneratedKeys()) {
                        if (!keys.next()) {
                            throw new SQLException("No sequence number generated for event " + version + " of "
                                    + streamId);
                        }
                        sequence = schema.readGeneratedSequence(keys);
                    }
                    recorded.add(new RecordedEvent<>(sequence, streamId, version, event.type, event.data,
                            recordedAt));
                }
            }
            return recorded;
        }

        private void updateVersion(Connection connection, long endVersion, Instant updatedAt)
                throws SQLException, StoreException {
            try (PreparedStatement updateVersion = schema.updateStreamVersion(connection, streamId, startVersion,
                endVersion, updatedAt)) {
                if (updateVersion.executeUpdate() != 1) {
                    throw StoreException.concurrentAppend(streamId, startVersion, null);
                }
            }
        }
    }

    private static final class PendingEvent {
        private final Object data;
        private final String type;
        private final int payloadVersion;
        private final String payload;

        PendingEvent(Object data, String type, int payloadVersion, String payload) {
            this.data = data;
            this.type = type;
            this.payloadVersion = payloadVersion;
            this.payload = payload;
        }
    }
}
