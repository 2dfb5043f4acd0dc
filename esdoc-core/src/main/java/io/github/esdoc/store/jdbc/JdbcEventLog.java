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

import io.github.esdoc.event.EventLog;
import io.github.esdoc.event.RecordedEvent;
import io.github.esdoc.event.StreamRegistry;
import io.github.esdoc.event.StreamState;
import io.github.esdoc.store.Serialization;
import io.github.esdoc.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Event log and stream registry backed by schema and serialization.
 */
public class JdbcEventLog extends JdbcSupport implements EventLog, StreamRegistry {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventLog.class);

    private final Serialization<Object> serialization;
    private final boolean strict;

    /**
     * Create instance that will read from provided datasource, delegating queries to JdbcSchema, deserializing events
     * by serialization, while being or not being strict.
     *
     * <p>When event log is in strict mode, it will throw an exception when an event being read cannot be deserialized.
     * This can usually happen in two cases: Either there was an error in payload serialization, or an event could have
     * belong to a future version of the system, code was rolled back and currently running code doesn't yet know such event.
     * <p>When {@code strict} is false, such event is skipped.
     *
     * <p>In case the aggregates need very strong state consistency guarantees, strict mode should be used.
     *
     * @param ds data source to read from
     * @param schema database layout
     * @param serialization event serialization
     * @param strict whether undecodable events fail the read
     */
    public JdbcEventLog(DataSource ds, JdbcSchema schema, Serialization<Object> serialization, boolean strict) {
        super(ds, schema, TxHandler.CONTAINER);
        this.serialization = Objects.requireNonNull(serialization);
        this.strict = strict;
    }

    /**
     * Indicate whether failure to deserialize event causes exception to be thrown.
     * @return true in strict mode
     */
    public boolean isStrict() {
        return strict;
    }

    @Override
    public StoredEvents readEvents(String streamId, long fromVersion, long toVersion) throws StoreException {
        Objects.requireNonNull(streamId, "Stream id cannot be null");
        try {
            return new JdbcStoredEvents(streamId, Math.max(1, fromVersion), toVersion);
        } catch (SQLException e) {
            throw StoreException.storeFailed(streamId, e);
        }
    }

    @Override
    public List<RecordedEvent<Object>> readAll(long afterSequence, int limit) throws StoreException {
        return withConnection("*", connection -> readAll(connection, afterSequence, limit));
    }

    List<RecordedEvent<Object>> readAll(Connection connection, long afterSequence, int limit)
            throws SQLException, StoreException {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive, was " + limit);
        }
        List<RecordedEvent<Object>> result = new ArrayList<>();
        try (PreparedStatement st = schema.selectAllEvents(connection, afterSequence, limit);
                ResultSet rs = st.executeQuery()) {
            while (rs.next()) {
                RecordedEvent<Object> event = readEvent(rs);
                if (event != null) {
                    result.add(event);
                }
            }
        }
        return result;
    }

    @Override
    public Optional<StreamState> streamState(String streamId) throws StoreException {
        return withConnection(streamId, connection -> {
            try (PreparedStatement st = schema.selectStream(connection, streamId);
                    ResultSet rs = st.executeQuery()) {
                return rs.next() ? Optional.of(schema.readStreamState(rs)) : Optional.<StreamState>empty();
            }
        });
    }

    /**
     * Read an event from current row of result set.
     * @return the event, or null when it cannot be deserialized and the log is lenient
     */
    private RecordedEvent<Object> readEvent(ResultSet rs) throws SQLException, StoreException {
        String streamId = schema.readEventStreamId(rs);
        long version = schema.readEventVersion(rs);
        String type = schema.readEventType(rs);
        int payloadVersion = schema.readEventPayloadVersion(rs);
        Object data;
        try {
            data = serialization.deserialize(payloadVersion, schema.readEventPayload(rs), type);
        } catch (RuntimeException e) {
            return undecodable(streamId, version, type, e);
        }
        if (data == null) {
            return undecodable(streamId, version, type, null);
        }
        return new RecordedEvent<>(schema.readEventSequence(rs), streamId, version, type, data,
                schema.readEventRecordedAt(rs));
    }

    private RecordedEvent<Object> undecodable(String streamId, long version, String type, RuntimeException cause)
            throws StoreException {
        String detail = "event " + version + " of type " + type;
        if (isStrict()) {
            throw StoreException.undecodable(streamId, detail, cause);
        }
        logger.warn("{} Could not deserialize {}, skipping it", streamId, detail, cause);
        return null;
    }

    class JdbcStoredEvents implements StoredEvents {
        private final String streamId;
        private Connection connection;
        private PreparedStatement statement;
        private ResultSet resultSet;
        private boolean iterating;
        private boolean stop;

        JdbcStoredEvents(String streamId, long fromVersion, long toVersion) throws SQLException {
            this.streamId = streamId;
            try {
                connection = dataSource.getConnection();
                statement = schema.selectEvents(connection, streamId, fromVersion, toVersion);
                resultSet = statement.executeQuery();
            } catch (SQLException e) {
                close();
                throw e;
            }
        }

        @Override
        public void foreach(Consumer<? super RecordedEvent<Object>> consumer) throws StoreException {
            reduce(null, (ignored, event) -> {
                consumer.accept(event);
                return null;
            });
        }

        @Override
        public <R> R reduce(R initial, BiFunction<R, ? super RecordedEvent<Object>, R> reducer)
                throws StoreException {
            if (iterating) {
                throw new IllegalStateException("Iteration has already been done");
            }
            iterating = true;
            try {
                R result = initial;
                while (!stop && resultSet.next()) {
                    RecordedEvent<Object> event = readEvent(resultSet);
                    if (event != null) {
                        result = reducer.apply(result, event);
                    }
                }
                return result;
            } catch (SQLException e) {
                throw StoreException.storeFailed(streamId, e);
            } finally {
                close();
            }
        }

        @Override
        public void stop() {
            stop = true;
        }

        @Override
        public void close() {
            cleanup(resultSet);
            cleanup(statement);
            cleanup(connection);
            resultSet = null;
            statement = null;
            connection = null;
        }
    }
}
