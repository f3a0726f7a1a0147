package io.github.goodees.esa.core.store.jdbc;

/*-
 * #%L
 * esa
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

import io.github.goodees.esa.core.SourceId;
import io.github.goodees.esa.core.store.CommittedEvent;
import io.github.goodees.esa.core.store.EventPersistence;
import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.core.store.EventsPage;
import io.github.goodees.esa.core.store.GlobalPosition;
import io.github.goodees.esa.core.store.SerializedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Event persistence in relational database, with statements provided by {@link JdbcSchema}.
 * <p>Commit runs in single transaction: it records the source id, verifies the aggregate's version, reserves global
 * sequence numbers and inserts the events. Reservation of global sequence numbers locks the sequence row until the
 * transaction ends, so global sequence numbers become visible in order, without gaps. Constraint violations are
 * translated to {@link EventStoreException.Fault#DUPLICATE_OPERATION} for source id and
 * {@link EventStoreException.Fault#OPTIMISTIC_LOCK} for events. When the sequence row is missing, the first commit
 * inserts it, and a concurrent commit losing that insert fails with optimistic lock as well.</p>
 */
public class JdbcEventPersistence implements EventPersistence {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventPersistence.class);
    private static final String INTEGRITY_CONSTRAINT_VIOLATION = "23";

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final TxHandler txHandler;

    public JdbcEventPersistence(DataSource dataSource, JdbcSchema schema) {
        this(dataSource, schema, TxHandler.local());
    }

    public JdbcEventPersistence(DataSource dataSource, JdbcSchema schema, TxHandler txHandler) {
        this.dataSource = Objects.requireNonNull(dataSource);
        this.schema = Objects.requireNonNull(schema);
        this.txHandler = Objects.requireNonNull(txHandler);
    }

    @Override
    public List<CommittedEvent> commit(String aggregateName, String aggregateId, SourceId sourceId,
            List<SerializedEvent> events) throws EventStoreException {
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        return createTemplate(aggregateName, aggregateId, sourceId, events).persist();
    }

    protected PersistTemplate createTemplate(String aggregateName, String aggregateId, SourceId sourceId,
            List<SerializedEvent> events) {
        return new PersistTemplate(aggregateName, aggregateId, sourceId, events);
    }

    protected class PersistTemplate {
        private final String aggregateName;
        private final String aggregateId;
        private final SourceId sourceId;
        private final List<SerializedEvent> events;
        private final long startVersion;

        PersistTemplate(String aggregateName, String aggregateId, SourceId sourceId, List<SerializedEvent> events) {
            this.aggregateName = aggregateName;
            this.aggregateId = aggregateId;
            this.sourceId = sourceId;
            this.events = events;
            this.startVersion = events.get(0).getAggregateSequenceNumber() - 1;
        }

        public List<CommittedEvent> persist() throws EventStoreException {
            try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
                try {
                    insertSourceId(connection);
                    checkSourceVersion(connection);
                    long firstGlobalSequence = reserveGlobalSequence(connection);
                    List<CommittedEvent> committed = storeEvents(connection, firstGlobalSequence);
                    txHandler.commit(connection);
                    return committed;
                } catch (SQLException | EventStoreException | RuntimeException e) {
                    txHandler.rollback(connection);
                    throw e;
                }
            } catch (SQLException ex) {
                throw EventStoreException.storeFailed(aggregateName, aggregateId, ex);
            }
        }

        private void insertSourceId(Connection connection) throws SQLException, EventStoreException {
            try (PreparedStatement st = schema.insertSourceId(connection, aggregateName, aggregateId,
                sourceId.getValue())) {
                st.executeUpdate();
            } catch (SQLException e) {
                if (isConstraintViolation(e)) {
                    throw EventStoreException.duplicateOperation(aggregateName, aggregateId, sourceId.getValue());
                }
                throw e;
            }
        }

        private void checkSourceVersion(Connection connection) throws SQLException, EventStoreException {
            try (PreparedStatement st = schema.selectAggregateVersion(connection, aggregateName, aggregateId);
                    ResultSet rs = st.executeQuery()) {
                long version = rs.next() ? schema.readAggregateVersion(rs) : 0;
                if (version != startVersion) {
                    throw EventStoreException.optimisticLock(aggregateName, aggregateId, startVersion, version);
                }
            }
        }

        private long reserveGlobalSequence(Connection connection) throws SQLException, EventStoreException {
            int updated;
            try (PreparedStatement update = schema.updateGlobalSequence(connection, events.size())) {
                updated = update.executeUpdate();
            }
            if (updated == 0) {
                logger.info("Initializing global sequence");
                try (PreparedStatement insert = schema.insertGlobalSequence(connection, events.size())) {
                    insert.executeUpdate();
                } catch (SQLException e) {
                    // another commit initialized the sequence first
                    if (isConstraintViolation(e)) {
                        throw EventStoreException.optimisticLock(aggregateName, aggregateId, startVersion, e);
                    }
                    throw e;
                }
            }
            try (PreparedStatement select = schema.selectGlobalSequence(connection);
                    ResultSet rs = select.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Global sequence is missing");
                }
                return schema.readGlobalSequence(rs) - events.size() + 1;
            }
        }

        private List<CommittedEvent> storeEvents(Connection connection, long firstGlobalSequence)
                throws SQLException, EventStoreException {
            List<CommittedEvent> committed = new ArrayList<>(events.size());
            try (PreparedStatement insertEvent = schema.insertEvent(connection)) {
                long globalSequence = firstGlobalSequence;
                for (SerializedEvent event : events) {
                    schema.prepareInsert(insertEvent, aggregateName, aggregateId, globalSequence, event);
                    insertEvent.addBatch();
                    committed.add(CommittedEvent.of(aggregateName, aggregateId, globalSequence, event));
                    globalSequence++;
                }
                insertEvent.executeBatch();
            } catch (SQLException e) {
                if (isConstraintViolation(e)) {
                    throw EventStoreException.optimisticLock(aggregateName, aggregateId, startVersion, e);
                }
                throw e;
            }
            return committed;
        }
    }

    static boolean isConstraintViolation(SQLException exception) {
        Throwable t = exception;
        while (t != null) {
            if (t instanceof SQLException) {
                String state = ((SQLException) t).getSQLState();
                if (state != null && state.startsWith(INTEGRITY_CONSTRAINT_VIOLATION)) {
                    return true;
                }
                SQLException next = ((SQLException) t).getNextException();
                t = next != null ? next : t.getCause();
            } else {
                t = t.getCause();
            }
        }
        return false;
    }

    @Override
    public List<CommittedEvent> load(String aggregateName, String aggregateId, long fromSequenceNumber)
            throws EventStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.selectEvents(connection, aggregateName, aggregateId, fromSequenceNumber);
                ResultSet rs = st.executeQuery()) {
            List<CommittedEvent> result = new ArrayList<>();
            while (rs.next()) {
                result.add(schema.readEvent(rs));
            }
            return result;
        } catch (SQLException e) {
            throw EventStoreException.readFailed("events of " + aggregateName + " " + aggregateId, e);
        }
    }

    @Override
    public EventsPage<CommittedEvent> loadAll(GlobalPosition position, int pageSize) throws EventStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.selectAllEvents(connection, position.getNextSequenceNumber(), pageSize);
                ResultSet rs = st.executeQuery()) {
            List<CommittedEvent> result = new ArrayList<>();
            while (rs.next() && result.size() < pageSize) {
                result.add(schema.readEvent(rs));
            }
            GlobalPosition next = result.isEmpty()
                    ? position
                    : GlobalPosition.after(result.get(result.size() - 1).getGlobalSequenceNumber());
            return new EventsPage<>(next, result);
        } catch (SQLException e) {
            throw EventStoreException.readFailed("events from global position " + position, e);
        }
    }

    @Override
    public int delete(String aggregateName, String aggregateId) throws EventStoreException {
        try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
            try (PreparedStatement deleteEvents = schema.deleteEvents(connection, aggregateName, aggregateId);
                    PreparedStatement deleteSourceIds = schema.deleteSourceIds(connection, aggregateName,
                        aggregateId)) {
                int deleted = deleteEvents.executeUpdate();
                deleteSourceIds.executeUpdate();
                txHandler.commit(connection);
                return deleted;
            } catch (SQLException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            throw EventStoreException.storeFailed(aggregateName, aggregateId, e);
        }
    }
}
