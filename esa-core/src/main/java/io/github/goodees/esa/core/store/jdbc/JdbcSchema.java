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

import io.github.goodees.esa.core.store.CommittedEvent;
import io.github.goodees.esa.core.store.SerializedEvent;
import io.github.goodees.esa.core.store.SerializedSnapshot;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Statements used by {@link JdbcEventPersistence} and {@link JdbcSnapshotPersistence}. Subclasses map the operations
 * to concrete tables, see {@link DefaultJdbcSchema}.
 */
public abstract class JdbcSchema {

    protected abstract PreparedStatement insertSourceId(Connection connection, String aggregateName,
            String aggregateId, String sourceId) throws SQLException;

    protected abstract PreparedStatement selectAggregateVersion(Connection connection, String aggregateName,
            String aggregateId) throws SQLException;

    protected abstract long readAggregateVersion(ResultSet rs) throws SQLException;

    /**
     * Increment global sequence. The statement should lock the sequence until commit, so that commits are assigned
     * sequence numbers in the order they become visible.
     */
    protected abstract PreparedStatement updateGlobalSequence(Connection connection, int increment)
            throws SQLException;

    protected abstract PreparedStatement insertGlobalSequence(Connection connection, long value) throws SQLException;

    protected abstract PreparedStatement selectGlobalSequence(Connection connection) throws SQLException;

    protected abstract long readGlobalSequence(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, String aggregateName, String aggregateId,
            long globalSequenceNumber, SerializedEvent event) throws SQLException;

    protected abstract PreparedStatement selectEvents(Connection connection, String aggregateName, String aggregateId,
            long fromSequenceNumber) throws SQLException;

    protected abstract PreparedStatement selectAllEvents(Connection connection, long fromGlobalSequenceNumber,
            int pageSize) throws SQLException;

    protected abstract CommittedEvent readEvent(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement deleteEvents(Connection connection, String aggregateName,
            String aggregateId) throws SQLException;

    protected abstract PreparedStatement deleteSourceIds(Connection connection, String aggregateName,
            String aggregateId) throws SQLException;

    protected abstract PreparedStatement selectSnapshot(Connection connection, String aggregateName,
            String aggregateId) throws SQLException;

    protected abstract SerializedSnapshot readSnapshot(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement updateSnapshot(Connection connection, SerializedSnapshot snapshot)
            throws SQLException;

    protected abstract PreparedStatement insertSnapshot(Connection connection, SerializedSnapshot snapshot)
            throws SQLException;

    protected abstract PreparedStatement deleteSnapshot(Connection connection, String aggregateName,
            String aggregateId) throws SQLException;
}
