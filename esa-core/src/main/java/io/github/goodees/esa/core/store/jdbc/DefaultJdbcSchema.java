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
import java.sql.Timestamp;

/**
 * JDBC schema with events of all aggregates in single table. Following tables are expected to exist:
 * <ul>
 * <li><em>eventTable</em>(AGGREGATE_NAME, AGGREGATE_ID, SEQUENCE_NUMBER, GLOBAL_SEQUENCE_NUMBER, EVENT_NAME,
 * EVENT_VERSION, BATCH_ID, CREATED_AT, DATA, METADATA) primary key (AGGREGATE_NAME, AGGREGATE_ID, SEQUENCE_NUMBER),
 * unique (GLOBAL_SEQUENCE_NUMBER)</li>
 * <li><em>sourceIdTable</em>(AGGREGATE_NAME, AGGREGATE_ID, SOURCE_ID) primary key (AGGREGATE_NAME, AGGREGATE_ID,
 * SOURCE_ID)</li>
 * <li><em>sequenceTable</em>(SEQUENCE_NAME, LAST_NUMBER) primary key (SEQUENCE_NAME)</li>
 * <li><em>snapshotTable</em>(AGGREGATE_NAME, AGGREGATE_ID, SEQUENCE_NUMBER, SNAPSHOT_NAME, SNAPSHOT_VERSION,
 * CREATED_AT, DATA, METADATA) primary key (AGGREGATE_NAME, AGGREGATE_ID)</li>
 * </ul>
 * <p>The primary keys are essential, violation of them is how concurrent commits are detected.</p>
 */
public class DefaultJdbcSchema extends JdbcSchema {
    static final String GLOBAL_SEQUENCE = "global";

    private final String eventTable;
    private final String sourceIdTable;
    private final String sequenceTable;
    private final String snapshotTable;

    public DefaultJdbcSchema(String eventTable, String sourceIdTable, String sequenceTable, String snapshotTable) {
        this.eventTable = eventTable;
        this.sourceIdTable = sourceIdTable;
        this.sequenceTable = sequenceTable;
        this.snapshotTable = snapshotTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getSourceIdTable() {
        return sourceIdTable;
    }

    protected String getSequenceTable() {
        return sequenceTable;
    }

    protected String getSnapshotTable() {
        return snapshotTable;
    }

    @Override
    protected PreparedStatement insertSourceId(Connection connection, String aggregateName, String aggregateId,
            String sourceId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getSourceIdTable()
                + " (AGGREGATE_NAME, AGGREGATE_ID, SOURCE_ID) VALUES (?, ?, ?)");
        st.setString(1, aggregateName);
        st.setString(2, aggregateId);
        st.setString(3, sourceId);
        return st;
    }

    @Override
    protected PreparedStatement selectAggregateVersion(Connection connection, String aggregateName,
            String aggregateId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT COALESCE(MAX(SEQUENCE_NUMBER), 0) FROM "
                + getEventTable() + " WHERE AGGREGATE_NAME=? AND AGGREGATE_ID=?");
        st.setString(1, aggregateName);
        st.setString(2, aggregateId);
        return st;
    }

    @Override
    protected long readAggregateVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement updateGlobalSequence(Connection connection, int increment) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getSequenceTable()
                + " SET LAST_NUMBER=LAST_NUMBER+? WHERE SEQUENCE_NAME=?");
        st.setInt(1, increment);
        st.setString(2, GLOBAL_SEQUENCE);
        return st;
    }

    @Override
    protected PreparedStatement insertGlobalSequence(Connection connection, long value) throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getSequenceTable()
                + " (SEQUENCE_NAME, LAST_NUMBER) VALUES (?, ?)");
        st.setString(1, GLOBAL_SEQUENCE);
        st.setLong(2, value);
        return st;
    }

    @Override
    protected PreparedStatement selectGlobalSequence(Connection connection) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT LAST_NUMBER FROM " + getSequenceTable()
                + " WHERE SEQUENCE_NAME=?");
        st.setString(1, GLOBAL_SEQUENCE);
        return st;
    }

    @Override
    protected long readGlobalSequence(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (AGGREGATE_NAME, AGGREGATE_ID, SEQUENCE_NUMBER, GLOBAL_SEQUENCE_NUMBER, EVENT_NAME, EVENT_VERSION,"
                + " BATCH_ID, CREATED_AT, DATA, METADATA) VALUES (?,?,?,?,?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, String aggregateName, String aggregateId,
            long globalSequenceNumber, SerializedEvent event) throws SQLException {
        insertEvent.setString(1, aggregateName);
        insertEvent.setString(2, aggregateId);
        insertEvent.setLong(3, event.getAggregateSequenceNumber());
        insertEvent.setLong(4, globalSequenceNumber);
        insertEvent.setString(5, event.getEventName());
        insertEvent.setInt(6, event.getEventVersion());
        insertEvent.setString(7, event.getBatchId());
        insertEvent.setTimestamp(8, Timestamp.from(event.getMetadata().getTimestamp()));
        insertEvent.setString(9, event.getData());
        insertEvent.setString(10, event.getSerializedMetadata());
    }

    private static final String EVENT_COLUMNS = "AGGREGATE_NAME, AGGREGATE_ID, SEQUENCE_NUMBER, "
            + "GLOBAL_SEQUENCE_NUMBER, EVENT_NAME, EVENT_VERSION, BATCH_ID, DATA, METADATA";

    @Override
    protected PreparedStatement selectEvents(Connection connection, String aggregateName, String aggregateId,
            long fromSequenceNumber) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE AGGREGATE_NAME=? AND AGGREGATE_ID=? AND SEQUENCE_NUMBER >= ? ORDER BY SEQUENCE_NUMBER");
        st.setString(1, aggregateName);
        st.setString(2, aggregateId);
        st.setLong(3, fromSequenceNumber);
        return st;
    }

    @Override
    protected PreparedStatement selectAllEvents(Connection connection, long fromGlobalSequenceNumber, int pageSize)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE GLOBAL_SEQUENCE_NUMBER >= ? ORDER BY GLOBAL_SEQUENCE_NUMBER");
        st.setLong(1, fromGlobalSequenceNumber);
        st.setMaxRows(pageSize);
        return st;
    }

    @Override
    protected CommittedEvent readEvent(ResultSet rs) throws SQLException {
        return new CommittedEvent(rs.getString(1), rs.getString(2), rs.getLong(3), rs.getLong(4), rs.getString(5),
            rs.getInt(6), rs.getString(7), rs.getString(8), rs.getString(9));
    }

    @Override
    protected PreparedStatement deleteEvents(Connection connection, String aggregateName, String aggregateId)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + getEventTable()
                + " WHERE AGGREGATE_NAME=? AND AGGREGATE_ID=?");
        st.setString(1, aggregateName);
        st.setString(2, aggregateId);
        return st;
    }

    @Override
    protected PreparedStatement deleteSourceIds(Connection connection, String aggregateName, String aggregateId)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + getSourceIdTable()
                + " WHERE AGGREGATE_NAME=? AND AGGREGATE_ID=?");
        st.setString(1, aggregateName);
        st.setString(2, aggregateId);
        return st;
    }

    @Override
    protected PreparedStatement selectSnapshot(Connection connection, String aggregateName, String aggregateId)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("SELECT AGGREGATE_NAME, AGGREGATE_ID, SEQUENCE_NUMBER, "
                + "SNAPSHOT_NAME, SNAPSHOT_VERSION, DATA, METADATA FROM " + getSnapshotTable()
                + " WHERE AGGREGATE_NAME=? AND AGGREGATE_ID=?");
        ps.setString(1, aggregateName);
        ps.setString(2, aggregateId);
        return ps;
    }

    @Override
    protected SerializedSnapshot readSnapshot(ResultSet rs) throws SQLException {
        return new SerializedSnapshot(rs.getString(1), rs.getString(2), rs.getLong(3), rs.getString(4), rs.getInt(5),
            rs.getString(6), rs.getString(7));
    }

    @Override
    protected PreparedStatement updateSnapshot(Connection connection, SerializedSnapshot snapshot)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("UPDATE " + getSnapshotTable()
                + " SET SEQUENCE_NUMBER=?, SNAPSHOT_NAME=?, SNAPSHOT_VERSION=?, CREATED_AT=?, DATA=?, METADATA=?"
                + " WHERE AGGREGATE_NAME=? AND AGGREGATE_ID=?");
        ps.setLong(1, snapshot.getAggregateSequenceNumber());
        ps.setString(2, snapshot.getSnapshotName());
        ps.setInt(3, snapshot.getSnapshotVersion());
        ps.setTimestamp(4, new Timestamp(System.currentTimeMillis()));
        ps.setString(5, snapshot.getData());
        ps.setString(6, snapshot.getMetadata());
        ps.setString(7, snapshot.getAggregateName());
        ps.setString(8, snapshot.getAggregateId());
        return ps;
    }

    @Override
    protected PreparedStatement insertSnapshot(Connection connection, SerializedSnapshot snapshot)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("INSERT INTO " + getSnapshotTable()
                + " (AGGREGATE_NAME, AGGREGATE_ID, SEQUENCE_NUMBER, SNAPSHOT_NAME, SNAPSHOT_VERSION, CREATED_AT, DATA,"
                + " METADATA) VALUES (?, ?, ?, ?, ?, ?, ?, ?)");
        ps.setString(1, snapshot.getAggregateName());
        ps.setString(2, snapshot.getAggregateId());
        ps.setLong(3, snapshot.getAggregateSequenceNumber());
        ps.setString(4, snapshot.getSnapshotName());
        ps.setInt(5, snapshot.getSnapshotVersion());
        ps.setTimestamp(6, new Timestamp(System.currentTimeMillis()));
        ps.setString(7, snapshot.getData());
        ps.setString(8, snapshot.getMetadata());
        return ps;
    }

    @Override
    protected PreparedStatement deleteSnapshot(Connection connection, String aggregateName, String aggregateId)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("DELETE FROM " + getSnapshotTable()
                + " WHERE AGGREGATE_NAME=? AND AGGREGATE_ID=?");
        ps.setString(1, aggregateName);
        ps.setString(2, aggregateId);
        return ps;
    }
}
