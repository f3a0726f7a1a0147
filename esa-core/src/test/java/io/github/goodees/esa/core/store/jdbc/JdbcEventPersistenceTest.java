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

import io.github.goodees.esa.core.Metadata;
import io.github.goodees.esa.core.MetadataKeys;
import io.github.goodees.esa.core.SourceId;
import io.github.goodees.esa.core.store.CommittedEvent;
import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.core.store.EventsPage;
import io.github.goodees.esa.core.store.GlobalPosition;
import io.github.goodees.esa.core.store.SerializedEvent;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;


public class JdbcEventPersistenceTest extends JdbcTest {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventPersistenceTest.class);
    @Rule
    public ErrorCollector collector = new ErrorCollector();

    private static List<SerializedEvent> events(long first, int... amounts) {
        List<SerializedEvent> result = new ArrayList<>();
        Instant now = Instant.now();
        for (int i = 0; i < amounts.length; i++) {
            Metadata metadata = Metadata.empty()
                    .with(MetadataKeys.TIMESTAMP, now.toString())
                    .with(MetadataKeys.BATCH_ID, "batch-" + first);
            result.add(new SerializedEvent(first + i, "IncrementedEvent", 2, "{\"amount\":" + amounts[i] + "}",
                "{}", metadata));
        }
        return result;
    }

    @Test
    public void events_for_new_aggregate_are_persisted() throws EventStoreException {
        List<CommittedEvent> committed = eventPersistence.commit("Counter", name(), SourceId.random(),
            events(1, 100, 200));
        assertDb(2, "select count(*) from esa_event where aggregate_id = ?", name());
        assertDb(1, "select count(*) from esa_source_id where aggregate_id = ?", name());
        assertEquals(committed.get(0).getGlobalSequenceNumber() + 1, committed.get(1).getGlobalSequenceNumber());
        assertEquals("batch-1", committed.get(1).getBatchId());
    }

    @Test
    public void events_for_existing_aggregate_are_persisted() throws EventStoreException {
        eventPersistence.commit("Counter", name(), SourceId.random(), events(1, 100, 200));
        eventPersistence.commit("Counter", name(), SourceId.random(), events(3, 100, 200));
        assertDb(4, "select count(*) from esa_event where aggregate_id = ?", name());
        assertDb(4, "select max(sequence_number) from esa_event where aggregate_id = ?", name());
        List<CommittedEvent> loaded = eventPersistence.load("Counter", name(), 2);
        assertThat(loaded, hasSize(3));
        assertEquals(2, loaded.get(0).getAggregateSequenceNumber());
        assertEquals("{\"amount\":200}", loaded.get(0).getData());
    }

    @Test
    public void persisting_stale_events_throws_early() throws EventStoreException {
        eventPersistence.commit("Counter", name(), SourceId.random(), events(1, 100, 200));
        try {
            eventPersistence.commit("Counter", name(), SourceId.random(), events(2, 300));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
        }
        assertDb(2, "select count(*) from esa_event where aggregate_id = ?", name());
        assertDb(1, "select count(*) from esa_source_id where aggregate_id = ?", name());
    }

    @Test
    public void repeated_source_id_is_duplicate_operation() throws EventStoreException {
        SourceId source = SourceId.of(name());
        eventPersistence.commit("Counter", name(), source, events(1, 100));
        try {
            eventPersistence.commit("Counter", name(), source, events(2, 100));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.DUPLICATE_OPERATION, e.getFault());
        }
        assertDb(1, "select count(*) from esa_event where aggregate_id = ?", name());
    }

    @Test
    public void global_sequence_is_contiguous_across_aggregates() throws EventStoreException {
        List<CommittedEvent> first = eventPersistence.commit("Counter", name() + "-a", SourceId.random(),
            events(1, 1, 2));
        List<CommittedEvent> second = eventPersistence.commit("Counter", name() + "-b", SourceId.random(),
            events(1, 3));
        assertEquals(first.get(1).getGlobalSequenceNumber() + 1, second.get(0).getGlobalSequenceNumber());
    }

    @Test
    public void global_pages_are_limited() throws EventStoreException {
        List<CommittedEvent> committed = eventPersistence.commit("Counter", name(), SourceId.random(),
            events(1, 1, 2, 3));
        GlobalPosition start = GlobalPosition.of(committed.get(0).getGlobalSequenceNumber());

        EventsPage<CommittedEvent> first = eventPersistence.loadAll(start, 2);
        assertThat(first.getEvents(), hasSize(2));
        EventsPage<CommittedEvent> second = eventPersistence.loadAll(first.getNextPosition(), 2);
        assertEquals(3, second.getEvents().get(0).getAggregateSequenceNumber());
        assertEquals(GlobalPosition.after(committed.get(2).getGlobalSequenceNumber()),
            second.getNextPosition());
    }

    @Test
    public void delete_removes_events_and_source_ids() throws EventStoreException {
        eventPersistence.commit("Counter", name(), SourceId.random(), events(1, 1, 2));
        assertEquals(2, eventPersistence.delete("Counter", name()));
        assertDb(0, "select count(*) from esa_event where aggregate_id = ?", name());
        assertDb(0, "select count(*) from esa_source_id where aggregate_id = ?", name());
        assertTrue(eventPersistence.load("Counter", name(), 1).isEmpty());
    }

    /**
     * Separate tables with empty global sequence, so that numbering starts over.
     */
    private DefaultJdbcSchema createUninitializedTables() {
        String prefix = "t_" + name();
        template.execute("create table " + prefix + "_event (AGGREGATE_NAME varchar(255), AGGREGATE_ID varchar(255),"
                + " SEQUENCE_NUMBER bigint, GLOBAL_SEQUENCE_NUMBER bigint unique, EVENT_NAME varchar(255),"
                + " EVENT_VERSION int, BATCH_ID varchar(64), CREATED_AT timestamp, DATA clob, METADATA clob,"
                + " primary key (AGGREGATE_NAME, AGGREGATE_ID, SEQUENCE_NUMBER))");
        template.execute("create table " + prefix + "_source_id (AGGREGATE_NAME varchar(255),"
                + " AGGREGATE_ID varchar(255), SOURCE_ID varchar(255),"
                + " primary key (AGGREGATE_NAME, AGGREGATE_ID, SOURCE_ID))");
        template.execute("create table " + prefix + "_sequence (SEQUENCE_NAME varchar(64) primary key,"
                + " LAST_NUMBER bigint)");
        return new DefaultJdbcSchema(prefix + "_event", prefix + "_source_id", prefix + "_sequence", "esa_snapshot");
    }

    private void dropTables(DefaultJdbcSchema tables) {
        template.execute("drop table " + tables.getEventTable());
        template.execute("drop table " + tables.getSourceIdTable());
        template.execute("drop table " + tables.getSequenceTable());
    }

    @Test
    public void missing_global_sequence_is_initialized() throws EventStoreException {
        DefaultJdbcSchema tables = createUninitializedTables();
        try {
            JdbcEventPersistence persistence = new JdbcEventPersistence(ds, tables);
            List<CommittedEvent> first = persistence.commit("Counter", name(), SourceId.random(), events(1, 1, 2));
            List<CommittedEvent> second = persistence.commit("Counter", name(), SourceId.random(), events(3, 3));
            assertEquals(1, first.get(0).getGlobalSequenceNumber());
            assertEquals(3, second.get(0).getGlobalSequenceNumber());
            assertDb(3, "select last_number from " + tables.getSequenceTable());
        } finally {
            dropTables(tables);
        }
    }

    @Test
    public void losing_global_sequence_initialization_fails_optimistic_lock() throws EventStoreException {
        DefaultJdbcSchema tables = createUninitializedTables();
        try {
            new JdbcEventPersistence(ds, tables).commit("Counter", name() + "-winner", SourceId.random(),
                events(1, 1));

            // update that sees no row, as a commit running concurrently with the initialization does
            JdbcSchema latecomer = new DefaultJdbcSchema(tables.getEventTable(), tables.getSourceIdTable(),
                tables.getSequenceTable(), "esa_snapshot") {
                @Override
                protected PreparedStatement updateGlobalSequence(Connection connection, int increment)
                        throws SQLException {
                    PreparedStatement st = connection.prepareStatement("UPDATE " + getSequenceTable()
                            + " SET LAST_NUMBER=LAST_NUMBER+? WHERE SEQUENCE_NAME=? AND 1=0");
                    st.setInt(1, increment);
                    st.setString(2, GLOBAL_SEQUENCE);
                    return st;
                }
            };
            try {
                new JdbcEventPersistence(ds, latecomer).commit("Counter", name(), SourceId.random(), events(1, 2));
                fail("should have failed");
            } catch (EventStoreException e) {
                assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
            }
            assertDb(0, "select count(*) from " + tables.getEventTable() + " where aggregate_id = ?", name());
            assertDb(0, "select count(*) from " + tables.getSourceIdTable() + " where aggregate_id = ?", name());

            // retry sees the initialized sequence
            new JdbcEventPersistence(ds, tables).commit("Counter", name(), SourceId.random(), events(1, 2));
            assertDb(1, "select count(*) from " + tables.getEventTable() + " where aggregate_id = ?", name());
            assertDb(2, "select last_number from " + tables.getSequenceTable());
        } finally {
            dropTables(tables);
        }
    }

    @Test
    public void constraint_violation_is_found_in_exception_chain() {
        SQLException batch = new SQLException("batch failed", "HY000");
        batch.setNextException(new SQLException("unique violated", "23505"));
        assertTrue(JdbcEventPersistence.isConstraintViolation(batch));
        assertTrue(JdbcEventPersistence.isConstraintViolation(new SQLException("wrapped", "HY000",
            new SQLException("unique violated", "23000"))));
        assertEquals(false, JdbcEventPersistence.isConstraintViolation(new SQLException("timeout", "HYT00")));
    }

    @Test
    public void persisting_stale_events_fails_optimistic_lock() throws Exception {
        // so how do we make a race condition?
        // we inject latches into JdbcSchema and transaction handler
        /*
            THREAD 1                 THREAD 2

            checkSourceVersion
            < release "T1 has version" >
                                     < wait for "T1 has version" >
                                     checkSourceVersion
                                     < release "T2 has version" >
            < wait for "T2 has version" >
            reserveGlobalSequence
            insert "10", commit
            < release "T1 committed" >
                                     < wait for "T1 committed" >
                                     reserveGlobalSequence
                                     insert "20" -> primary key violation

            Thread 1 wins, thread 2 fails on optimistic lock.
         */
        CountDownLatch thread1hasVersion = new CountDownLatch(1);
        CountDownLatch thread2hasVersion = new CountDownLatch(1);
        CountDownLatch thread1committed = new CountDownLatch(1);

        JdbcSchema race1 = new DefaultJdbcSchema("esa_event", "esa_source_id", "esa_global_sequence",
            "esa_snapshot") {
            @Override
            protected long readAggregateVersion(ResultSet rs) throws SQLException {
                try {
                    return super.readAggregateVersion(rs);
                } finally {
                    logger.info("Thread 1 has read aggregate version");
                    thread1hasVersion.countDown();
                }
            }

            @Override
            protected PreparedStatement updateGlobalSequence(Connection connection, int increment)
                    throws SQLException {
                PreparedStatement delegate = super.updateGlobalSequence(connection, increment);
                return (PreparedStatement) Proxy.newProxyInstance(delegate.getClass().getClassLoader(),
                    new Class<?>[]{PreparedStatement.class}, (p, m, a) -> {
                        if ("executeUpdate".equals(m.getName())) {
                            logger.info("Waiting for thread 2 to read aggregate version");
                            thread2hasVersion.await();
                        }
                        return m.invoke(delegate, a);
                    });
            }
        };

        JdbcSchema race2 = new DefaultJdbcSchema("esa_event", "esa_source_id", "esa_global_sequence",
            "esa_snapshot") {
            @Override
            protected long readAggregateVersion(ResultSet rs) throws SQLException {
                try {
                    logger.info("Thread 2 waits for thread 1 to read aggregate version");
                    thread1hasVersion.await();
                } catch (InterruptedException e) {
                    collector.addError(e);
                }
                try {
                    return super.readAggregateVersion(rs);
                } finally {
                    thread2hasVersion.countDown();
                }
            }

            @Override
            protected PreparedStatement updateGlobalSequence(Connection connection, int increment)
                    throws SQLException {
                PreparedStatement delegate = super.updateGlobalSequence(connection, increment);
                return (PreparedStatement) Proxy.newProxyInstance(delegate.getClass().getClassLoader(),
                    new Class<?>[]{PreparedStatement.class}, (p, m, a) -> {
                        if ("executeUpdate".equals(m.getName())) {
                            logger.info("Waiting for thread 1 to commit");
                            thread1committed.await();
                        }
                        return m.invoke(delegate, a);
                    });
            }
        };

        TxHandler signallingTxHandler = new TxHandler() {
            @Override
            public Connection enroll(Connection connection) throws SQLException {
                return TxHandler.local().enroll(connection);
            }

            @Override
            public void commit(Connection connection) throws SQLException {
                TxHandler.local().commit(connection);
                logger.info("Thread 1 committed");
                thread1committed.countDown();
            }

            @Override
            public void rollback(Connection connection) throws SQLException {
                TxHandler.local().rollback(connection);
            }
        };
        JdbcEventPersistence store1 = new JdbcEventPersistence(ds, race1, signallingTxHandler);
        JdbcEventPersistence store2 = new JdbcEventPersistence(ds, race2, TxHandler.local());

        eventPersistence.commit("Counter", name(), SourceId.random(), events(1, 1));
        Thread thread1 = new Thread(() -> {
            try {
                store1.commit("Counter", name(), SourceId.of("thread-1"), events(2, 10));
            } catch (Exception e) {
                logger.error("Thread 1 failed", e);
                collector.addError(e);
            } finally {
                // release all latches in case we failed:
                thread1hasVersion.countDown();
                thread1committed.countDown();
            }
        });
        thread1.setName("Thread 1");
        thread1.start();
        try {
            store2.commit("Counter", name(), SourceId.of("thread-2"), events(2, 20));
            fail("Should have failed");
        } catch (EventStoreException e) {
            logger.info("Thread 2 got (expected) event store exception", e);
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
        } finally {
            thread2hasVersion.countDown();
        }
        thread1.join();
        assertDb(2, "select count(*) from esa_event where aggregate_id = ?", name());
        assertDb(1, "select count(*) from esa_event where aggregate_id = ? and data like '%10}'", name());
        assertDb(0, "select count(*) from esa_event where aggregate_id = ? and data like '%20}'", name());
        assertDb(0, "select count(*) from esa_source_id where aggregate_id = ? and source_id = 'thread-2'", name());
        assertDb(1, "select count(*) from esa_event where aggregate_id = ? and global_sequence_number = "
                + "(select last_number from esa_global_sequence)", name());
    }
}
