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

import io.github.goodees.esa.core.store.EventStore;
import io.github.goodees.esa.core.store.SnapshotStore;
import io.github.goodees.esa.example.counter.Counters;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.rules.TestName;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.Assert.assertEquals;


public class JdbcTest {
    protected static JdbcDataSource ds;
    protected static JdbcTemplate template;
    @Rule
    public TestName testName = new TestName();
    protected DefaultJdbcSchema schema;
    protected JdbcEventPersistence eventPersistence;
    protected JdbcSnapshotPersistence snapshotPersistence;
    protected EventStore eventStore;
    protected SnapshotStore snapshotStore;

    @BeforeClass
    public static void initDb() throws SQLException {
        ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:estest;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        ds.setUser("sa");
        try (Connection con = ds.getConnection()) {
            executeSql(
                con,
                "create table esa_event (AGGREGATE_NAME varchar(255), AGGREGATE_ID varchar(255), SEQUENCE_NUMBER bigint,"
                        + " GLOBAL_SEQUENCE_NUMBER bigint unique, EVENT_NAME varchar(255), EVENT_VERSION int,"
                        + " BATCH_ID varchar(64), CREATED_AT timestamp, DATA clob, METADATA clob,"
                        + " primary key (AGGREGATE_NAME, AGGREGATE_ID, SEQUENCE_NUMBER))",
                "create table esa_source_id (AGGREGATE_NAME varchar(255), AGGREGATE_ID varchar(255),"
                        + " SOURCE_ID varchar(255), primary key (AGGREGATE_NAME, AGGREGATE_ID, SOURCE_ID))",
                "create table esa_global_sequence (SEQUENCE_NAME varchar(64) primary key, LAST_NUMBER bigint)",
                "insert into esa_global_sequence (SEQUENCE_NAME, LAST_NUMBER) values ('global', 0)",
                "create table esa_snapshot (AGGREGATE_NAME varchar(255), AGGREGATE_ID varchar(255),"
                        + " SEQUENCE_NUMBER bigint, SNAPSHOT_NAME varchar(255), SNAPSHOT_VERSION int,"
                        + " CREATED_AT timestamp, DATA clob, METADATA clob, primary key (AGGREGATE_NAME, AGGREGATE_ID))");
        }
        template = new JdbcTemplate(ds);
    }

    @AfterClass
    public static void dropDb() throws SQLException {
        try (Connection con = ds.getConnection()) {
            executeSql(con, "drop table esa_event", "drop table esa_source_id", "drop table esa_global_sequence",
                "drop table esa_snapshot");
        }
    }

    static void executeSql(Connection con, String... statements) throws SQLException {
        for (String statement : statements) {
            try (CallableStatement cst = con.prepareCall(statement)) {
                cst.execute();
            }
        }
    }

    @Before
    public void setUp() {
        this.schema = new DefaultJdbcSchema("esa_event", "esa_source_id", "esa_global_sequence", "esa_snapshot");
        this.eventPersistence = new JdbcEventPersistence(ds, schema);
        this.snapshotPersistence = new JdbcSnapshotPersistence(ds, schema);
        this.eventStore = new EventStore(eventPersistence, Counters.eventSerializer(), Counters.upgrades());
        this.snapshotStore = new SnapshotStore(snapshotPersistence, Counters.SNAPSHOTS, Counters.serialization(),
            Counters.snapshotUpgraders());
    }

    protected String name() {
        return testName.getMethodName();
    }

    protected void assertDb(long expected, String sql, Object... params) {
        assertEquals(Long.valueOf(expected), template.queryForObject(sql, Long.class, params));
    }
}
