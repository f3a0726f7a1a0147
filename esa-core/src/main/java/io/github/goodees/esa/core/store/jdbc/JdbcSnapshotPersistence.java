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

import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.core.store.SerializedSnapshot;
import io.github.goodees.esa.core.store.SnapshotPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot persistence in relational database. Single row per aggregate is kept, it is updated when it exists and
 * inserted otherwise.
 */
public class JdbcSnapshotPersistence implements SnapshotPersistence {
    private static final Logger logger = LoggerFactory.getLogger(JdbcSnapshotPersistence.class);

    private final DataSource ds;
    private final JdbcSchema schema;

    public JdbcSnapshotPersistence(DataSource ds, JdbcSchema schema) {
        this.ds = Objects.requireNonNull(ds);
        this.schema = Objects.requireNonNull(schema);
    }

    @Override
    public Optional<SerializedSnapshot> get(String aggregateName, String aggregateId) throws EventStoreException {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectSnapshot(connection, aggregateName, aggregateId);
                ResultSet rs = st.executeQuery()) {
            return rs.next() ? Optional.of(schema.readSnapshot(rs)) : Optional.empty();
        } catch (SQLException se) {
            throw EventStoreException.readFailed("snapshot of " + aggregateName + " " + aggregateId, se);
        }
    }

    @Override
    public void set(SerializedSnapshot snapshot) throws EventStoreException {
        String aggregateName = snapshot.getAggregateName();
        String aggregateId = snapshot.getAggregateId();
        try (Connection connection = ds.getConnection()) {
            int result;
            try (PreparedStatement update = schema.updateSnapshot(connection, snapshot)) {
                result = update.executeUpdate();
            }
            if (result == 0) {
                try (PreparedStatement insert = schema.insertSnapshot(connection, snapshot)) {
                    result = insert.executeUpdate();
                }
            }
            if (result != 1) {
                logger.error("Snapshot update did not create/update a row for aggregate {} {}", aggregateName,
                    aggregateId);
            }
        } catch (SQLException se) {
            throw EventStoreException.storeFailed(aggregateName, aggregateId, se);
        }
    }

    @Override
    public void delete(String aggregateName, String aggregateId) throws EventStoreException {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.deleteSnapshot(connection, aggregateName, aggregateId)) {
            st.executeUpdate();
        } catch (SQLException se) {
            throw EventStoreException.storeFailed(aggregateName, aggregateId, se);
        }
    }
}
