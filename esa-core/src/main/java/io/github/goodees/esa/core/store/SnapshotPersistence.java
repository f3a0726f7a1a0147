package io.github.goodees.esa.core.store;

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

import java.util.Optional;

/**
 * Storage backend of {@link SnapshotStore}. Keeps the latest snapshot per aggregate.
 */
public interface SnapshotPersistence {
    /**
     * Retrieve most recent snapshot of an aggregate.
     * @param aggregateName name of aggregate type
     * @param aggregateId id of the aggregate
     * @return stored snapshot
     * @throws EventStoreException when storage fails
     */
    Optional<SerializedSnapshot> get(String aggregateName, String aggregateId) throws EventStoreException;

    /**
     * Store a snapshot, replacing previous one of the same aggregate.
     * @param snapshot snapshot to store
     * @throws EventStoreException when storage fails
     */
    void set(SerializedSnapshot snapshot) throws EventStoreException;

    void delete(String aggregateName, String aggregateId) throws EventStoreException;
}
