package io.github.goodees.esa.core.store.inmemory;

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

import io.github.goodees.esa.core.store.SerializedSnapshot;
import io.github.goodees.esa.core.store.SnapshotPersistence;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Stores snapshots in memory. It doesn't make much sense to use it outside tests, but when aggregate doesn't support
 * snapshots it's good one to use.
 */
public class InMemorySnapshotPersistence implements SnapshotPersistence {
    private final ConcurrentMap<String, SerializedSnapshot> snapshots = new ConcurrentHashMap<>();

    private static String key(String aggregateName, String aggregateId) {
        return aggregateName + "/" + aggregateId;
    }

    @Override
    public Optional<SerializedSnapshot> get(String aggregateName, String aggregateId) {
        return Optional.ofNullable(snapshots.get(key(aggregateName, aggregateId)));
    }

    @Override
    public void set(SerializedSnapshot snapshot) {
        snapshots.put(key(snapshot.getAggregateName(), snapshot.getAggregateId()), snapshot);
    }

    @Override
    public void delete(String aggregateName, String aggregateId) {
        snapshots.remove(key(aggregateName, aggregateId));
    }

    public long getSnapshottedVersion(String aggregateName, String aggregateId) {
        return get(aggregateName, aggregateId).map(SerializedSnapshot::getAggregateSequenceNumber).orElse(0L);
    }
}
