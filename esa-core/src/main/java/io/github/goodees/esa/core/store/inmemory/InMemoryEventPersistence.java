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

import io.github.goodees.esa.core.SourceId;
import io.github.goodees.esa.core.store.CommittedEvent;
import io.github.goodees.esa.core.store.EventPersistence;
import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.core.store.EventsPage;
import io.github.goodees.esa.core.store.GlobalPosition;
import io.github.goodees.esa.core.store.SerializedEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static java.util.stream.Collectors.toList;

/**
 * Keeps events in memory. Commits are serialized by single lock, therefore global order equals commit order. It
 * doesn't make much sense to use it outside tests and prototypes.
 */
public class InMemoryEventPersistence implements EventPersistence {
    private final Object lock = new Object();
    private final Map<StreamKey, List<CommittedEvent>> streams = new HashMap<>();
    private final Map<StreamKey, Set<SourceId>> sourceIds = new HashMap<>();
    private final List<CommittedEvent> allEvents = new ArrayList<>();
    private long lastGlobalSequenceNumber;

    @Override
    public List<CommittedEvent> commit(String aggregateName, String aggregateId, SourceId sourceId,
            List<SerializedEvent> events) throws EventStoreException {
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        StreamKey key = new StreamKey(aggregateName, aggregateId);
        synchronized (lock) {
            Set<SourceId> knownSources = sourceIds.computeIfAbsent(key, k -> new HashSet<>());
            if (knownSources.contains(sourceId)) {
                throw EventStoreException.duplicateOperation(aggregateName, aggregateId, sourceId.getValue());
            }
            List<CommittedEvent> stream = streams.computeIfAbsent(key, k -> new ArrayList<>());
            long currentVersion = stream.isEmpty() ? 0 : stream.get(stream.size() - 1).getAggregateSequenceNumber();
            long expectedVersion = events.get(0).getAggregateSequenceNumber() - 1;
            if (currentVersion != expectedVersion) {
                throw EventStoreException.optimisticLock(aggregateName, aggregateId, expectedVersion, currentVersion);
            }
            List<CommittedEvent> committed = new ArrayList<>(events.size());
            for (SerializedEvent event : events) {
                committed.add(CommittedEvent.of(aggregateName, aggregateId, ++lastGlobalSequenceNumber, event));
            }
            stream.addAll(committed);
            allEvents.addAll(committed);
            knownSources.add(sourceId);
            return committed;
        }
    }

    @Override
    public List<CommittedEvent> load(String aggregateName, String aggregateId, long fromSequenceNumber) {
        synchronized (lock) {
            List<CommittedEvent> stream = streams.getOrDefault(new StreamKey(aggregateName, aggregateId),
                Collections.emptyList());
            return stream.stream().filter(e -> e.getAggregateSequenceNumber() >= fromSequenceNumber).collect(toList());
        }
    }

    @Override
    public EventsPage<CommittedEvent> loadAll(GlobalPosition position, int pageSize) {
        synchronized (lock) {
            List<CommittedEvent> page = allEvents.stream()
                    .filter(e -> e.getGlobalSequenceNumber() >= position.getNextSequenceNumber())
                    .limit(pageSize)
                    .collect(toList());
            GlobalPosition next = page.isEmpty()
                    ? position
                    : GlobalPosition.after(page.get(page.size() - 1).getGlobalSequenceNumber());
            return new EventsPage<>(next, page);
        }
    }

    @Override
    public int delete(String aggregateName, String aggregateId) {
        StreamKey key = new StreamKey(aggregateName, aggregateId);
        synchronized (lock) {
            List<CommittedEvent> removed = streams.remove(key);
            sourceIds.remove(key);
            if (removed == null) {
                return 0;
            }
            allEvents.removeIf(e -> key.matches(e));
            return removed.size();
        }
    }

    private static final class StreamKey {
        private final String aggregateName;
        private final String aggregateId;

        StreamKey(String aggregateName, String aggregateId) {
            this.aggregateName = Objects.requireNonNull(aggregateName);
            this.aggregateId = Objects.requireNonNull(aggregateId);
        }

        boolean matches(CommittedEvent event) {
            return aggregateName.equals(event.getAggregateName()) && aggregateId.equals(event.getAggregateId());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof StreamKey)) {
                return false;
            }
            StreamKey other = (StreamKey) o;
            return aggregateName.equals(other.aggregateName) && aggregateId.equals(other.aggregateId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(aggregateName, aggregateId);
        }
    }
}
