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

import io.github.goodees.esa.core.SourceId;

import java.util.List;

/**
 * Storage backend of the {@link EventStore}. An append-only log per aggregate, keyed by aggregate name and id, and
 * ordered globally by monotonic global sequence number.
 * <p>Implementations must guarantee:</p>
 * <ul>
 * <li>{@link #commit} is atomic. Either all events are durably appended with contiguous aggregate sequence numbers,
 * or none are.</li>
 * <li>An append that does not directly follow the last committed event of the aggregate fails with
 * {@link EventStoreException.Fault#OPTIMISTIC_LOCK}.</li>
 * <li>An append with source id already committed for the aggregate fails with
 * {@link EventStoreException.Fault#DUPLICATE_OPERATION}.</li>
 * <li>Global sequence numbers are strictly increasing in commit order, and a reader never observes a global sequence
 * number before all lower ones are committed.</li>
 * </ul>
 */
public interface EventPersistence {
    /**
     * Append events of single aggregate.
     * @param aggregateName name of aggregate type
     * @param aggregateId id of the aggregate
     * @param sourceId source of the events
     * @param events events to append, ordered by aggregate sequence number
     * @return committed events with global sequence numbers
     * @throws EventStoreException on conflict or storage failure
     */
    List<CommittedEvent> commit(String aggregateName, String aggregateId, SourceId sourceId,
            List<SerializedEvent> events) throws EventStoreException;

    /**
     * Read events of an aggregate.
     * @param aggregateName name of aggregate type
     * @param aggregateId id of the aggregate
     * @param fromSequenceNumber first aggregate sequence number to read
     * @return events ordered by aggregate sequence number, empty list for unknown aggregate
     * @throws EventStoreException on storage failure
     */
    List<CommittedEvent> load(String aggregateName, String aggregateId, long fromSequenceNumber)
            throws EventStoreException;

    /**
     * Read events of all aggregates in global order.
     * @param position position to read from
     * @param pageSize maximal number of events to return
     * @return page of events
     * @throws EventStoreException on storage failure
     */
    EventsPage<CommittedEvent> loadAll(GlobalPosition position, int pageSize) throws EventStoreException;

    /**
     * Delete all events and source ids of an aggregate.
     * @param aggregateName name of aggregate type
     * @param aggregateId id of the aggregate
     * @return number of deleted events
     * @throws EventStoreException on storage failure
     */
    int delete(String aggregateName, String aggregateId) throws EventStoreException;
}
