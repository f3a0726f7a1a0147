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

import io.github.goodees.esa.core.Cancellation;
import io.github.goodees.esa.core.DomainEvent;
import io.github.goodees.esa.core.Identities;
import io.github.goodees.esa.core.Metadata;
import io.github.goodees.esa.core.MetadataKeys;
import io.github.goodees.esa.core.SourceId;
import io.github.goodees.esa.core.UncommittedEvent;
import io.github.goodees.esa.core.upgrade.EventUpgradeManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Event store combines {@linkplain EventSerializer serialization}, {@linkplain EventPersistence persistence} and
 * {@linkplain EventUpgradeManager upgrades} into appending new events of an aggregate and reading its history.
 * <p>Events returned by the store are always passed through the upgrade manager, regardless if they were just written
 * or read, so callers always observe the same shapes of events.</p>
 */
public class EventStore {
    private static final Logger logger = LoggerFactory.getLogger(EventStore.class);

    private final EventPersistence persistence;
    private final EventSerializer serializer;
    private final EventUpgradeManager upgradeManager;

    public EventStore(EventPersistence persistence, EventSerializer serializer, EventUpgradeManager upgradeManager) {
        this.persistence = Objects.requireNonNull(persistence, "Event persistence must be specified");
        this.serializer = Objects.requireNonNull(serializer, "Event serializer must be specified");
        this.upgradeManager = Objects.requireNonNull(upgradeManager, "Upgrade manager must be specified");
    }

    /**
     * Append events of an aggregate. All events are stored in one batch, identified by metadata key
     * {@value MetadataKeys#BATCH_ID}.
     * @param aggregateName name of aggregate type
     * @param aggregateId id of the aggregate
     * @param events events to append, with contiguous aggregate sequence numbers
     * @param sourceId source of the events
     * @param cancellation cancellation signal, checked before the append
     * @return committed events, empty list if {@code events} is empty
     * @throws EventStoreException with fault {@link EventStoreException.Fault#OPTIMISTIC_LOCK} when aggregate was
     *      modified meanwhile, {@link EventStoreException.Fault#DUPLICATE_OPERATION} when source id was already
     *      committed
     */
    public List<DomainEvent> store(String aggregateName, String aggregateId, List<UncommittedEvent> events,
            SourceId sourceId, Cancellation cancellation) throws EventStoreException {
        Identities.validate(aggregateName, "Aggregate name");
        Identities.validate(aggregateId, "Aggregate id");
        Objects.requireNonNull(sourceId, "Source id must be specified");
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        String batchId = UUID.randomUUID().toString();
        List<SerializedEvent> serialized = new ArrayList<>(events.size());
        for (UncommittedEvent event : events) {
            Metadata metadata = event.getMetadata()
                    .with(MetadataKeys.BATCH_ID, batchId)
                    .with(MetadataKeys.SOURCE_ID, sourceId.getValue());
            serialized.add(serializer.serialize(event.getEvent(), metadata));
        }
        checkSequence(aggregateName, aggregateId, serialized);
        cancellation.throwIfCancelled();

        List<CommittedEvent> committed = persistence.commit(aggregateName, aggregateId, sourceId, serialized);
        logger.debug("Committed {} events of {} {} in batch {}", committed.size(), aggregateName, aggregateId, batchId);
        return upgradeManager.upgrade(deserialize(committed));
    }

    private void checkSequence(String aggregateName, String aggregateId, List<SerializedEvent> events)
            throws EventStoreException {
        long expected = events.get(0).getAggregateSequenceNumber();
        for (SerializedEvent event : events) {
            if (!aggregateName.equals(event.getMetadata().getAggregateName())
                    || !aggregateId.equals(event.getMetadata().getAggregateId())) {
                throw EventStoreException.multipleAggregates(aggregateName + " " + aggregateId,
                    event.getMetadata().getAggregateName() + " " + event.getMetadata().getAggregateId());
            }
            if (event.getAggregateSequenceNumber() != expected) {
                throw EventStoreException.nonMonotonic(aggregateName, aggregateId, expected,
                    event.getAggregateSequenceNumber());
            }
            expected++;
        }
    }

    /**
     * Read history of an aggregate.
     * @param aggregateName name of aggregate type
     * @param aggregateId id of the aggregate
     * @param fromSequenceNumber first sequence number to read, 1 for full history
     * @param cancellation cancellation signal
     * @return upgraded events, empty for unknown aggregate
     * @throws EventStoreException when storage fails
     * @throws io.github.goodees.esa.core.upgrade.EventUpgradeException when an upgrader fails
     */
    public List<DomainEvent> load(String aggregateName, String aggregateId, long fromSequenceNumber,
            Cancellation cancellation) throws EventStoreException {
        Identities.validate(aggregateName, "Aggregate name");
        Identities.validate(aggregateId, "Aggregate id");
        if (fromSequenceNumber < 1) {
            throw new IllegalArgumentException("Sequence number to load from must be positive, got "
                    + fromSequenceNumber);
        }
        cancellation.throwIfCancelled();
        List<CommittedEvent> committed = persistence.load(aggregateName, aggregateId, fromSequenceNumber);
        return upgradeManager.upgrade(deserialize(committed));
    }

    public List<DomainEvent> load(String aggregateName, String aggregateId, Cancellation cancellation)
            throws EventStoreException {
        return load(aggregateName, aggregateId, 1, cancellation);
    }

    /**
     * Read events of all aggregates in global order. Passing {@link EventsPage#getNextPosition()} to the next call
     * continues exactly after the last returned event.
     * @param position position to read from
     * @param pageSize maximal number of events to read
     * @param cancellation cancellation signal
     * @return page of events
     * @throws IllegalArgumentException if page size is not positive
     * @throws EventStoreException when storage fails
     */
    public EventsPage<DomainEvent> loadAll(GlobalPosition position, int pageSize, Cancellation cancellation)
            throws EventStoreException {
        Objects.requireNonNull(position, "Position must be specified");
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive, got " + pageSize);
        }
        cancellation.throwIfCancelled();
        EventsPage<CommittedEvent> page = persistence.loadAll(position, pageSize);
        return new EventsPage<>(page.getNextPosition(),
            upgradeManager.upgradeInGlobalOrder(deserialize(page.getEvents())));
    }

    /**
     * Delete the history of an aggregate. This is an administrative operation, it makes the aggregate new again.
     * @param aggregateName name of aggregate type
     * @param aggregateId id of the aggregate
     * @throws EventStoreException when storage fails
     */
    public void deleteAggregate(String aggregateName, String aggregateId) throws EventStoreException {
        Identities.validate(aggregateName, "Aggregate name");
        Identities.validate(aggregateId, "Aggregate id");
        int deleted = persistence.delete(aggregateName, aggregateId);
        logger.info("Deleted {} events of aggregate {} {}", deleted, aggregateName, aggregateId);
    }

    private List<DomainEvent> deserialize(List<CommittedEvent> committed) {
        List<DomainEvent> result = new ArrayList<>(committed.size());
        for (CommittedEvent event : committed) {
            result.add(serializer.deserialize(event));
        }
        return result;
    }
}
