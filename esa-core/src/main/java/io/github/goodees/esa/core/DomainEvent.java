package io.github.goodees.esa.core;

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

import java.time.Instant;
import java.util.Objects;

/**
 * An event as committed in the event store. It knows its position both within the history of its aggregate, and
 * within the whole store.
 * <p>The triple of aggregate name, aggregate id and aggregate sequence number identifies the event, and consumers of
 * the event stream should use it to recognize events they already processed.</p>
 */
public final class DomainEvent {
    private final String aggregateName;
    private final String aggregateId;
    private final long aggregateSequenceNumber;
    private final long globalSequenceNumber;
    private final String batchId;
    private final AggregateEvent event;
    private final Metadata metadata;
    private final Instant timestamp;

    public DomainEvent(String aggregateName, String aggregateId, long aggregateSequenceNumber,
            long globalSequenceNumber, String batchId, AggregateEvent event, Metadata metadata, Instant timestamp) {
        this.aggregateName = Objects.requireNonNull(aggregateName, "Aggregate name must be specified");
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        if (aggregateSequenceNumber < 1) {
            throw new IllegalArgumentException("Aggregate sequence number must be positive, got "
                    + aggregateSequenceNumber);
        }
        this.aggregateSequenceNumber = aggregateSequenceNumber;
        this.globalSequenceNumber = globalSequenceNumber;
        this.batchId = batchId;
        this.event = Objects.requireNonNull(event, "Event must be specified");
        this.metadata = Objects.requireNonNull(metadata, "Metadata must be specified");
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must be specified");
    }

    /**
     * Create a copy of this event with different payload at the same position. This is how
     * {@linkplain io.github.goodees.esa.core.upgrade.EventUpgrader upgraders} replace old shapes of events.
     * @param upgraded new payload
     * @return event at same position with new payload
     */
    public DomainEvent upgradeTo(AggregateEvent upgraded) {
        return new DomainEvent(aggregateName, aggregateId, aggregateSequenceNumber, globalSequenceNumber, batchId,
            upgraded, metadata, timestamp);
    }

    public String getAggregateName() {
        return aggregateName;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getAggregateSequenceNumber() {
        return aggregateSequenceNumber;
    }

    public long getGlobalSequenceNumber() {
        return globalSequenceNumber;
    }

    public String getBatchId() {
        return batchId;
    }

    public AggregateEvent getEvent() {
        return event;
    }

    public Class<? extends AggregateEvent> getEventType() {
        return event.getClass();
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DomainEvent that = (DomainEvent) o;
        return aggregateSequenceNumber == that.aggregateSequenceNumber
                && globalSequenceNumber == that.globalSequenceNumber
                && aggregateName.equals(that.aggregateName)
                && aggregateId.equals(that.aggregateId)
                && event.equals(that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateName, aggregateId, aggregateSequenceNumber);
    }

    @Override
    public String toString() {
        return aggregateName + "/" + aggregateId + "#" + aggregateSequenceNumber + " (global " + globalSequenceNumber
                + "): " + event;
    }
}
