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

import java.util.Objects;

/**
 * Event as read from persistence, still in serialized form.
 */
public final class CommittedEvent {
    private final String aggregateName;
    private final String aggregateId;
    private final long aggregateSequenceNumber;
    private final long globalSequenceNumber;
    private final String eventName;
    private final int eventVersion;
    private final String batchId;
    private final String data;
    private final String metadata;

    public CommittedEvent(String aggregateName, String aggregateId, long aggregateSequenceNumber,
            long globalSequenceNumber, String eventName, int eventVersion, String batchId, String data,
            String metadata) {
        this.aggregateName = Objects.requireNonNull(aggregateName);
        this.aggregateId = Objects.requireNonNull(aggregateId);
        this.aggregateSequenceNumber = aggregateSequenceNumber;
        this.globalSequenceNumber = globalSequenceNumber;
        this.eventName = Objects.requireNonNull(eventName);
        this.eventVersion = eventVersion;
        this.batchId = batchId;
        this.data = Objects.requireNonNull(data);
        this.metadata = Objects.requireNonNull(metadata);
    }

    /**
     * Committed counterpart of an event that was just appended.
     * @param aggregateName name of the aggregate
     * @param aggregateId id of the aggregate
     * @param globalSequenceNumber global sequence number assigned by the backend
     * @param event the appended event
     * @return committed event
     */
    public static CommittedEvent of(String aggregateName, String aggregateId, long globalSequenceNumber,
            SerializedEvent event) {
        return new CommittedEvent(aggregateName, aggregateId, event.getAggregateSequenceNumber(),
            globalSequenceNumber, event.getEventName(), event.getEventVersion(), event.getBatchId(), event.getData(),
            event.getSerializedMetadata());
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

    public String getEventName() {
        return eventName;
    }

    public int getEventVersion() {
        return eventVersion;
    }

    public String getBatchId() {
        return batchId;
    }

    public String getData() {
        return data;
    }

    public String getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return aggregateName + "/" + aggregateId + "#" + aggregateSequenceNumber + " (global " + globalSequenceNumber
                + ") " + eventName + " v" + eventVersion;
    }
}
