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

import io.github.goodees.esa.core.Metadata;

import java.util.Objects;

/**
 * Event prepared for persistence. Payload and metadata are already serialized, metadata is kept in parsed form as well
 * for backends that store some keys in separate columns.
 */
public final class SerializedEvent {
    private final long aggregateSequenceNumber;
    private final String eventName;
    private final int eventVersion;
    private final String data;
    private final String serializedMetadata;
    private final Metadata metadata;

    public SerializedEvent(long aggregateSequenceNumber, String eventName, int eventVersion, String data,
            String serializedMetadata, Metadata metadata) {
        this.aggregateSequenceNumber = aggregateSequenceNumber;
        this.eventName = Objects.requireNonNull(eventName);
        this.eventVersion = eventVersion;
        this.data = Objects.requireNonNull(data);
        this.serializedMetadata = Objects.requireNonNull(serializedMetadata);
        this.metadata = Objects.requireNonNull(metadata);
    }

    public long getAggregateSequenceNumber() {
        return aggregateSequenceNumber;
    }

    public String getEventName() {
        return eventName;
    }

    public int getEventVersion() {
        return eventVersion;
    }

    public String getData() {
        return data;
    }

    public String getSerializedMetadata() {
        return serializedMetadata;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public String getBatchId() {
        return metadata.getBatchId();
    }

    @Override
    public String toString() {
        return eventName + " v" + eventVersion + " #" + aggregateSequenceNumber;
    }
}
