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
 * Snapshot in persisted form.
 */
public final class SerializedSnapshot {
    private final String aggregateName;
    private final String aggregateId;
    private final long aggregateSequenceNumber;
    private final String snapshotName;
    private final int snapshotVersion;
    private final String data;
    private final String metadata;

    public SerializedSnapshot(String aggregateName, String aggregateId, long aggregateSequenceNumber,
            String snapshotName, int snapshotVersion, String data, String metadata) {
        this.aggregateName = Objects.requireNonNull(aggregateName);
        this.aggregateId = Objects.requireNonNull(aggregateId);
        this.aggregateSequenceNumber = aggregateSequenceNumber;
        this.snapshotName = Objects.requireNonNull(snapshotName);
        this.snapshotVersion = snapshotVersion;
        this.data = Objects.requireNonNull(data);
        this.metadata = Objects.requireNonNull(metadata);
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

    public String getSnapshotName() {
        return snapshotName;
    }

    public int getSnapshotVersion() {
        return snapshotVersion;
    }

    public String getData() {
        return data;
    }

    public String getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "Snapshot " + snapshotName + " v" + snapshotVersion + " of " + aggregateName + " " + aggregateId
                + " at version " + aggregateSequenceNumber;
    }
}
