package io.github.goodees.esa.core.snapshot;

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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.github.goodees.esa.core.SourceId;
import io.github.goodees.esa.immutables.ImmutablesSupport;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.List;

/**
 * Header data of a snapshot.
 */
@Value.Immutable
@ImmutablesSupport
@JsonSerialize(as = ImmutableSnapshotMetadata.class)
@JsonDeserialize(as = ImmutableSnapshotMetadata.class)
public abstract class SnapshotMetadata {
    /**
     * Name of the aggregate type.
     * @return aggregate name
     */
    public abstract String getAggregateName();

    /**
     * Identity of the aggregate.
     * @return identity
     */
    public abstract String getAggregateId();

    /**
     * Aggregate version
     * @return the version aggregate was in when this snapshot was generated
     */
    public abstract long getAggregateSequenceNumber();

    /**
     * Source ids of last commits before the snapshot, so that duplicate operations are recognized after restore.
     * @return source ids, oldest first
     */
    public abstract List<SourceId> getPreviousSourceIds();

    /**
     * Timestamp of the snapshot
     * @return the time when snapshot was created
     */
    public abstract Instant getTimestamp();

    public static ImmutableSnapshotMetadata.Builder builder() {
        return ImmutableSnapshotMetadata.builder();
    }
}
