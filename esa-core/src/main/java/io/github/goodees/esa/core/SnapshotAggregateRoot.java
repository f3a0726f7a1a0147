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

import io.github.goodees.esa.core.snapshot.Snapshot;
import io.github.goodees.esa.core.snapshot.SnapshotContainer;
import io.github.goodees.esa.core.snapshot.SnapshotMetadata;
import io.github.goodees.esa.core.snapshot.SnapshotStrategy;

import java.time.Instant;
import java.util.Objects;

/**
 * Aggregate that can compact its state into a snapshot, so that loading it does not need to replay the full history.
 * <p>When a snapshot exists, the store restores it via {@link #loadSnapshot(Snapshot, SnapshotMetadata)} and replays
 * only the events past the snapshot's version. After every commit the {@linkplain SnapshotStrategy strategy} decides
 * whether a new snapshot is created via {@link #createSnapshot()}.</p>
 *
 * @param <E> base type of events of this aggregate
 * @param <S> type of snapshot of this aggregate
 */
public abstract class SnapshotAggregateRoot<E extends AggregateEvent, S extends Snapshot> extends AggregateRoot<E> {
    private final Class<S> snapshotType;
    private final SnapshotStrategy snapshotStrategy;
    private long snapshotVersion;
    private boolean restoredFromSnapshot;

    protected SnapshotAggregateRoot(String id, Class<E> eventType, Class<S> snapshotType,
            SnapshotStrategy snapshotStrategy) {
        this(null, id, eventType, snapshotType, snapshotStrategy);
    }

    protected SnapshotAggregateRoot(String name, String id, Class<E> eventType, Class<S> snapshotType,
            SnapshotStrategy snapshotStrategy) {
        super(name, id, eventType);
        this.snapshotType = Objects.requireNonNull(snapshotType, "Snapshot type must be specified");
        this.snapshotStrategy = Objects.requireNonNull(snapshotStrategy, "Snapshot strategy must be specified");
    }

    /**
     * Return snapshot of current state.
     * @return the snapshot
     */
    protected abstract S createSnapshot();

    /**
     * Initialize the state from stored snapshot. Snapshots of past shapes are converted by
     * {@linkplain io.github.goodees.esa.core.snapshot.SnapshotUpgrader upgraders} before they reach this method.
     * @param snapshot the snapshot
     * @param metadata metadata of the snapshot
     */
    protected abstract void loadSnapshot(S snapshot, SnapshotMetadata metadata);

    public final Class<S> getSnapshotType() {
        return snapshotType;
    }

    /**
     * Version of last snapshot restored or stored by this instance.
     * @return snapshot version, 0 if there is none
     */
    public final long getSnapshotVersion() {
        return snapshotVersion;
    }

    public final boolean isRestoredFromSnapshot() {
        return restoredFromSnapshot;
    }

    final void restoreSnapshot(SnapshotContainer<S> container) {
        if (restoredFromSnapshot) {
            throw new IllegalStateException("Aggregate " + this + " already has snapshot loaded");
        }
        if (getVersion() > 0) {
            throw new IllegalStateException("Aggregate " + this + " already has events loaded");
        }
        SnapshotMetadata metadata = container.getMetadata();
        loadSnapshot(container.getSnapshot(), metadata);
        restoreVersion(metadata.getAggregateSequenceNumber(), metadata.getPreviousSourceIds());
        snapshotVersion = metadata.getAggregateSequenceNumber();
        restoredFromSnapshot = true;
    }

    final boolean shouldCreateSnapshot() {
        return snapshotStrategy.shouldCreateSnapshot(getVersion(), snapshotVersion);
    }

    final SnapshotContainer<S> createSnapshotContainer() {
        SnapshotMetadata metadata = SnapshotMetadata.builder()
                .aggregateName(getName())
                .aggregateId(getId())
                .aggregateSequenceNumber(getVersion())
                .previousSourceIds(getPreviousSourceIds())
                .timestamp(Instant.now())
                .build();
        return new SnapshotContainer<>(createSnapshot(), metadata);
    }

    final void snapshotStored(long version) {
        this.snapshotVersion = version;
    }
}
