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
import io.github.goodees.esa.core.Identities;
import io.github.goodees.esa.core.definition.VersionedTypeDefinition;
import io.github.goodees.esa.core.definition.VersionedTypeRegistry;
import io.github.goodees.esa.core.snapshot.Snapshot;
import io.github.goodees.esa.core.snapshot.SnapshotContainer;
import io.github.goodees.esa.core.snapshot.SnapshotMetadata;
import io.github.goodees.esa.core.snapshot.SnapshotUpgrader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Common logic for storing snapshots. Snapshots are an optimization only: a snapshot that cannot be read is logged
 * and reported as missing, so the aggregate is recovered by replaying its full history.
 * <p>Snapshots are persisted under name and version from the registry. When a stored snapshot is of other type than
 * the aggregate expects, registered {@linkplain SnapshotUpgrader upgraders} are chained to convert it.</p>
 */
public class SnapshotStore {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final SnapshotPersistence persistence;
    private final VersionedTypeRegistry<Snapshot> definitions;
    private final Serialization serialization;
    private final List<SnapshotUpgrader<?, ?>> upgraders;

    public SnapshotStore(SnapshotPersistence persistence, VersionedTypeRegistry<Snapshot> definitions,
            Serialization serialization) {
        this(persistence, definitions, serialization, Collections.emptyList());
    }

    public SnapshotStore(SnapshotPersistence persistence, VersionedTypeRegistry<Snapshot> definitions,
            Serialization serialization, List<SnapshotUpgrader<?, ?>> upgraders) {
        this.persistence = Objects.requireNonNull(persistence, "Snapshot persistence must be specified");
        this.definitions = Objects.requireNonNull(definitions, "Snapshot definitions must be specified");
        this.serialization = Objects.requireNonNull(serialization, "Serialization must be specified");
        this.upgraders = Collections.unmodifiableList(new ArrayList<>(upgraders));
    }

    /**
     * Read latest snapshot of an aggregate.
     * @param aggregateName name of aggregate type
     * @param aggregateId id of the aggregate
     * @param snapshotType type of snapshot the aggregate expects
     * @param cancellation cancellation signal
     * @param <S> type of snapshot
     * @return the snapshot, empty if there is none or it cannot be read or upgraded
     */
    public <S extends Snapshot> Optional<SnapshotContainer<S>> load(String aggregateName, String aggregateId,
            Class<S> snapshotType, Cancellation cancellation) {
        cancellation.throwIfCancelled();
        try {
            Optional<SerializedSnapshot> stored = persistence.get(aggregateName, aggregateId);
            if (!stored.isPresent()) {
                return Optional.empty();
            }
            SerializedSnapshot record = stored.get();
            Snapshot snapshot = serialization.deserialize(record.getData(),
                definitions.typeOf(record.getSnapshotName(), record.getSnapshotVersion()));
            SnapshotMetadata metadata = serialization.deserialize(record.getMetadata(), SnapshotMetadata.class);
            Optional<S> upgraded = upgrade(snapshot, snapshotType);
            if (!upgraded.isPresent()) {
                logger.warn("{} cannot be upgraded to {}, ignoring it", record, snapshotType.getName());
            }
            return upgraded.map(s -> new SnapshotContainer<>(s, metadata));
        } catch (EventStoreException | RuntimeException e) {
            logger.error("Failure during reading snapshot of {} {}", aggregateName, aggregateId, e);
            return Optional.empty();
        }
    }

    private <S extends Snapshot> Optional<S> upgrade(Snapshot snapshot, Class<S> snapshotType) {
        Snapshot current = snapshot;
        // every upgrader is used at most once, cycles end here
        for (int i = 0; i < upgraders.size() && !snapshotType.isInstance(current); i++) {
            SnapshotUpgrader<?, ?> upgrader = findUpgrader(current);
            if (upgrader == null) {
                break;
            }
            current = applyUpgrader(upgrader, current);
        }
        return snapshotType.isInstance(current) ? Optional.of(snapshotType.cast(current)) : Optional.empty();
    }

    private SnapshotUpgrader<?, ?> findUpgrader(Snapshot snapshot) {
        for (SnapshotUpgrader<?, ?> upgrader : upgraders) {
            if (upgrader.fromType().isInstance(snapshot)) {
                return upgrader;
            }
        }
        return null;
    }

    private static <F extends Snapshot> Snapshot applyUpgrader(SnapshotUpgrader<F, ?> upgrader, Snapshot snapshot) {
        return upgrader.upgrade(upgrader.fromType().cast(snapshot));
    }

    /**
     * Store a snapshot, replacing the previous one.
     * @param container snapshot with its metadata
     * @param cancellation cancellation signal
     * @throws EventStoreException when storage fails
     */
    public void store(SnapshotContainer<?> container, Cancellation cancellation) throws EventStoreException {
        cancellation.throwIfCancelled();
        SnapshotMetadata metadata = container.getMetadata();
        VersionedTypeDefinition definition = definitions.definitionOf(container.getSnapshot());
        SerializedSnapshot record = new SerializedSnapshot(metadata.getAggregateName(), metadata.getAggregateId(),
            metadata.getAggregateSequenceNumber(), definition.getName(), definition.getVersion(),
            serialization.serialize(container.getSnapshot()), serialization.serialize(metadata));
        persistence.set(record);
        logger.debug("Stored {}", record);
    }

    public void delete(String aggregateName, String aggregateId) throws EventStoreException {
        Identities.validate(aggregateName, "Aggregate name");
        Identities.validate(aggregateId, "Aggregate id");
        persistence.delete(aggregateName, aggregateId);
    }
}
