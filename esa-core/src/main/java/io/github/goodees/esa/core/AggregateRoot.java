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

import io.github.goodees.esa.core.definition.VersionedTypeNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A single event sourced aggregate. The aggregate is instantiated and loaded by an {@linkplain AggregateStore
 * aggregate store}, that replays its history and commits events it emits.
 * <p>An aggregate is identified by its name, which is shared by all instances of the aggregate type, and by unique
 * String id within that type.
 *
 * <p>An aggregate preserves its internal state. This state can <strong>only</strong> change as result of application
 * of an event in method {@link #apply(AggregateEvent)} (with exception of restoring a snapshot). Business methods of
 * the aggregate validate their input against the state and {@linkplain #emit(AggregateEvent) emit} events, which
 * are applied immediately and kept as uncommitted until the store commits them.</p>
 *
 * <p>An aggregate instance is not thread safe. It serves a single update, and a fresh instance is loaded for every
 * retry of the update.</p>
 *
 * @param <E> base type of events of this aggregate
 */
public abstract class AggregateRoot<E extends AggregateEvent> {
    /**
     * Number of source ids of recent commits an aggregate remembers to recognize repeated operations.
     */
    public static final int PREVIOUS_SOURCE_IDS = 10;

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final String name;
    private final String id;
    private final Class<E> eventType;
    private final List<UncommittedEvent> uncommittedEvents = new ArrayList<>();
    private final Deque<SourceId> previousSourceIds = new ArrayDeque<>();
    private long version;
    private LoadState loadState = LoadState.NEW;

    /**
     * States of loading the history of an aggregate.
     */
    public enum LoadState {
        NEW, LOADING, LOADED
    }

    /**
     * Constructor for aggregates named after their class, see {@link VersionedTypeNames#aggregateName(Class)}.
     * @param id the identity of the aggregate
     * @param eventType base type of events of this aggregate
     */
    protected AggregateRoot(String id, Class<E> eventType) {
        this(null, id, eventType);
    }

    protected AggregateRoot(String name, String id, Class<E> eventType) {
        this.name = Identities.validate(name == null ? VersionedTypeNames.aggregateName(getClass()) : name,
            "Aggregate name");
        this.id = Identities.validate(id, "Aggregate id");
        this.eventType = Objects.requireNonNull(eventType, "Event type must be specified");
    }

    public final String getName() {
        return name;
    }

    public final String getId() {
        return id;
    }

    /**
     * Version of an aggregate. It equals the sequence number of last applied event, either committed or emitted.
     * @return current version
     */
    public final long getVersion() {
        return version;
    }

    public final boolean isNew() {
        return version == 0;
    }

    public final LoadState getLoadState() {
        return loadState;
    }

    public final Class<E> getEventType() {
        return eventType;
    }

    public final List<UncommittedEvent> getUncommittedEvents() {
        return Collections.unmodifiableList(new ArrayList<>(uncommittedEvents));
    }

    public final boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    /**
     * Check whether an operation already contributed to the history of this aggregate. Only the source ids of last
     * {@value #PREVIOUS_SOURCE_IDS} commits are known, the event store itself detects older duplicates.
     * @param sourceId source id of the operation
     * @return true if events with this source id were committed recently
     */
    public final boolean hasSourceId(SourceId sourceId) {
        return previousSourceIds.contains(sourceId);
    }

    public final List<SourceId> getPreviousSourceIds() {
        return new ArrayList<>(previousSourceIds);
    }

    /**
     * Emit new event. The event is applied to the state immediately and queued for commit.
     * @param event event to emit
     */
    protected final void emit(E event) {
        emit(event, Metadata.empty());
    }

    /**
     * Emit new event with additional metadata. Reserved keys are populated by the aggregate and the store, and may
     * not be present in {@code metadata}.
     * @param event event to emit
     * @param metadata additional metadata
     */
    protected final void emit(E event, Metadata metadata) {
        Objects.requireNonNull(event, "Event cannot be null");
        if (loadState == LoadState.LOADING) {
            throw new IllegalStateException("Aggregate " + this + " cannot emit events while loading");
        }
        long sequenceNumber = version + 1;
        Instant now = Instant.now();
        Metadata eventMetadata = Metadata.empty()
                .with(MetadataKeys.TIMESTAMP, now.toString())
                .with(MetadataKeys.TIMESTAMP_EPOCH, now.toEpochMilli())
                .with(MetadataKeys.AGGREGATE_SEQUENCE_NUMBER, sequenceNumber)
                .with(MetadataKeys.AGGREGATE_NAME, name)
                .with(MetadataKeys.AGGREGATE_ID, id)
                .with(MetadataKeys.EVENT_ID, eventId(sequenceNumber))
                .with(metadata);
        applyEvent(event, sequenceNumber);
        uncommittedEvents.add(new UncommittedEvent(event, eventMetadata));
    }

    private String eventId(long sequenceNumber) {
        String key = name + "|" + id + "|" + sequenceNumber;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * Update the state as result of application of an event. This method must be very robust - it may not throw an
     * exception or break state invariants under any input, as the events are already facts. Failing to do so will make
     * the aggregate irrecoverable.
     * <p>Implementations usually delegate to a {@link io.github.goodees.esa.core.matching.TypeSwitch}.</p>
     *
     * @param event event to apply
     */
    protected abstract void apply(E event);

    private void applyEvent(AggregateEvent event, long sequenceNumber) {
        if (sequenceNumber != version + 1) {
            throw new IllegalStateException("Aggregate " + this + " cannot apply event #" + sequenceNumber
                    + ", expecting #" + (version + 1));
        }
        applyTyped(event, sequenceNumber);
    }

    private void applyTyped(AggregateEvent event, long sequenceNumber) {
        if (!eventType.isInstance(event)) {
            throw new IllegalStateException("Aggregate " + this + " cannot apply event of type "
                    + event.getClass().getName() + ", expecting " + eventType.getName());
        }
        apply(eventType.cast(event));
        version = sequenceNumber;
    }

    /**
     * Apply an event from history during loading. Upgraded history may skip sequence numbers of dropped events and
     * repeat sequence number of an event split into several, so the version follows the event's sequence number as
     * long as it does not step back.
     * @param event committed event
     * @throws IllegalStateException when not loading, or event is older than current version
     */
    final void applyCommitted(DomainEvent event) {
        if (loadState != LoadState.LOADING) {
            throw new IllegalStateException("Aggregate " + this + " is not loading, it is " + loadState);
        }
        if (!name.equals(event.getAggregateName()) || !id.equals(event.getAggregateId())) {
            throw new IllegalStateException("Aggregate " + this + " cannot apply event of " + event.getAggregateName()
                    + " " + event.getAggregateId());
        }
        long sequenceNumber = event.getAggregateSequenceNumber();
        if (sequenceNumber < version || sequenceNumber < 1) {
            throw new IllegalStateException("Aggregate " + this + " cannot apply event #" + sequenceNumber
                    + ", it is older than current version");
        }
        applyTyped(event.getEvent(), sequenceNumber);
        event.getMetadata().getSourceId().ifPresent(this::rememberSourceId);
    }

    final void beginLoad() {
        if (loadState != LoadState.NEW) {
            throw new IllegalStateException("Aggregate " + this + " is already " + loadState);
        }
        loadState = LoadState.LOADING;
    }

    final void completeLoad() {
        if (loadState != LoadState.LOADING) {
            throw new IllegalStateException("Aggregate " + this + " is not loading, it is " + loadState);
        }
        loadState = LoadState.LOADED;
    }

    /**
     * Set version and known source ids after state was restored from a snapshot.
     */
    final void restoreVersion(long restoredVersion, Collection<SourceId> sourceIds) {
        if (loadState != LoadState.LOADING) {
            throw new IllegalStateException("Aggregate " + this + " is not loading, it is " + loadState);
        }
        this.version = restoredVersion;
        sourceIds.forEach(this::rememberSourceId);
    }

    /**
     * Called by the store after uncommitted events were persisted.
     */
    final void markCommitted(SourceId sourceId) {
        uncommittedEvents.clear();
        rememberSourceId(sourceId);
    }

    private void rememberSourceId(SourceId sourceId) {
        if (previousSourceIds.contains(sourceId)) {
            return;
        }
        previousSourceIds.addLast(sourceId);
        while (previousSourceIds.size() > PREVIOUS_SOURCE_IDS) {
            previousSourceIds.removeFirst();
        }
    }

    @Override
    public String toString() {
        return name + " " + id + " v" + version;
    }
}
