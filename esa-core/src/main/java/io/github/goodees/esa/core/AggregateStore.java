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

import io.github.goodees.esa.core.publish.EventPublisher;
import io.github.goodees.esa.core.publish.PublicationException;
import io.github.goodees.esa.core.retry.RetryStrategy;
import io.github.goodees.esa.core.snapshot.Snapshot;
import io.github.goodees.esa.core.snapshot.SnapshotContainer;
import io.github.goodees.esa.core.store.EventStore;
import io.github.goodees.esa.core.store.EventStoreException;
import io.github.goodees.esa.core.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Loads, mutates and commits aggregates of one type.
 *
 * <h2 id="update-lifecycle">Update lifecycle</h2>
 * <p>When {@linkplain #update update} is invoked, the store performs following steps:</p>
 * <ol>
 * <li>A fresh instance is created by the {@linkplain AggregateFactory factory} and {@linkplain #load loaded}: if the
 * aggregate supports snapshots and one is available, it is restored, and then all events past it are replayed.</li>
 * <li>If the aggregate already committed events of the update's source id, the update already happened, and an
 * empty list is returned.</li>
 * <li>The mutation is executed, and events it emitted are stored.</li>
 * <li>If storing fails on optimistic lock, the {@linkplain RetryStrategy retry strategy} decides whether whole update
 * is repeated with freshly loaded aggregate. When the event store reports the source id as duplicate, the update
 * succeeds without new events.</li>
 * <li>If the {@linkplain io.github.goodees.esa.core.snapshot.SnapshotStrategy snapshot strategy} asks for it, snapshot
 * is stored. Failure to store a snapshot is logged, and does not fail the update.</li>
 * <li>Committed events are passed to the {@linkplain EventPublisher publisher}. Failure of publication results in
 * {@link PublicationException} carrying the committed events.</li>
 * </ol>
 * <p>The store keeps no instances between updates and holds no locks. Concurrent updates of same aggregate are
 * resolved by the event store's append, different aggregates are updated in parallel.</p>
 *
 * @param <A> the type of aggregate this store handles
 */
public class AggregateStore<A extends AggregateRoot<?>> {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final AggregateFactory<A> factory;
    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final EventPublisher publisher;
    private final RetryStrategy retryStrategy;
    private final Executor executor;

    /**
     * Create store with default retry strategy, executing asynchronous updates in common fork-join pool.
     * @param factory factory of aggregate instances
     * @param eventStore the event store
     * @param snapshotStore the snapshot store
     * @param publisher publisher of committed events
     */
    public AggregateStore(AggregateFactory<A> factory, EventStore eventStore, SnapshotStore snapshotStore,
            EventPublisher publisher) {
        this(factory, eventStore, snapshotStore, publisher, RetryStrategy.optimisticConcurrency(),
            ForkJoinPool.commonPool());
    }

    /**
     * Create store.
     * @param factory factory of aggregate instances
     * @param eventStore the event store
     * @param snapshotStore the snapshot store
     * @param publisher publisher of committed events
     * @param retryStrategy strategy for retrying conflicting updates
     * @param executor executor for {@link #updateAsync}
     */
    public AggregateStore(AggregateFactory<A> factory, EventStore eventStore, SnapshotStore snapshotStore,
            EventPublisher publisher, RetryStrategy retryStrategy, Executor executor) {
        this.factory = Objects.requireNonNull(factory, "Aggregate factory must be specified");
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be specified");
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "Snapshot store must be specified");
        this.publisher = Objects.requireNonNull(publisher, "Event publisher must be specified");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "Retry strategy must be specified");
        this.executor = Objects.requireNonNull(executor, "Executor must be specified");
    }

    /**
     * Load current state of an aggregate.
     * @param id id of the aggregate
     * @param cancellation cancellation signal
     * @return loaded aggregate, at version 0 if it has no history
     * @throws EventStoreException when reading events fails
     */
    public A load(String id, Cancellation cancellation) throws EventStoreException {
        Identities.validate(id, "Aggregate id");
        long start = System.currentTimeMillis();
        A aggregate = instantiate(id);
        if (aggregate instanceof SnapshotAggregateRoot) {
            try {
                restoreSnapshot((SnapshotAggregateRoot<?, ?>) aggregate, cancellation);
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.warn("Restoring snapshot of {} failed, replaying full history", aggregate, e);
                aggregate = instantiate(id);
            }
        }
        long snapshotVersion = aggregate.getVersion();
        List<DomainEvent> events = eventStore.load(aggregate.getName(), id, snapshotVersion + 1, cancellation);
        for (DomainEvent event : events) {
            aggregate.applyCommitted(event);
        }
        aggregate.completeLoad();
        logger.debug("{} recovered in {} ms from snapshot version {} replaying {} events", aggregate,
            System.currentTimeMillis() - start, snapshotVersion, events.size());
        return aggregate;
    }

    private A instantiate(String id) {
        A aggregate = factory.create(id);
        Objects.requireNonNull(aggregate, () -> "Factory returned null for id " + id);
        if (!id.equals(aggregate.getId())) {
            throw new IllegalStateException("Factory created aggregate " + aggregate + " for id " + id);
        }
        aggregate.beginLoad();
        return aggregate;
    }

    private <S extends Snapshot> void restoreSnapshot(SnapshotAggregateRoot<?, S> aggregate,
            Cancellation cancellation) {
        Optional<SnapshotContainer<S>> snapshot = snapshotStore.load(aggregate.getName(), aggregate.getId(),
            aggregate.getSnapshotType(), cancellation);
        snapshot.ifPresent(aggregate::restoreSnapshot);
    }

    /**
     * Update an aggregate, as described in <a href="#update-lifecycle">update lifecycle</a>.
     * @param id id of the aggregate
     * @param sourceId identity of the update, used to recognize repeated updates
     * @param mutation the mutation to perform
     * @param cancellation cancellation signal. It is respected until events are committed, publication is never
     *      cancelled.
     * @param <X> checked exception of the mutation
     * @return committed events, empty if mutation emitted none or the update already happened
     * @throws EventStoreException when storing fails and retry strategy gives up
     * @throws PublicationException when events were committed, but publishing them failed
     * @throws X if mutation throws
     */
    public <X extends Exception> List<DomainEvent> update(String id, SourceId sourceId,
            AggregateMutation<? super A, X> mutation, Cancellation cancellation)
            throws EventStoreException, PublicationException, X {
        Objects.requireNonNull(sourceId, "Source id must be specified");
        Objects.requireNonNull(mutation, "Mutation must be specified");
        int failedAttempts = 0;
        while (true) {
            A aggregate = load(id, cancellation);
            if (aggregate.hasSourceId(sourceId)) {
                logger.debug("{} already contains events of source {}", aggregate, sourceId);
                return Collections.emptyList();
            }
            mutation.mutate(aggregate, cancellation);
            List<DomainEvent> committed;
            try {
                committed = commit(aggregate, sourceId, cancellation);
            } catch (EventStoreException e) {
                if (e.getFault() == EventStoreException.Fault.DUPLICATE_OPERATION) {
                    logger.info("{} already contains events of source {}, nothing to commit", aggregate, sourceId);
                    return Collections.emptyList();
                }
                failedAttempts++;
                long delay = retryStrategy.retryDelay(e, failedAttempts);
                if (delay == RetryStrategy.DO_NOT_RETRY) {
                    logger.error("Update of {} failed after {} attempts", aggregate, failedAttempts, e);
                    throw e;
                }
                logger.warn("Update of {} failed with {}, retrying in {} ms", aggregate, e.getFault(), delay);
                sleep(delay, aggregate);
                continue;
            }
            storeSnapshot(aggregate);
            publish(aggregate, committed);
            return committed;
        }
    }

    /**
     * Update an aggregate on the store's executor.
     * @param id id of the aggregate
     * @param sourceId identity of the update
     * @param mutation the mutation to perform
     * @param cancellation cancellation signal
     * @param <X> checked exception of the mutation
     * @return future of committed events, completing exceptionally with exceptions of {@link #update}
     */
    public <X extends Exception> CompletableFuture<List<DomainEvent>> updateAsync(String id, SourceId sourceId,
            AggregateMutation<? super A, X> mutation, Cancellation cancellation) {
        CompletableFuture<List<DomainEvent>> result = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                result.complete(update(id, sourceId, mutation, cancellation));
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        return result;
    }

    /**
     * Store uncommitted events of a loaded aggregate, without retries. Useful when the caller manages the aggregate's
     * lifecycle itself.
     * @param aggregate loaded aggregate
     * @param sourceId source of the events
     * @param cancellation cancellation signal
     * @return committed events
     * @throws EventStoreException when storing fails
     */
    public List<DomainEvent> commit(A aggregate, SourceId sourceId, Cancellation cancellation)
            throws EventStoreException {
        if (aggregate.getLoadState() != AggregateRoot.LoadState.LOADED) {
            throw new IllegalStateException("Aggregate " + aggregate + " was not loaded");
        }
        List<DomainEvent> committed = eventStore.store(aggregate.getName(), aggregate.getId(),
            aggregate.getUncommittedEvents(), sourceId, cancellation);
        aggregate.markCommitted(sourceId);
        return committed;
    }

    private void storeSnapshot(A aggregate) {
        if (!(aggregate instanceof SnapshotAggregateRoot)) {
            return;
        }
        SnapshotAggregateRoot<?, ?> snapshotAggregate = (SnapshotAggregateRoot<?, ?>) aggregate;
        if (!snapshotAggregate.shouldCreateSnapshot()) {
            return;
        }
        try {
            snapshotStore.store(snapshotAggregate.createSnapshotContainer(), Cancellation.none());
            snapshotAggregate.snapshotStored(snapshotAggregate.getVersion());
        } catch (Exception e) {
            logger.error("Creating snapshot of aggregate {} failed", aggregate, e);
        }
    }

    private void publish(A aggregate, List<DomainEvent> committed) throws PublicationException {
        if (committed.isEmpty()) {
            return;
        }
        try {
            publisher.publish(committed, Cancellation.none());
        } catch (Exception e) {
            logger.error("Publication of {} events of {} failed", committed.size(), aggregate, e);
            throw new PublicationException(committed, e);
        }
    }

    private void sleep(long delay, A aggregate) {
        if (delay <= RetryStrategy.RETRY_NOW) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while waiting to retry update of "
                    + aggregate);
            cancelled.initCause(e);
            throw cancelled;
        }
    }
}
