package io.github.goodees.esa.core.store.jdbc;

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

import io.github.goodees.esa.core.AggregateStore;
import io.github.goodees.esa.core.Cancellation;
import io.github.goodees.esa.core.DomainEvent;
import io.github.goodees.esa.core.SourceId;
import io.github.goodees.esa.core.publish.EventPublisher;
import io.github.goodees.esa.core.retry.RetryStrategy;
import io.github.goodees.esa.core.snapshot.SnapshotStrategies;
import io.github.goodees.esa.example.counter.CounterAggregate;
import io.github.goodees.esa.example.counter.TallyAggregate;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class JdbcAggregateStoreTest extends JdbcTest {
    private ExecutorService executor;

    @Before
    public void startExecutor() {
        executor = Executors.newFixedThreadPool(4);
    }

    @After
    public void stopExecutor() {
        executor.shutdownNow();
    }

    @Test
    public void concurrent_updates_converge() throws Exception {
        AggregateStore<TallyAggregate> tallies = new AggregateStore<>(TallyAggregate::new, eventStore, snapshotStore,
            EventPublisher.NONE, RetryStrategy.optimisticConcurrency(1000, 1, TimeUnit.MILLISECONDS), executor);
        List<CompletableFuture<List<DomainEvent>>> updates = new ArrayList<>();
        for (int i = 1; i <= 20; i++) {
            int amount = i;
            updates.add(tallies.updateAsync(name(), SourceId.random(), (t, c) -> t.add(amount), Cancellation.none()));
        }
        CompletableFuture.allOf(updates.toArray(new CompletableFuture<?>[0])).get(60, TimeUnit.SECONDS);

        TallyAggregate tally = tallies.load(name(), Cancellation.none());
        assertEquals(20, tally.getVersion());
        assertEquals(210, tally.getTotal());
        assertDb(20, "select count(distinct global_sequence_number) from esa_event where aggregate_id = ?", name());
        assertDb(20, "select count(*) from esa_source_id where aggregate_id = ?", name());
    }

    @Test
    public void aggregate_is_restored_from_stored_snapshot() throws Exception {
        AggregateStore<CounterAggregate> counters = new AggregateStore<>(
            id -> new CounterAggregate(id, SnapshotStrategies.everyFewVersions(2)), eventStore, snapshotStore,
            EventPublisher.NONE, RetryStrategy.noRetries(), executor);
        for (int i = 1; i <= 3; i++) {
            int amount = i;
            counters.update(name(), SourceId.random(), (counter, c) -> counter.increment(amount), Cancellation.none());
        }
        assertDb(2, "select sequence_number from esa_snapshot where aggregate_id = ?", name());

        CounterAggregate counter = counters.load(name(), Cancellation.none());
        assertTrue(counter.isRestoredFromSnapshot());
        assertEquals(1, counter.getAppliedEvents());
        assertEquals(6, counter.getValue());
        assertEquals(3, counter.getVersion());
    }

    @Test
    public void deleted_aggregate_starts_over() throws Exception {
        AggregateStore<TallyAggregate> tallies = new AggregateStore<>(TallyAggregate::new, eventStore, snapshotStore,
            EventPublisher.NONE);
        SourceId source = SourceId.of(name());
        tallies.update(name(), source, (t, c) -> t.add(7), Cancellation.none());
        eventStore.deleteAggregate("Tally", name());

        assertEquals(0, tallies.load(name(), Cancellation.none()).getVersion());
        assertEquals(1, tallies.update(name(), source, (t, c) -> t.add(7), Cancellation.none()).size());
    }
}
