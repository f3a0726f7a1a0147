package io.github.goodees.esa.core.upgrade;

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

import io.github.goodees.esa.core.AggregateEvent;
import io.github.goodees.esa.core.DomainEvent;
import io.github.goodees.esa.core.Metadata;
import io.github.goodees.esa.example.counter.IncrementedEvent;
import io.github.goodees.esa.example.counter.OldIncrementedEvent;
import io.github.goodees.esa.example.counter.ResetEvent;
import org.junit.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class EventUpgradeManagerTest {

    private static DomainEvent event(String aggregate, long sequence, long global, AggregateEvent payload) {
        return new DomainEvent(aggregate, "1", sequence, global, "b", payload, Metadata.empty(), Instant.now());
    }

    /**
     * Splits an increment into two halves.
     */
    static class SplitUpgrader implements EventUpgrader {
        @Override
        public List<DomainEvent> upgrade(DomainEvent event) {
            if (event.getEvent() instanceof IncrementedEvent) {
                int amount = ((IncrementedEvent) event.getEvent()).getAmount();
                return Arrays.asList(event.upgradeTo(IncrementedEvent.of(amount / 2)),
                    event.upgradeTo(IncrementedEvent.of(amount - amount / 2)));
            }
            return Collections.singletonList(event);
        }
    }

    /**
     * Drops reset events.
     */
    static class DropResetUpgrader implements EventUpgrader {
        @Override
        public List<DomainEvent> upgrade(DomainEvent event) {
            return event.getEvent() instanceof ResetEvent ? Collections.emptyList() : Collections.singletonList(event);
        }
    }

    static class ConvertOldUpgrader extends SingleEventUpgrader<OldIncrementedEvent> {
        ConvertOldUpgrader() {
            super(OldIncrementedEvent.class);
        }

        @Override
        protected AggregateEvent upgrade(OldIncrementedEvent event) {
            return IncrementedEvent.of(event.getSteps() * 10);
        }

        @Override
        public String name() {
            return "1-convert";
        }
    }

    private static List<AggregateEvent> payloads(List<DomainEvent> events) {
        return events.stream().map(DomainEvent::getEvent).collect(toList());
    }

    @Test
    public void events_without_upgraders_pass_unchanged() {
        List<DomainEvent> events = Collections.singletonList(event("Other", 1, 1, IncrementedEvent.of(1)));
        EventUpgradeManager manager = EventUpgradeManager.builder().add("Counter", new SplitUpgrader()).build();
        assertSame(events, manager.upgrade(events));
        assertSame(events, EventUpgradeManager.none().upgrade(events));
    }

    @Test
    public void upgraders_apply_in_name_order() {
        EventUpgradeManager manager = EventUpgradeManager.builder()
                .add("Counter", new SplitUpgrader())
                .add("Counter", new ConvertOldUpgrader())
                .build();
        List<DomainEvent> upgraded = manager.upgrade(Collections.singletonList(event("Counter", 1, 1,
            OldIncrementedEvent.of(1))));
        assertThat(payloads(upgraded), contains(IncrementedEvent.of(5), IncrementedEvent.of(5)));
    }

    @Test
    public void split_and_dropped_events_keep_sequence_order() {
        EventUpgradeManager manager = EventUpgradeManager.builder()
                .add("Counter", new SplitUpgrader())
                .add("Counter", new DropResetUpgrader())
                .build();
        List<DomainEvent> upgraded = manager.upgrade(Arrays.asList(event("Counter", 1, 1, IncrementedEvent.of(4)),
            event("Counter", 2, 2, ResetEvent.of("x")), event("Counter", 3, 3, IncrementedEvent.of(3))));
        assertThat(payloads(upgraded), contains(IncrementedEvent.of(2), IncrementedEvent.of(2),
            IncrementedEvent.of(1), IncrementedEvent.of(2)));
        assertThat(upgraded.stream().map(DomainEvent::getAggregateSequenceNumber).collect(toList()), contains(1L, 1L,
            3L, 3L));
    }

    @Test
    public void global_order_is_kept() {
        EventUpgradeManager manager = EventUpgradeManager.builder().add("Counter", new SplitUpgrader()).build();
        List<DomainEvent> upgraded = manager.upgradeInGlobalOrder(Arrays.asList(
            event("Counter", 5, 1, IncrementedEvent.of(2)),
            event("Other", 1, 2, IncrementedEvent.of(7)),
            event("Counter", 6, 3, IncrementedEvent.of(4))));
        assertThat(upgraded.stream().map(DomainEvent::getGlobalSequenceNumber).collect(toList()), contains(1L, 1L, 2L,
            3L, 3L));
    }

    @Test
    public void failing_upgrader_reports_event() {
        EventUpgrader failing = event -> {
            throw new IllegalStateException("broken");
        };
        EventUpgradeManager manager = EventUpgradeManager.builder().add("Counter", failing).build();
        DomainEvent event = event("Counter", 1, 1, IncrementedEvent.of(1));
        try {
            manager.upgrade(Collections.singletonList(event));
            fail("Should have failed");
        } catch (EventUpgradeException e) {
            assertSame(event, e.getEvent());
            assertEquals(IllegalStateException.class, e.getCause().getClass());
        }
    }

    @Test(expected = EventUpgradeException.class)
    public void upgrader_returning_null_fails() {
        EventUpgradeManager manager = EventUpgradeManager.builder().add("Counter", event -> null).build();
        manager.upgrade(Collections.singletonList(event("Counter", 1, 1, IncrementedEvent.of(1))));
    }
}
