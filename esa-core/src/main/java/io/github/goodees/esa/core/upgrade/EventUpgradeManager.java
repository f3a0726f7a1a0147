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

import io.github.goodees.esa.core.DomainEvent;
import io.github.goodees.esa.core.definition.VersionedTypeNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs events read from the store through upgraders of their aggregate type.
 * <p>Upgraders of an aggregate are ordered by {@linkplain EventUpgrader#name() name}. Upgrading is a single ordered
 * pass: every event goes through each upgrader exactly once, and all events produced by an upgrader are passed to the
 * next one. There is no search for a fixed point, so a chain of upgrades from version 1 to version 3 requires the
 * upgrader from 1 to 2 to be ordered before the upgrader from 2 to 3.</p>
 * <p>The manager is built once and immutable.</p>
 */
public final class EventUpgradeManager {
    private static final Logger logger = LoggerFactory.getLogger(EventUpgradeManager.class);
    private static final EventUpgradeManager NONE = new EventUpgradeManager(Collections.emptyMap());
    private static final Comparator<EventUpgrader> ORDER = Comparator.comparing(EventUpgrader::name)
            .thenComparing(u -> u.getClass().getName());

    private final Map<String, List<EventUpgrader>> upgraders;

    private EventUpgradeManager(Map<String, List<EventUpgrader>> upgraders) {
        this.upgraders = upgraders;
    }

    public static EventUpgradeManager none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Upgrade events of single aggregate. Result is sorted by aggregate sequence number, the sort is stable so events
     * created by splitting one event keep their order.
     * @param events events in order of aggregate sequence number
     * @return upgraded events, the input itself if no upgraders apply
     * @throws EventUpgradeException if any upgrader fails
     */
    public List<DomainEvent> upgrade(List<DomainEvent> events) {
        if (!hasUpgradersFor(events)) {
            return events;
        }
        List<DomainEvent> result = new ArrayList<>();
        for (DomainEvent event : events) {
            result.addAll(upgrade(event));
        }
        result.sort(Comparator.comparingLong(DomainEvent::getAggregateSequenceNumber));
        return result;
    }

    /**
     * Upgrade events of multiple aggregates in global order. Upgraded events stay at the position of their source.
     * @param events events in global order
     * @return upgraded events, the input itself if no upgraders apply
     * @throws EventUpgradeException if any upgrader fails
     */
    public List<DomainEvent> upgradeInGlobalOrder(List<DomainEvent> events) {
        if (!hasUpgradersFor(events)) {
            return events;
        }
        List<DomainEvent> result = new ArrayList<>();
        for (DomainEvent event : events) {
            result.addAll(upgrade(event));
        }
        return result;
    }

    private boolean hasUpgradersFor(List<DomainEvent> events) {
        if (upgraders.isEmpty()) {
            return false;
        }
        for (DomainEvent event : events) {
            if (upgraders.containsKey(event.getAggregateName())) {
                return true;
            }
        }
        return false;
    }

    private List<DomainEvent> upgrade(DomainEvent event) {
        List<EventUpgrader> chain = upgraders.getOrDefault(event.getAggregateName(), Collections.emptyList());
        List<DomainEvent> current = Collections.singletonList(event);
        for (EventUpgrader upgrader : chain) {
            List<DomainEvent> next = new ArrayList<>();
            for (DomainEvent e : current) {
                List<DomainEvent> upgraded;
                try {
                    upgraded = upgrader.upgrade(e);
                } catch (RuntimeException ex) {
                    throw new EventUpgradeException(upgrader.name(), e, ex);
                }
                if (upgraded == null) {
                    throw new EventUpgradeException(upgrader.name(), e,
                            new NullPointerException("Upgrader returned null"));
                }
                next.addAll(upgraded);
            }
            if (logger.isTraceEnabled() && !next.equals(current)) {
                logger.trace("{} upgraded {} to {}", upgrader.name(), current, next);
            }
            current = next;
        }
        return current;
    }

    public List<EventUpgrader> upgradersOf(String aggregateName) {
        return upgraders.getOrDefault(aggregateName, Collections.emptyList());
    }

    public static class Builder {
        private final Map<String, List<EventUpgrader>> upgraders = new HashMap<>();

        public Builder add(String aggregateName, EventUpgrader upgrader) {
            Objects.requireNonNull(upgrader, "Upgrader cannot be null");
            upgraders.computeIfAbsent(aggregateName, n -> new ArrayList<>()).add(upgrader);
            return this;
        }

        public Builder add(Class<?> aggregateClass, EventUpgrader upgrader) {
            return add(VersionedTypeNames.aggregateName(aggregateClass), upgrader);
        }

        public EventUpgradeManager build() {
            Map<String, List<EventUpgrader>> sorted = new HashMap<>();
            upgraders.forEach((name, list) -> {
                List<EventUpgrader> copy = new ArrayList<>(list);
                copy.sort(ORDER);
                sorted.put(name, Collections.unmodifiableList(copy));
            });
            return new EventUpgradeManager(Collections.unmodifiableMap(sorted));
        }
    }
}
