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

import java.util.List;

/**
 * Rewrites events of one aggregate type as they were persisted into their current shape. An upgrader may keep an
 * event, replace it, drop it (e. g. for retired event types) or split it into several events.
 * <p>Upgraders must return events they do not handle unchanged, as every event of the aggregate passes through every
 * registered upgrader.</p>
 *
 * @see EventUpgradeManager
 * @see SingleEventUpgrader
 */
public interface EventUpgrader {

    /**
     * Upgrade single event.
     * @param event event to upgrade
     * @return zero or more events to replace the input
     */
    List<DomainEvent> upgrade(DomainEvent event);

    /**
     * Name determining the order in which upgraders of an aggregate are applied.
     * @return simple class name by default
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
