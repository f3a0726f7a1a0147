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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Upgrader replacing payloads of one past event type with the current one, one to one. Events of other types pass
 * through.
 *
 * @param <F> the past event type
 */
public abstract class SingleEventUpgrader<F extends AggregateEvent> implements EventUpgrader {
    private final Class<F> upgradedType;

    protected SingleEventUpgrader(Class<F> upgradedType) {
        this.upgradedType = Objects.requireNonNull(upgradedType);
    }

    @Override
    public final List<DomainEvent> upgrade(DomainEvent event) {
        if (upgradedType.isInstance(event.getEvent())) {
            return Collections.singletonList(event.upgradeTo(upgrade(upgradedType.cast(event.getEvent()))));
        }
        return Collections.singletonList(event);
    }

    protected abstract AggregateEvent upgrade(F event);
}
