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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One page of the global event sequence, with position to continue from.
 *
 * @param <E> type of events, serialized or deserialized
 */
public final class EventsPage<E> {
    private final GlobalPosition nextPosition;
    private final List<E> events;

    public EventsPage(GlobalPosition nextPosition, List<E> events) {
        this.nextPosition = Objects.requireNonNull(nextPosition);
        this.events = Collections.unmodifiableList(events);
    }

    /**
     * Position to pass to next read. When the page is empty, it is the position the page was read from.
     * @return position of next page
     */
    public GlobalPosition getNextPosition() {
        return nextPosition;
    }

    public List<E> getEvents() {
        return events;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
