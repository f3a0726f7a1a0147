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

import java.util.Objects;

/**
 * Event emitted by an aggregate and not yet persisted.
 */
public final class UncommittedEvent {
    private final AggregateEvent event;
    private final Metadata metadata;

    public UncommittedEvent(AggregateEvent event, Metadata metadata) {
        this.event = Objects.requireNonNull(event, "Event must be specified");
        this.metadata = Objects.requireNonNull(metadata, "Metadata must be specified");
    }

    public AggregateEvent getEvent() {
        return event;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "UncommittedEvent{" + event + ", " + metadata + '}';
    }
}
