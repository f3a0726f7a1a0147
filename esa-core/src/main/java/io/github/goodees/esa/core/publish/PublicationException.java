package io.github.goodees.esa.core.publish;

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

import java.util.Collections;
import java.util.List;

/**
 * Publication of committed events failed. The events are durable, and are available to the caller.
 */
public class PublicationException extends Exception {
    private final transient List<DomainEvent> committedEvents;

    public PublicationException(List<DomainEvent> committedEvents, Throwable cause) {
        super("Publication of " + committedEvents.size() + " committed events failed: " + cause.getMessage(), cause);
        this.committedEvents = Collections.unmodifiableList(committedEvents);
    }

    public List<DomainEvent> getCommittedEvents() {
        return committedEvents;
    }
}
