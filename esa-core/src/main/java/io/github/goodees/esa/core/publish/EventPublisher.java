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

import io.github.goodees.esa.core.Cancellation;
import io.github.goodees.esa.core.DomainEvent;

import java.util.List;

/**
 * Receives events after they were durably committed, e. g. to update read models or drive sagas. The aggregate store
 * does not retry publication, events that failed to publish are to be picked up by a recovery process reading
 * {@link io.github.goodees.esa.core.store.EventStore#loadAll}.
 */
@FunctionalInterface
public interface EventPublisher {
    EventPublisher NONE = (events, cancellation) -> { };

    /**
     * Publish committed events.
     * @param events events of one commit, in order of aggregate sequence number
     * @param cancellation cancellation signal
     * @throws Exception when publication fails
     */
    void publish(List<DomainEvent> events, Cancellation cancellation) throws Exception;
}
