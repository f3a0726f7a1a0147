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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Publishes events to several publishers in order. All publishers are invoked even if some of them fail, the first
 * failure is thrown with the others suppressed.
 */
public class CompositeEventPublisher implements EventPublisher {
    private static final Logger logger = LoggerFactory.getLogger(CompositeEventPublisher.class);

    private final List<EventPublisher> publishers;

    public CompositeEventPublisher(List<EventPublisher> publishers) {
        this.publishers = Collections.unmodifiableList(new ArrayList<>(publishers));
    }

    public static EventPublisher of(EventPublisher... publishers) {
        return new CompositeEventPublisher(Arrays.asList(publishers));
    }

    @Override
    public void publish(List<DomainEvent> events, Cancellation cancellation) throws Exception {
        Exception failure = null;
        for (EventPublisher publisher : publishers) {
            try {
                publisher.publish(events, cancellation);
            } catch (Exception e) {
                logger.warn("Publisher {} failed to publish {} events", publisher, events.size(), e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
