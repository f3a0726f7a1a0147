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

/**
 * An upgrader failed. Events of the aggregate cannot be read until the upgrader or the data is fixed.
 */
public class EventUpgradeException extends RuntimeException {
    private final transient DomainEvent event;

    public EventUpgradeException(String upgrader, DomainEvent event, Throwable cause) {
        super("Upgrader " + upgrader + " failed on " + event + ": " + cause.getMessage(), cause);
        this.event = event;
    }

    public DomainEvent getEvent() {
        return event;
    }
}
