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

/**
 * Marker of event payloads. An event describes single state transition of single aggregate type, and carries no
 * identity of its own. Position of the event in history of an aggregate is tracked by {@link DomainEvent} and
 * {@link Metadata}.
 * <p>Implementations must be immutable and serializable by the event store's
 * {@linkplain io.github.goodees.esa.core.store.Serialization serialization}. Immutables-generated value types with
 * Jackson annotations work well.</p>
 */
public interface AggregateEvent {
}
