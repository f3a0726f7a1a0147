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

/**
 * Common interface for serialization and deserialization into String payload. Event store uses it for event payloads
 * and metadata, snapshot store for snapshots.
 * <p>The serialization does not track versions of payloads. Name and version of the payload type are stored
 * separately by the stores, as resolved by
 * {@linkplain io.github.goodees.esa.core.definition.VersionedTypeRegistry registry}, and the type to deserialize into
 * is passed to {@link #deserialize(String, Class)}.</p>
 */
public interface Serialization {
    /**
     * Serialize the object into a String payload.
     * @param object object to serialize
     * @return String serialization of the object
     * @throws IllegalArgumentException if object cannot be serialized
     */
    String serialize(Object object);

    /**
     * Deserialize a payload.
     * @param payload payload to deserialize
     * @param type type to deserialize into
     * @param <T> type of result
     * @return deserialized object
     * @throws IllegalArgumentException if payload cannot be read as given type
     */
    <T> T deserialize(String payload, Class<T> type);
}
