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

import io.github.goodees.esa.core.AggregateEvent;
import io.github.goodees.esa.core.DomainEvent;
import io.github.goodees.esa.core.Metadata;
import io.github.goodees.esa.core.MetadataKeys;
import io.github.goodees.esa.core.definition.VersionedTypeDefinition;
import io.github.goodees.esa.core.definition.VersionedTypeRegistry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts events with metadata to persisted form and back. Name and version of the payload are taken from the
 * registry and recorded in metadata as {@value MetadataKeys#EVENT_NAME} and {@value MetadataKeys#EVENT_VERSION}.
 */
public class EventSerializer {
    private final VersionedTypeRegistry<AggregateEvent> definitions;
    private final Serialization serialization;

    public EventSerializer(VersionedTypeRegistry<AggregateEvent> definitions, Serialization serialization) {
        this.definitions = Objects.requireNonNull(definitions, "Event definitions must be specified");
        this.serialization = Objects.requireNonNull(serialization, "Serialization must be specified");
    }

    public SerializedEvent serialize(AggregateEvent event, Metadata metadata) {
        VersionedTypeDefinition definition = definitions.definitionOf(event);
        Metadata tagged = metadata.with(MetadataKeys.EVENT_NAME, definition.getName())
                .with(MetadataKeys.EVENT_VERSION, definition.getVersion());
        return new SerializedEvent(tagged.getAggregateSequenceNumber(), definition.getName(),
            definition.getVersion(), serialization.serialize(event), serialization.serialize(tagged.asMap()), tagged);
    }

    public DomainEvent deserialize(CommittedEvent committed) {
        Class<? extends AggregateEvent> type = definitions.typeOf(committed.getEventName(),
            committed.getEventVersion());
        AggregateEvent event = serialization.deserialize(committed.getData(), type);
        Metadata metadata = deserializeMetadata(committed.getMetadata());
        return new DomainEvent(committed.getAggregateName(), committed.getAggregateId(),
            committed.getAggregateSequenceNumber(), committed.getGlobalSequenceNumber(), committed.getBatchId(), event,
            metadata, metadata.getTimestamp());
    }

    private Metadata deserializeMetadata(String payload) {
        Map<?, ?> raw = serialization.deserialize(payload, Map.class);
        Map<String, String> values = new LinkedHashMap<>();
        raw.forEach((k, v) -> values.put(String.valueOf(k), String.valueOf(v)));
        return Metadata.of(values);
    }
}
