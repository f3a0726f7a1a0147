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

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static io.github.goodees.esa.core.MetadataKeys.*;

/**
 * Ordered string key-value map attached to every event. Metadata is immutable and additive: every {@code with}
 * method returns a new instance, and adding a key that is already present fails.
 */
public final class Metadata {
    private static final Metadata EMPTY = new Metadata(Collections.emptyMap());

    private final Map<String, String> values;

    private Metadata(Map<String, String> values) {
        this.values = values;
    }

    public static Metadata empty() {
        return EMPTY;
    }

    public static Metadata of(Map<String, String> values) {
        return EMPTY.with(values);
    }

    public static Metadata of(String key, String value) {
        return EMPTY.with(key, value);
    }

    /**
     * Add a key.
     * @param key the key
     * @param value the value
     * @return new metadata instance with the key added
     * @throws IllegalArgumentException if the key already exists
     */
    public Metadata with(String key, String value) {
        return with(Collections.singletonMap(key, value));
    }

    public Metadata with(String key, long value) {
        return with(key, Long.toString(value));
    }

    public Metadata with(Metadata other) {
        return with(other.values);
    }

    /**
     * Add all keys of a map, keeping their iteration order.
     * @param additions keys to add
     * @return new metadata instance
     * @throws IllegalArgumentException if any of the keys already exists
     */
    public Metadata with(Map<String, String> additions) {
        if (additions.isEmpty()) {
            return this;
        }
        Map<String, String> result = new LinkedHashMap<>(values);
        for (Map.Entry<String, String> entry : additions.entrySet()) {
            String key = Objects.requireNonNull(entry.getKey(), "Metadata key cannot be null");
            String value = Objects.requireNonNull(entry.getValue(), () -> "Value of metadata key " + key
                    + " cannot be null");
            if (result.containsKey(key)) {
                throw new IllegalArgumentException("Metadata key '" + key + "' is already set to '" + result.get(key)
                        + "', refusing to overwrite it with '" + value + "'");
            }
            result.put(key, value);
        }
        return new Metadata(Collections.unmodifiableMap(result));
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Read mandatory key.
     * @param key the key
     * @return the value
     * @throws IllegalStateException when the key is missing
     */
    public String require(String key) {
        String value = values.get(key);
        if (value == null) {
            throw new IllegalStateException("Metadata is missing key '" + key + "': " + values);
        }
        return value;
    }

    public long requireLong(String key) {
        String value = require(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Metadata key '" + key + "' is not a number: " + value, e);
        }
    }

    public String getEventName() {
        return require(EVENT_NAME);
    }

    public int getEventVersion() {
        return (int) requireLong(EVENT_VERSION);
    }

    public Instant getTimestamp() {
        String value = require(TIMESTAMP);
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Metadata key '" + TIMESTAMP + "' is not a timestamp: " + value, e);
        }
    }

    public long getAggregateSequenceNumber() {
        return requireLong(AGGREGATE_SEQUENCE_NUMBER);
    }

    public String getAggregateName() {
        return require(AGGREGATE_NAME);
    }

    public String getAggregateId() {
        return require(AGGREGATE_ID);
    }

    public Optional<SourceId> getSourceId() {
        return get(SOURCE_ID).map(SourceId::of);
    }

    public String getBatchId() {
        return require(BATCH_ID);
    }

    public String getEventId() {
        return require(EVENT_ID);
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return values.equals(((Metadata) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
