package io.github.goodees.esa.core.definition;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry mapping persisted (name, version) pairs to Java types and back. It is built once at startup and is
 * immutable afterwards, so it can be shared by any number of stores and threads.
 * <p>Every registered type has exactly one <em>canonical</em> definition, used for serialization. Additional
 * <em>aliases</em> allow reading payloads persisted under names the type had in the past. All conflicts are reported
 * by {@link Builder#build()}, never during serialization.</p>
 *
 * @param <T> common supertype of registered types, e. g. {@link io.github.goodees.esa.core.AggregateEvent}
 */
public final class VersionedTypeRegistry<T> {
    private final Class<T> baseType;
    private final Map<Class<?>, VersionedTypeDefinition> canonical;
    private final Map<String, VersionedTypeDefinition> byNameAndVersion;

    private VersionedTypeRegistry(Builder<T> builder) {
        this.baseType = builder.baseType;
        this.canonical = Collections.unmodifiableMap(new LinkedHashMap<>(builder.canonical));
        this.byNameAndVersion = Collections.unmodifiableMap(new LinkedHashMap<>(builder.byNameAndVersion));
    }

    public static <T> Builder<T> builder(Class<T> baseType) {
        return new Builder<>(baseType);
    }

    public Class<T> getBaseType() {
        return baseType;
    }

    /**
     * Canonical definition of a type. Subtypes of registered types resolve to the definition of the registered type,
     * so that implementation classes generated by Immutables serialize under the name of their abstract type.
     * @param type the type
     * @return canonical definition
     * @throws IllegalArgumentException if the type or any of its supertypes is not registered
     */
    public VersionedTypeDefinition definitionOf(Class<?> type) {
        VersionedTypeDefinition exact = canonical.get(type);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<Class<?>, VersionedTypeDefinition> entry : canonical.entrySet()) {
            if (entry.getKey().isAssignableFrom(type)) {
                return entry.getValue();
            }
        }
        throw new IllegalArgumentException("Type " + type.getName() + " is not registered as "
                + baseType.getSimpleName());
    }

    public VersionedTypeDefinition definitionOf(T instance) {
        return definitionOf(instance.getClass());
    }

    public boolean isRegistered(Class<?> type) {
        if (canonical.containsKey(type)) {
            return true;
        }
        return canonical.keySet().stream().anyMatch(registered -> registered.isAssignableFrom(type));
    }

    public Optional<VersionedTypeDefinition> find(String name, int version) {
        return Optional.ofNullable(byNameAndVersion.get(key(name, version)));
    }

    /**
     * Definition for persisted name and version.
     * @param name persisted name
     * @param version persisted version
     * @return the definition
     * @throws IllegalStateException if no type is registered for the pair, as the stored data cannot be read
     */
    public VersionedTypeDefinition get(String name, int version) {
        return find(name, version).orElseThrow(() -> new IllegalStateException("No " + baseType.getSimpleName()
                + " is registered for name " + name + " version " + version));
    }

    /**
     * Type registered for persisted name and version, cast to base type.
     * @param name persisted name
     * @param version persisted version
     * @return registered type
     */
    public Class<? extends T> typeOf(String name, int version) {
        return get(name, version).getType().asSubclass(baseType);
    }

    public Collection<VersionedTypeDefinition> definitions() {
        return byNameAndVersion.values();
    }

    private static String key(String name, int version) {
        return name + "@" + version;
    }

    public static class Builder<T> {
        private static final Logger logger = LoggerFactory.getLogger(VersionedTypeRegistry.class);

        private final Class<T> baseType;
        private final Map<Class<?>, VersionedTypeDefinition> canonical = new LinkedHashMap<>();
        private final Map<String, VersionedTypeDefinition> byNameAndVersion = new LinkedHashMap<>();
        private final List<String> conflicts = new ArrayList<>();

        Builder(Class<T> baseType) {
            this.baseType = Objects.requireNonNull(baseType, "Base type must be specified");
        }

        /**
         * Register a type with definition derived by {@link VersionedTypeNames#definitionOf(Class)}.
         * @param type type to register
         * @return this builder
         */
        public Builder<T> add(Class<? extends T> type) {
            return add(VersionedTypeNames.definitionOf(type));
        }

        @SafeVarargs
        public final Builder<T> add(Class<? extends T>... types) {
            for (Class<? extends T> type : types) {
                add(type);
            }
            return this;
        }

        public Builder<T> add(String name, int version, Class<? extends T> type) {
            return add(VersionedTypeDefinition.of(name, version, type));
        }

        private Builder<T> add(VersionedTypeDefinition definition) {
            checkBaseType(definition);
            VersionedTypeDefinition existing = canonical.get(definition.getType());
            if (existing != null) {
                if (existing.sameNameAndVersion(definition)) {
                    logger.debug("Skipping repeated registration of {}", definition);
                    return this;
                }
                conflicts.add("Type " + definition.getType().getName() + " is registered both as " + existing
                        + " and " + definition);
                return this;
            }
            if (register(definition)) {
                canonical.put(definition.getType(), definition);
            }
            return this;
        }

        /**
         * Register alternative name and version of a type, used only for reading past payloads.
         * @param name past name
         * @param version past version
         * @param type the type
         * @return this builder
         */
        public Builder<T> alias(String name, int version, Class<? extends T> type) {
            VersionedTypeDefinition definition = VersionedTypeDefinition.of(name, version, type);
            checkBaseType(definition);
            register(definition);
            return this;
        }

        private boolean register(VersionedTypeDefinition definition) {
            String key = key(definition.getName(), definition.getVersion());
            VersionedTypeDefinition existing = byNameAndVersion.get(key);
            if (existing == null) {
                byNameAndVersion.put(key, definition);
                return true;
            } else if (existing.getType().equals(definition.getType())) {
                logger.debug("Skipping repeated registration of {}", definition);
                return true;
            } else {
                conflicts.add("Name " + definition.getName() + " version " + definition.getVersion()
                        + " is ambiguous between " + existing.getType().getName() + " and "
                        + definition.getType().getName());
                return false;
            }
        }

        private void checkBaseType(VersionedTypeDefinition definition) {
            if (!baseType.isAssignableFrom(definition.getType())) {
                throw new IllegalArgumentException(definition.getType().getName() + " is not a "
                        + baseType.getName());
            }
        }

        /**
         * Build the registry.
         * @return immutable registry
         * @throws IllegalStateException listing all conflicting registrations
         */
        public VersionedTypeRegistry<T> build() {
            if (!conflicts.isEmpty()) {
                throw new IllegalStateException("Conflicting " + baseType.getSimpleName() + " definitions: "
                        + String.join("; ", conflicts));
            }
            return new VersionedTypeRegistry<>(this);
        }
    }
}
