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

import io.github.goodees.esa.core.Identities;
import io.github.goodees.esa.immutables.ImmutablesSupport;
import org.immutables.value.Value;

/**
 * Persisted name and version of a type. The pair (name, version) is what the store writes next to serialized
 * payload, and what it uses to find the type to deserialize into.
 */
@Value.Immutable
@ImmutablesSupport
public abstract class VersionedTypeDefinition {

    public abstract String getName();

    public abstract int getVersion();

    public abstract Class<?> getType();

    @Value.Check
    protected void check() {
        Identities.validate(getName(), "Type name");
        if (getVersion() < 1) {
            throw new IllegalArgumentException("Version of " + getName() + " must be positive, got " + getVersion());
        }
    }

    /**
     * @return true if other definition has same name and version
     */
    public boolean sameNameAndVersion(VersionedTypeDefinition other) {
        return getName().equals(other.getName()) && getVersion() == other.getVersion();
    }

    public static VersionedTypeDefinition of(String name, int version, Class<?> type) {
        return ImmutableVersionedTypeDefinition.builder().name(name).version(version).type(type).build();
    }

    @Override
    public String toString() {
        return getName() + " v" + getVersion() + " (" + getType().getName() + ")";
    }
}
