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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conventions for deriving persisted names from class names.
 */
public final class VersionedTypeNames {
    private static final Pattern VERSIONED_NAME = Pattern.compile("^(Old)?(?<name>[a-zA-Z]+?)(V(?<version>[0-9]+))?$");

    private VersionedTypeNames() {

    }

    /**
     * Definition of a type as declared by {@link VersionedType}, or derived from its simple class name. Simple name
     * {@code ThingHappenedEvent} gives name {@code ThingHappenedEvent} version 1, {@code OldThingHappenedEventV2}
     * gives the same name in version 2. Prefix {@code Old} allows keeping past shapes next to the current one.
     * @param type type to define
     * @return definition of the type
     * @throws IllegalArgumentException if the class name does not follow the convention and is not annotated
     */
    public static VersionedTypeDefinition definitionOf(Class<?> type) {
        VersionedType declared = type.getAnnotation(VersionedType.class);
        if (declared != null) {
            return VersionedTypeDefinition.of(declared.name(), declared.version(), type);
        }
        Matcher m = VERSIONED_NAME.matcher(type.getSimpleName());
        if (!m.matches()) {
            throw new IllegalArgumentException("Class name " + type.getSimpleName() + " does not follow convention "
                    + "[Old]Name[V<version>], annotate it with @VersionedType");
        }
        String version = m.group("version");
        return VersionedTypeDefinition.of(m.group("name"), version == null ? 1 : Integer.parseInt(version), type);
    }

    /**
     * Default name of an aggregate type. Strips suffix Aggregate from the simple class name.
     * @param aggregateClass class of the aggregate
     * @return Simple name. CounterAggregate becomes Counter.
     */
    public static String aggregateName(Class<?> aggregateClass) {
        return fromSimpleClassnameStripping(aggregateClass.getSimpleName(), "", "Aggregate");
    }

    public static String fromSimpleClassnameStripping(String simpleClassName, String prefix, String suffix) {
        int start = simpleClassName.startsWith(prefix) ? prefix.length() : 0;
        int end = simpleClassName.endsWith(suffix) && simpleClassName.length() > suffix.length() + start
                ? simpleClassName.length() - suffix.length() : simpleClassName.length();
        return simpleClassName.substring(start, end);
    }
}
