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

import io.github.goodees.esa.example.counter.CounterAggregate;
import io.github.goodees.esa.example.counter.IncrementedEvent;
import io.github.goodees.esa.example.counter.OldCounterSnapshot;
import io.github.goodees.esa.example.counter.ResetEvent;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class VersionedTypeNamesTest {

    static class ItemAddedV3 {
    }

    static class Item_Added {
    }

    @Test
    public void annotation_takes_precedence() {
        VersionedTypeDefinition definition = VersionedTypeNames.definitionOf(IncrementedEvent.class);
        assertEquals("IncrementedEvent", definition.getName());
        assertEquals(2, definition.getVersion());
    }

    @Test
    public void plain_name_is_version_one() {
        VersionedTypeDefinition definition = VersionedTypeNames.definitionOf(ResetEvent.class);
        assertEquals("ResetEvent", definition.getName());
        assertEquals(1, definition.getVersion());
    }

    @Test
    public void old_prefix_is_stripped() {
        VersionedTypeDefinition definition = VersionedTypeNames.definitionOf(OldCounterSnapshot.class);
        assertEquals("CounterSnapshot", definition.getName());
        assertEquals(1, definition.getVersion());
    }

    @Test
    public void version_suffix_is_parsed() {
        VersionedTypeDefinition definition = VersionedTypeNames.definitionOf(ItemAddedV3.class);
        assertEquals("ItemAdded", definition.getName());
        assertEquals(3, definition.getVersion());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unconventional_name_requires_annotation() {
        VersionedTypeNames.definitionOf(Item_Added.class);
    }

    @Test
    public void aggregate_suffix_is_stripped() {
        assertEquals("Counter", VersionedTypeNames.aggregateName(CounterAggregate.class));
        assertEquals("Aggregate", VersionedTypeNames.fromSimpleClassnameStripping("Aggregate", "", "Aggregate"));
    }
}
