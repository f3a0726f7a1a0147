package io.github.goodees.esa.example.counter;

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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.github.goodees.esa.core.definition.VersionedType;
import io.github.goodees.esa.immutables.ImmutablesSupport;
import org.immutables.value.Value;

/**
 * Counter was incremented. Version 2 replaced {@link OldIncrementedEvent}.
 */
@Value.Immutable
@ImmutablesSupport
@VersionedType(name = "IncrementedEvent", version = 2)
@JsonSerialize(as = ImmutableIncrementedEvent.class)
@JsonDeserialize(as = ImmutableIncrementedEvent.class)
public interface IncrementedEvent extends CounterEvent {
    int getAmount();

    static IncrementedEvent of(int amount) {
        return ImmutableIncrementedEvent.builder().amount(amount).build();
    }
}
