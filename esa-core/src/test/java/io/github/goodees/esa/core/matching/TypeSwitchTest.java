package io.github.goodees.esa.core.matching;

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

import io.github.goodees.esa.example.counter.CounterEvent;
import io.github.goodees.esa.example.counter.IncrementedEvent;
import io.github.goodees.esa.example.counter.OldIncrementedEvent;
import io.github.goodees.esa.example.counter.ResetEvent;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertFalse;

public class TypeSwitchTest {
    private final List<String> handled = new ArrayList<>();

    @Test
    public void first_matching_branch_is_executed() {
        TypeSwitch<CounterEvent> typeSwitch = TypeSwitch.builder(CounterEvent.class)
                .on(IncrementedEvent.class, e -> handled.add("increment " + e.getAmount()))
                .on(ResetEvent.class, e -> handled.add("reset"))
                .build();
        typeSwitch.executeExactlyOne(IncrementedEvent.of(3));
        typeSwitch.executeExactlyOne(ResetEvent.of("x"));
        assertThat(handled, contains("increment 3", "reset"));
    }

    @Test
    public void fallback_handles_rest() {
        TypeSwitch<CounterEvent> typeSwitch = TypeSwitch.builder(CounterEvent.class)
                .on(IncrementedEvent.class, e -> handled.add("increment"))
                .otherwise(e -> handled.add("other"))
                .build();
        typeSwitch.executeMatching(ResetEvent.of("x"));
        assertThat(handled, contains("other"));
    }

    @Test
    public void unmatched_instance_is_reported() {
        TypeSwitch<CounterEvent> typeSwitch = TypeSwitch.builder(CounterEvent.class)
                .on(IncrementedEvent.class, e -> handled.add("increment"))
                .build();
        assertFalse(typeSwitch.executeMatching(OldIncrementedEvent.of(1)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void exactly_one_fails_without_match() {
        TypeSwitch.builder(CounterEvent.class).build().executeExactlyOne(ResetEvent.of("x"));
    }

    @Test(expected = IllegalStateException.class)
    public void duplicate_branch_is_rejected() {
        TypeSwitch.builder(CounterEvent.class)
                .on(ResetEvent.class, e -> handled.add("a"))
                .on(ResetEvent.class, e -> handled.add("b"));
    }
}
