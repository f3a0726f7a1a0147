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

import io.github.goodees.esa.core.AggregateRoot;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate without snapshots, remembering all increments in order.
 */
public class TallyAggregate extends AggregateRoot<CounterEvent> {
    private final List<Integer> increments = new ArrayList<>();

    public TallyAggregate(String id) {
        super(id, CounterEvent.class);
    }

    public void add(int amount) {
        emit(IncrementedEvent.of(amount));
    }

    public List<Integer> getIncrements() {
        return increments;
    }

    public int getTotal() {
        return increments.stream().mapToInt(Integer::intValue).sum();
    }

    @Override
    protected void apply(CounterEvent event) {
        if (event instanceof IncrementedEvent) {
            increments.add(((IncrementedEvent) event).getAmount());
        }
    }
}
