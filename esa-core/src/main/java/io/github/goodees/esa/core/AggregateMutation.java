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

/**
 * Mutation of an aggregate passed to {@link AggregateStore#update}. The mutation calls business methods of the
 * aggregate, which emit events. It may run several times against different versions of the aggregate when commits
 * conflict, so it must decide only based on the aggregate's state and its own input.
 *
 * @param <A> type of aggregate
 * @param <X> checked exception of the mutation
 */
@FunctionalInterface
public interface AggregateMutation<A, X extends Exception> {
    void mutate(A aggregate, Cancellation cancellation) throws X;
}
