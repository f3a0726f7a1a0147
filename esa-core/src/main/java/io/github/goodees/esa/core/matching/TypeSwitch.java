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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Typesafe and boilerplate-free instance matching, used by aggregates to apply events to their state without visitors
 * or reflective method lookup. Branches are tried in order of registration, and the first matching branch wins.
 * <p>Switch is built once, usually in the constructor of an aggregate, and is immutable afterwards:
 * <pre>
 * private final TypeSwitch&lt;CounterEvent&gt; applier = TypeSwitch.builder(CounterEvent.class)
 *         .on(IncrementedEvent.class, e -&gt; value += e.getAmount())
 *         .on(ResetEvent.class, e -&gt; value = 0)
 *         .build();
 * </pre>
 *
 * @param <T> common supertype of matched instances
 */
public class TypeSwitch<T> {

    private final Class<T> baseType;
    private final List<SwitchBranch<? extends T>> branches;
    private final Consumer<? super T> fallback;

    private TypeSwitch(Builder<T> b) {
        this.baseType = b.baseType;
        this.branches = Collections.unmodifiableList(new ArrayList<>(b.branches));
        this.fallback = b.fallback;
    }

    /**
     * Execute first matching branch, or the fallback.
     * @param instance instance to match against
     * @return true if a branch or the fallback was executed
     */
    public boolean executeMatching(T instance) {
        for (SwitchBranch<? extends T> branch : branches) {
            if (branch.match(instance)) {
                return true;
            }
        }
        if (fallback != null && instance != null) {
            fallback.accept(instance);
            return true;
        }
        return false;
    }

    /**
     * Execute first matching branch, and fail if there is none.
     * @param instance instance to match against
     * @throws IllegalArgumentException if no branch matches
     */
    public void executeExactlyOne(T instance) {
        if (!executeMatching(instance)) {
            throw new IllegalArgumentException("No branch of " + baseType.getSimpleName() + " switch handles "
                    + (instance == null ? "null" : instance.getClass().getName()));
        }
    }

    public static <T> Builder<T> builder(Class<T> baseType) {
        return new Builder<>(baseType);
    }

    public static class Builder<T> {
        private final Class<T> baseType;
        private final List<SwitchBranch<? extends T>> branches = new ArrayList<>();
        private Consumer<? super T> fallback;

        Builder(Class<T> baseType) {
            this.baseType = Objects.requireNonNull(baseType, "Base type cannot be null");
        }

        public <S extends T> Builder<T> on(Class<S> clazz, Consumer<? super S> callback) {
            for (SwitchBranch<? extends T> branch : branches) {
                if (branch.caseClass.equals(clazz)) {
                    throw new IllegalStateException("Type " + clazz.getName() + " is already handled");
                }
            }
            this.branches.add(new SwitchBranch<>(clazz, callback));
            return this;
        }

        public Builder<T> otherwise(Consumer<? super T> fallback) {
            this.fallback = Objects.requireNonNull(fallback, "Fallback cannot be null");
            return this;
        }

        public TypeSwitch<T> build() {
            return new TypeSwitch<>(this);
        }
    }

    private static class SwitchBranch<S> {

        private final Class<S> caseClass;
        private final Consumer<? super S> callback;

        SwitchBranch(Class<S> caseClass, Consumer<? super S> callback) {
            this.caseClass = Objects.requireNonNull(caseClass, "Case class cannot be null");
            this.callback = Objects.requireNonNull(callback, "Callback cannot be null");
        }

        boolean match(Object obj) {
            if (obj != null && caseClass.isInstance(obj)) {
                callback.accept(caseClass.cast(obj));
                return true;
            }
            return false;
        }
    }
}
