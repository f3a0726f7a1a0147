package io.github.goodees.esa.core.snapshot;

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

import java.util.function.Function;

/**
 * Converts a snapshot of past shape to newer one. The snapshot store chains upgraders until the snapshot has the type
 * the aggregate expects.
 *
 * @param <F> past snapshot type
 * @param <T> newer snapshot type
 */
public interface SnapshotUpgrader<F extends Snapshot, T extends Snapshot> {
    Class<F> fromType();

    Class<T> toType();

    T upgrade(F snapshot);

    static <F extends Snapshot, T extends Snapshot> SnapshotUpgrader<F, T> of(Class<F> fromType, Class<T> toType,
            Function<F, T> upgrade) {
        return new SnapshotUpgrader<F, T>() {
            @Override
            public Class<F> fromType() {
                return fromType;
            }

            @Override
            public Class<T> toType() {
                return toType;
            }

            @Override
            public T upgrade(F snapshot) {
                return upgrade.apply(snapshot);
            }
        };
    }
}
