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

import java.util.Objects;

/**
 * Snapshot together with its metadata.
 *
 * @param <S> type of snapshot
 */
public final class SnapshotContainer<S extends Snapshot> {
    private final S snapshot;
    private final SnapshotMetadata metadata;

    public SnapshotContainer(S snapshot, SnapshotMetadata metadata) {
        this.snapshot = Objects.requireNonNull(snapshot, "Snapshot must be specified");
        this.metadata = Objects.requireNonNull(metadata, "Snapshot metadata must be specified");
    }

    public S getSnapshot() {
        return snapshot;
    }

    public SnapshotMetadata getMetadata() {
        return metadata;
    }
}
