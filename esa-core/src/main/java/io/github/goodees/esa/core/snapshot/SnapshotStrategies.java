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

/**
 * Common snapshot strategies.
 */
public final class SnapshotStrategies {
    private static final SnapshotStrategy NEVER = (version, snapshotVersion) -> false;

    private SnapshotStrategies() {

    }

    public static SnapshotStrategy never() {
        return NEVER;
    }

    /**
     * Snapshot whenever the aggregate reaches or passes a multiple of {@code versions}. A commit of several events
     * that skips over the multiple still creates the snapshot.
     * @param versions number of versions between snapshots
     * @return snapshot strategy
     */
    public static SnapshotStrategy everyFewVersions(int versions) {
        checkPositive(versions);
        return (version, snapshotVersion) -> version / versions > snapshotVersion / versions;
    }

    /**
     * Snapshot when at least {@code versions} events were committed since the last snapshot.
     * @param versions number of events
     * @return snapshot strategy
     */
    public static SnapshotStrategy sinceLastSnapshot(int versions) {
        checkPositive(versions);
        return (version, snapshotVersion) -> version - snapshotVersion >= versions;
    }

    private static void checkPositive(int versions) {
        if (versions < 1) {
            throw new IllegalArgumentException("Number of versions must be positive, got " + versions);
        }
    }
}
