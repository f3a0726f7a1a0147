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
 * Decides whether a snapshot should be stored after a commit.
 *
 * @see SnapshotStrategies
 */
@FunctionalInterface
public interface SnapshotStrategy {
    /**
     * @param version version of the aggregate after the commit
     * @param snapshotVersion version of last loaded or stored snapshot, 0 when there is none
     * @return true if snapshot should be stored
     */
    boolean shouldCreateSnapshot(long version, long snapshotVersion);
}
