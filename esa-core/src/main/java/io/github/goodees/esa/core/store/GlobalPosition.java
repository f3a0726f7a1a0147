package io.github.goodees.esa.core.store;

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
 * Position in the global event sequence, pointing at the first global sequence number that has not been read yet.
 */
public final class GlobalPosition implements Comparable<GlobalPosition> {
    private static final GlobalPosition START = new GlobalPosition(1);

    private final long nextSequenceNumber;

    private GlobalPosition(long nextSequenceNumber) {
        if (nextSequenceNumber < 1) {
            throw new IllegalArgumentException("Global position must be positive, got " + nextSequenceNumber);
        }
        this.nextSequenceNumber = nextSequenceNumber;
    }

    public static GlobalPosition start() {
        return START;
    }

    public static GlobalPosition of(long nextSequenceNumber) {
        return new GlobalPosition(nextSequenceNumber);
    }

    /**
     * Position after given global sequence number.
     * @param globalSequenceNumber last read sequence number
     * @return position following it
     */
    public static GlobalPosition after(long globalSequenceNumber) {
        return new GlobalPosition(globalSequenceNumber + 1);
    }

    public long getNextSequenceNumber() {
        return nextSequenceNumber;
    }

    public boolean isStart() {
        return nextSequenceNumber == 1;
    }

    @Override
    public int compareTo(GlobalPosition o) {
        return Long.compare(nextSequenceNumber, o.nextSequenceNumber);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GlobalPosition && ((GlobalPosition) o).nextSequenceNumber == nextSequenceNumber;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(nextSequenceNumber);
    }

    @Override
    public String toString() {
        return Long.toString(nextSequenceNumber);
    }
}
