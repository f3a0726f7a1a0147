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
 * Exception generated when storing or reading events fails. The {@linkplain Fault fault} tells callers how to react.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * Another writer appended to the aggregate first. The operation can be retried against fresh state.
         */
        OPTIMISTIC_LOCK,
        /**
         * The source id was already committed for the aggregate. The operation already happened.
         */
        DUPLICATE_OPERATION,
        /**
         * Storage failed. Not retried, as blindly repeating an append is not safe.
         */
        BACKEND_UNAVAILABLE,
        /**
         * Caller violated the contract of the store.
         */
        PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException optimisticLock(String aggregateName, String aggregateId, long expectedVersion,
            long actualVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Aggregate " + aggregateName + " " + aggregateId
                + " storing events after version " + expectedVersion + " attempted while last known version is "
                + actualVersion, null);
    }

    public static EventStoreException optimisticLock(String aggregateName, String aggregateId, long expectedVersion,
            Throwable cause) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Aggregate " + aggregateName + " " + aggregateId
                + " was modified concurrently after version " + expectedVersion, cause);
    }

    public static EventStoreException duplicateOperation(String aggregateName, String aggregateId, String sourceId) {
        return new EventStoreException(Fault.DUPLICATE_OPERATION, "Aggregate " + aggregateName + " " + aggregateId
                + " already committed events of source " + sourceId, null);
    }

    public static EventStoreException storeFailed(String aggregateName, String aggregateId, Throwable cause) {
        return new EventStoreException(Fault.BACKEND_UNAVAILABLE,
            "Store of aggregate " + aggregateName + " " + aggregateId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException readFailed(String what, Throwable cause) {
        return new EventStoreException(Fault.BACKEND_UNAVAILABLE, "Reading " + what + " failed. " + cause.getMessage(),
            cause);
    }

    public static EventStoreException nonMonotonic(String aggregateName, String aggregateId, long expectedVersion,
            long actualVersion) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Event for aggregate " + aggregateName + " "
                + aggregateId + " does not follow sequence. Expected: " + expectedVersion + " actual: "
                + actualVersion, null);
    }

    public static EventStoreException multipleAggregates(String expected, String violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Stored events span multiple aggregates: " + expected
                + " and " + violating, null);
    }
}
