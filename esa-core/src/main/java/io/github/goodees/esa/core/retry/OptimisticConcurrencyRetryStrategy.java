package io.github.goodees.esa.core.retry;

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

import io.github.goodees.esa.core.store.EventStoreException;

/**
 * Retries updates that failed on {@linkplain EventStoreException.Fault#OPTIMISTIC_LOCK optimistic lock} a fixed
 * number of times with fixed delay. Other faults are never retried.
 */
public class OptimisticConcurrencyRetryStrategy implements RetryStrategy {
    public static final int DEFAULT_RETRIES = 4;
    public static final long DEFAULT_DELAY_MILLIS = 100;

    static final RetryStrategy NO_RETRIES = (failure, attempts) -> DO_NOT_RETRY;

    private final int retries;
    private final long delay;

    public OptimisticConcurrencyRetryStrategy(int retries, long delayMillis) {
        if (retries < 0) {
            throw new IllegalArgumentException("Number of retries cannot be negative, got " + retries);
        }
        if (delayMillis < 0) {
            throw new IllegalArgumentException("Retry delay cannot be negative, got " + delayMillis);
        }
        this.retries = retries;
        this.delay = delayMillis;
    }

    public int getRetries() {
        return retries;
    }

    public long getDelay() {
        return delay;
    }

    @Override
    public long retryDelay(EventStoreException failure, int completedAttempts) {
        if (failure.getFault() != EventStoreException.Fault.OPTIMISTIC_LOCK) {
            return DO_NOT_RETRY;
        }
        return completedAttempts <= retries ? delay : DO_NOT_RETRY;
    }
}
