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

import java.util.concurrent.TimeUnit;

/**
 * Strategy for retrying an aggregate update after failed commit.
 *
 * @see OptimisticConcurrencyRetryStrategy
 */
@FunctionalInterface
public interface RetryStrategy {
    long DO_NOT_RETRY = -1;
    long RETRY_NOW = 0;

    /**
     * Decide on retry of an update.
     * @param failure the failure of the last attempt
     * @param completedAttempts number of attempts that failed so far, including the last one
     * @return delay in milliseconds before next attempt, or {@link #DO_NOT_RETRY}
     */
    long retryDelay(EventStoreException failure, int completedAttempts);

    /**
     * Retry strategy that doesn't retry any failed update.
     * @return a retry strategy
     */
    static RetryStrategy noRetries() {
        return OptimisticConcurrencyRetryStrategy.NO_RETRIES;
    }

    /**
     * Retry strategy retrying optimistic lock failures 4 times with delay of 100 milliseconds.
     * @return a retry strategy
     */
    static RetryStrategy optimisticConcurrency() {
        return new OptimisticConcurrencyRetryStrategy(OptimisticConcurrencyRetryStrategy.DEFAULT_RETRIES,
                OptimisticConcurrencyRetryStrategy.DEFAULT_DELAY_MILLIS);
    }

    /**
     * Retry strategy retrying optimistic lock failures with defined retry delay.
     * @param retries number of retries to allow
     * @param delay delay before retrying
     * @param unit unit of delay
     * @return a retry strategy
     */
    static RetryStrategy optimisticConcurrency(int retries, long delay, TimeUnit unit) {
        return new OptimisticConcurrencyRetryStrategy(retries, unit.toMillis(delay));
    }
}
