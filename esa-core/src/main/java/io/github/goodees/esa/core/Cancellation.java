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

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation signal passed through every persistence and publication call. Components check it before
 * they start an operation with side effects, never in the middle of one, so a cancelled call leaves the store as if it
 * never happened.
 */
public class Cancellation {
    private static final Cancellation NONE = new Cancellation(false);

    private final boolean cancellable;
    private volatile boolean cancelled;

    private Cancellation(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Signal that can never be cancelled. Used for work that has to complete once events are durable, like
     * publication.
     * @return non-cancellable signal
     */
    public static Cancellation none() {
        return NONE;
    }

    /**
     * Create new signal that can be cancelled by calling {@link #cancel()}.
     * @return new cancellation signal
     */
    public static Cancellation create() {
        return new Cancellation(true);
    }

    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException("This operation cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws CancellationException if cancellation was requested
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Operation was cancelled");
        }
    }
}
