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

/**
 * Validation of aggregate identities, aggregate names and source ids. All of them are opaque strings, but they end up
 * as keys in persistent storage, so we reject values that cannot be stored reliably.
 */
public final class Identities {
    public static final int MAX_LENGTH = 255;

    private Identities() {

    }

    /**
     * Validate an identity value.
     * @param value value to validate
     * @param what description of the value used in exception message, e. g. "Aggregate id"
     * @return the value
     * @throws IllegalArgumentException if value is null, blank, too long or contains control characters
     */
    public static String validate(String value, String what) {
        if (value == null) {
            throw new IllegalArgumentException(what + " must be specified");
        }
        if (value.trim().isEmpty()) {
            throw new IllegalArgumentException(what + " may not be blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(what + " '" + value.substring(0, 32) + "...' is longer than "
                    + MAX_LENGTH + " characters");
        }
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                throw new IllegalArgumentException(what + " '" + value + "' contains control characters");
            }
        }
        return value;
    }
}
