package io.github.goodees.esa.immutables;

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

import org.immutables.value.Value;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Recommended style for immutables-based events, snapshots and other value types of the store. Use either on
 * package-info, or on classes annotated with {@code @Value.Immutable}. For Jackson support annotate the abstract type
 * with {@code @JsonSerialize(as = ImmutableX.class)} and {@code @JsonDeserialize(as = ImmutableX.class)}.
 * <p>Accessors follow bean convention, {@code getAmount()} becomes attribute {@code amount} in builders and JSON.</p>
 */
@Target({ElementType.PACKAGE, ElementType.TYPE})
@Retention(RetentionPolicy.CLASS)
@Value.Style(overshadowImplementation = true,//
        optionalAcceptNullable = true,//
        depluralize = true,//
        jdkOnly = true, //
        get = { "get*", "is*" })
public @interface ImmutablesSupport {

}
