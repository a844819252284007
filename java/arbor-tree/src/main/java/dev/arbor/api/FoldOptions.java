/**
 * (c) Copyright 2025 The Arbor Authors. All rights reserved.
 * <p>
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.arbor.api;

import org.immutables.value.Value;

/**
 * Options for configuring a fold.
 */
@Value.Immutable
public interface FoldOptions {
    /**
     * Ownership policy the fold runs under. Defaults to {@link Ownership#SHARED}.
     */
    @Value.Default
    default Ownership ownership() {
        return Ownership.SHARED;
    }

    static FoldOptions of() {
        return ImmutableFoldOptions.builder().build();
    }

    static FoldOptions of(Ownership ownership) {
        return ImmutableFoldOptions.builder().ownership(ownership).build();
    }

    static ImmutableFoldOptions.Builder builder() {
        return ImmutableFoldOptions.builder();
    }
}
