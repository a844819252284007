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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

public final class Identifier implements Node {
    private final String value;

    private Identifier(String value) {
        this.value = value;
    }

    public static Identifier of(String value) {
        return new Identifier(checkNotNull(value, "identifier value"));
    }

    public String getValue() {
        return value;
    }

    @Override
    public String type() {
        return "identifier";
    }

    @Override
    public Identifier copy() {
        return new Identifier(value);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Identifier)) return false;
        Identifier other = (Identifier) o;
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
