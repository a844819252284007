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
package dev.arbor.api.expressions;

import dev.arbor.api.Expression;

public final class IntLiteral implements Expression {
    private final long value;

    private IntLiteral(long value) {
        this.value = value;
    }

    public static IntLiteral of(long value) {
        return new IntLiteral(value);
    }

    public long getValue() {
        return value;
    }

    @Override
    public String type() {
        return "int";
    }

    @Override
    public IntLiteral copy() {
        return new IntLiteral(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitIntLiteral(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof IntLiteral)) return false;
        IntLiteral other = (IntLiteral) o;
        return value == other.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
