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

import static com.google.common.base.Preconditions.checkNotNull;

import dev.arbor.api.Expression;
import java.util.Objects;

public final class Subtract implements Expression {
    private final Expression left;
    private final Expression right;

    private Subtract(Expression left, Expression right) {
        this.left = left;
        this.right = right;
    }

    public static Subtract of(Expression left, Expression right) {
        return new Subtract(checkNotNull(left, "left"), checkNotNull(right, "right"));
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public String type() {
        return "subtract";
    }

    @Override
    public Subtract copy() {
        return new Subtract(left.copy(), right.copy());
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitSubtract(this);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Subtract other = (Subtract) o;
        return Objects.equals(left, other.left) && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type(), left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " - " + right + ")";
    }
}
