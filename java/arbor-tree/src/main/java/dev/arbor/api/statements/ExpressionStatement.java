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
package dev.arbor.api.statements;

import static com.google.common.base.Preconditions.checkNotNull;

import dev.arbor.api.Expression;
import dev.arbor.api.Statement;
import java.util.Objects;

/**
 * A bare expression evaluated for its value.
 */
public final class ExpressionStatement implements Statement {
    private final Expression expression;

    private ExpressionStatement(Expression expression) {
        this.expression = expression;
    }

    public static ExpressionStatement of(Expression expression) {
        return new ExpressionStatement(checkNotNull(expression, "expression"));
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public String type() {
        return "expression";
    }

    @Override
    public ExpressionStatement copy() {
        return new ExpressionStatement(expression.copy());
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitExpressionStatement(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ExpressionStatement)) return false;
        ExpressionStatement other = (ExpressionStatement) o;
        return Objects.equals(expression, other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(expression);
    }

    @Override
    public String toString() {
        return expression + ";";
    }
}
