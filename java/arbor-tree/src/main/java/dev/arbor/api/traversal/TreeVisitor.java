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
package dev.arbor.api.traversal;

import dev.arbor.api.Expression;
import dev.arbor.api.Identifier;
import dev.arbor.api.Statement;
import dev.arbor.api.expressions.*;
import dev.arbor.api.statements.*;
import java.util.List;

/**
 * Reads a tree into a single value without rebuilding it.
 * <p>
 * The defaults walk the tree depth-first, children in declaration order, and combine the results of the children of a
 * node with {@link #aggregate(Object, Object)}, starting from {@link #defaultResult()}. Leaves produce
 * {@link #defaultResult()}. Subclasses override the kinds they care about and may keep state in the context.
 *
 * @param <R> result of visiting a node
 * @param <A> context threaded through one top-level visit
 */
public abstract class TreeVisitor<R, A> {
    protected abstract R defaultResult();

    /**
     * Combine the result accumulated so far for a node with the result of its next child. Defaults to the child's.
     */
    protected R aggregate(R aggregate, R next) {
        return next;
    }

    /**
     * Visit each statement in list order.
     */
    public R visitStatements(List<? extends Statement> statements, A context) {
        R result = defaultResult();
        for (Statement statement : statements) {
            result = aggregate(result, visitStatement(statement, context));
        }
        return result;
    }

    public R visitStatement(Statement statement, A context) {
        return statement.accept(new Statement.Visitor<R>() {
            @Override
            public R visitExpressionStatement(ExpressionStatement expressionStatement) {
                return TreeVisitor.this.visitExpressionStatement(expressionStatement, context);
            }

            @Override
            public R visitBinding(Binding binding) {
                return TreeVisitor.this.visitBinding(binding, context);
            }
        });
    }

    public R visitExpressionStatement(ExpressionStatement statement, A context) {
        return aggregate(defaultResult(), visitExpression(statement.getExpression(), context));
    }

    public R visitBinding(Binding binding, A context) {
        R result = defaultResult();
        result = aggregate(result, visitIdentifier(binding.getName(), context));
        result = aggregate(result, visitExpression(binding.getValue(), context));
        return result;
    }

    public R visitExpression(Expression expression, A context) {
        return expression.accept(new Expression.Visitor<R>() {
            @Override
            public R visitIntLiteral(IntLiteral literal) {
                return TreeVisitor.this.visitIntLiteral(literal, context);
            }

            @Override
            public R visitAdd(Add add) {
                return TreeVisitor.this.visitAdd(add, context);
            }

            @Override
            public R visitSubtract(Subtract subtract) {
                return TreeVisitor.this.visitSubtract(subtract, context);
            }
        });
    }

    public R visitIntLiteral(IntLiteral literal, A context) {
        return defaultResult();
    }

    public R visitAdd(Add add, A context) {
        R result = defaultResult();
        result = aggregate(result, visitExpression(add.getLeft(), context));
        result = aggregate(result, visitExpression(add.getRight(), context));
        return result;
    }

    public R visitSubtract(Subtract subtract, A context) {
        R result = defaultResult();
        result = aggregate(result, visitExpression(subtract.getLeft(), context));
        result = aggregate(result, visitExpression(subtract.getRight(), context));
        return result;
    }

    public R visitIdentifier(Identifier identifier, A context) {
        return defaultResult();
    }
}
