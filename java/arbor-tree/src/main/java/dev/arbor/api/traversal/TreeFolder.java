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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.jakewharton.nopen.annotation.Open;
import dev.arbor.api.Expression;
import dev.arbor.api.FoldOptions;
import dev.arbor.api.Identifier;
import dev.arbor.api.Node;
import dev.arbor.api.Ownership;
import dev.arbor.api.Statement;
import dev.arbor.api.Tree;
import dev.arbor.api.expressions.*;
import dev.arbor.api.statements.*;
import java.util.List;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Rewrites a tree into a new tree.
 * <p>
 * Every {@code on*} method is an override point for one node kind. The defaults fold the children of a node from
 * left to right and rebuild it from the results, so an unmodified {@code TreeFolder} is the identity fold. Subclasses
 * override only the kinds they rewrite, and call the {@code fold*} methods to recurse.
 * <p>
 * The {@link Ownership} from the {@link FoldOptions} decides whether unchanged nodes are reused, moved or copied into
 * the result. The fold methods apply it to every result uniformly, overrides never need to look at it. An override
 * that wants to keep a node should return the node it was given (or build from the folded children), never a raw
 * child of the source.
 * <p>
 * Nothing here catches exceptions: a failure in any override aborts the fold of every ancestor.
 *
 * @param <A> context threaded through one top-level fold
 */
@Open
public class TreeFolder<A> {
    private final Ownership ownership;

    public TreeFolder() {
        this(FoldOptions.of());
    }

    public TreeFolder(FoldOptions options) {
        this.ownership = options.ownership();
    }

    public final Statement foldStatement(Statement statement, A context) {
        return adopt(statement, onStatement(statement, context), Statement::copy);
    }

    public final Expression foldExpression(Expression expression, A context) {
        return adopt(expression, onExpression(expression, context), Expression::copy);
    }

    public final Identifier foldIdentifier(Identifier identifier, A context) {
        return adopt(identifier, onIdentifier(identifier, context), Identifier::copy);
    }

    /**
     * Fold each statement in list order.
     */
    public final List<Statement> foldStatements(List<? extends Statement> statements, A context) {
        ImmutableList.Builder<Statement> folded = ImmutableList.builderWithExpectedSize(statements.size());
        for (Statement statement : statements) {
            folded.add(foldStatement(statement, context));
        }
        return folded.build();
    }

    /**
     * Fold the statement held by {@code tree}, consuming the handle if the ownership policy owns its source.
     */
    public final Tree<Statement> foldStatementTree(Tree<? extends Statement> tree, A context) {
        Statement root = ownership.acquire(tree);
        return Tree.of(foldStatement(root, context));
    }

    /**
     * Fold the expression held by {@code tree}, consuming the handle if the ownership policy owns its source.
     */
    public final Tree<Expression> foldExpressionTree(Tree<? extends Expression> tree, A context) {
        Expression root = ownership.acquire(tree);
        return Tree.of(foldExpression(root, context));
    }

    public Statement onStatement(Statement statement, A context) {
        return statement.accept(new Statement.Visitor<Statement>() {
            @Override
            public Statement visitExpressionStatement(ExpressionStatement expressionStatement) {
                return onExpressionStatement(expressionStatement, context);
            }

            @Override
            public Statement visitBinding(Binding binding) {
                return onBinding(binding, context);
            }
        });
    }

    public Statement onExpressionStatement(ExpressionStatement statement, A context) {
        Expression expression = foldExpression(statement.getExpression(), context);
        return rebuild(statement, expression == statement.getExpression(), () -> ExpressionStatement.of(expression));
    }

    public Statement onBinding(Binding binding, A context) {
        Identifier name = foldIdentifier(binding.getName(), context);
        Expression value = foldExpression(binding.getValue(), context);
        return rebuild(
                binding,
                name == binding.getName() && value == binding.getValue(),
                () -> Binding.of(name, value));
    }

    public Expression onExpression(Expression expression, A context) {
        return expression.accept(new Expression.Visitor<Expression>() {
            @Override
            public Expression visitIntLiteral(IntLiteral literal) {
                return onIntLiteral(literal, context);
            }

            @Override
            public Expression visitAdd(Add add) {
                return onAdd(add, context);
            }

            @Override
            public Expression visitSubtract(Subtract subtract) {
                return onSubtract(subtract, context);
            }
        });
    }

    public Expression onIntLiteral(IntLiteral literal, A context) {
        return literal;
    }

    public Expression onAdd(Add add, A context) {
        Expression left = foldExpression(add.getLeft(), context);
        Expression right = foldExpression(add.getRight(), context);
        return rebuild(add, left == add.getLeft() && right == add.getRight(), () -> Add.of(left, right));
    }

    public Expression onSubtract(Subtract subtract, A context) {
        Expression left = foldExpression(subtract.getLeft(), context);
        Expression right = foldExpression(subtract.getRight(), context);
        return rebuild(
                subtract,
                left == subtract.getLeft() && right == subtract.getRight(),
                () -> Subtract.of(left, right));
    }

    public Identifier onIdentifier(Identifier identifier, A context) {
        return identifier;
    }

    /**
     * Returns {@code original} when its folded children are the very instances it already holds and the ownership
     * policy allows reuse, otherwise a node built by {@code rebuilt}.
     */
    protected final <N extends Node> N rebuild(N original, boolean childrenUnchanged, Supplier<? extends N> rebuilt) {
        if (childrenUnchanged && ownership.reusesUnchanged()) {
            return original;
        }
        return rebuilt.get();
    }

    private <N extends Node> N adopt(N original, N folded, UnaryOperator<N> copier) {
        checkNotNull(folded, "Fold of %s returned null", original.type());
        return folded == original ? ownership.retain(original, copier) : folded;
    }
}
