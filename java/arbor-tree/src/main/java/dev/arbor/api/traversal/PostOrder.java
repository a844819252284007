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

import com.google.common.collect.ImmutableList;
import dev.arbor.api.Expression;
import dev.arbor.api.expressions.*;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Flattens an expression tree into post-order (left, right, then the operator) without recursing, so that passes
 * which only need operands before operators can handle trees of any depth.
 */
public final class PostOrder {
    private static final Expression.Visitor<ImmutableList<Expression>> CHILDREN =
            new Expression.Visitor<ImmutableList<Expression>>() {
                @Override
                public ImmutableList<Expression> visitIntLiteral(IntLiteral literal) {
                    return ImmutableList.of();
                }

                @Override
                public ImmutableList<Expression> visitAdd(Add add) {
                    return ImmutableList.of(add.getLeft(), add.getRight());
                }

                @Override
                public ImmutableList<Expression> visitSubtract(Subtract subtract) {
                    return ImmutableList.of(subtract.getLeft(), subtract.getRight());
                }
            };

    private PostOrder() {}

    public static ImmutableList<Expression> expressions(Expression root) {
        Deque<Expression> pending = new ArrayDeque<>();
        // Reverse post-order: each node lands ahead of everything already collected.
        Deque<Expression> collected = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Expression next = pending.pop();
            collected.push(next);
            for (Expression child : next.accept(CHILDREN)) {
                pending.push(child);
            }
        }
        return ImmutableList.copyOf(collected);
    }
}
