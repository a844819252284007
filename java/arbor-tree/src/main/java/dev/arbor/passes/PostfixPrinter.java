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
package dev.arbor.passes;

import static com.google.common.base.Preconditions.checkNotNull;

import dev.arbor.api.Expression;
import dev.arbor.api.expressions.*;
import dev.arbor.api.traversal.PostOrder;
import java.util.stream.Collectors;

/**
 * Lower an {@link Expression} to postfix (reverse Polish) notation: operands first, then the operator.
 * <p>
 * Operators are rendered from a {@link PostOrder} walk, so the depth of the tree is not bounded by the call stack.
 */
public final class PostfixPrinter implements Expression.Visitor<String> {
    /**
     * Tokens written back to back. Unambiguous only while every literal is a single digit.
     */
    public static final PostfixPrinter COMPACT = new PostfixPrinter("");

    public static final PostfixPrinter SPACED = new PostfixPrinter(" ");

    private static final Expression.Visitor<String> TOKEN = new Expression.Visitor<String>() {
        @Override
        public String visitIntLiteral(IntLiteral literal) {
            return Long.toString(literal.getValue());
        }

        @Override
        public String visitAdd(Add add) {
            return "+";
        }

        @Override
        public String visitSubtract(Subtract subtract) {
            return "-";
        }
    };

    private final String separator;

    private PostfixPrinter(String separator) {
        this.separator = separator;
    }

    public static PostfixPrinter withSeparator(String separator) {
        return new PostfixPrinter(checkNotNull(separator, "separator"));
    }

    public static String print(Expression expression) {
        return expression.accept(COMPACT);
    }

    @Override
    public String visitIntLiteral(IntLiteral literal) {
        return literal.accept(TOKEN);
    }

    @Override
    public String visitAdd(Add add) {
        return postfix(add);
    }

    @Override
    public String visitSubtract(Subtract subtract) {
        return postfix(subtract);
    }

    private String postfix(Expression expression) {
        return PostOrder.expressions(expression).stream()
                .map(node -> node.accept(TOKEN))
                .collect(Collectors.joining(separator));
    }
}
