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

import dev.arbor.api.Expression;
import dev.arbor.api.Statement;
import dev.arbor.api.expressions.Add;
import dev.arbor.api.expressions.IntLiteral;
import dev.arbor.api.expressions.Subtract;
import dev.arbor.api.statements.Binding;
import dev.arbor.api.statements.ExpressionStatement;
import dev.arbor.api.traversal.PostOrder;
import dev.arbor.api.traversal.TreeVisitor;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates statements in order, recording their effects in an {@link Environment}.
 * <p>
 * Arithmetic is exact; overflow throws {@link ArithmeticException}. Expressions are evaluated over an operand stack
 * in {@link PostOrder}, so arbitrarily deep operator chains do not exhaust the call stack.
 */
public final class Interpreter extends TreeVisitor<Long, Environment> {
    private static final Logger logger = LoggerFactory.getLogger(Interpreter.class);

    public static final Interpreter INSTANCE = new Interpreter();

    private Interpreter() {}

    public static Environment run(List<? extends Statement> statements) {
        Environment environment = new Environment();
        INSTANCE.visitStatements(statements, environment);
        return environment;
    }

    public static long evaluate(Expression expression) {
        return INSTANCE.visitExpression(expression, new Environment());
    }

    @Override
    protected Long defaultResult() {
        return null;
    }

    @Override
    public Long visitExpressionStatement(ExpressionStatement statement, Environment environment) {
        long value = visitExpression(statement.getExpression(), environment);
        environment.recordResult(value);
        return value;
    }

    @Override
    public Long visitBinding(Binding binding, Environment environment) {
        String name = binding.getName().getValue();
        long value = visitExpression(binding.getValue(), environment);
        Optional<Long> previous = environment.bind(name, value);
        if (previous.isPresent()) {
            logger.debug("Rebound {} from {} to {}", name, previous.get(), value);
        } else {
            logger.debug("Bound {} to {}", name, value);
        }
        return value;
    }

    @Override
    public Long visitIntLiteral(IntLiteral literal, Environment environment) {
        return literal.getValue();
    }

    @Override
    public Long visitAdd(Add add, Environment environment) {
        return new OperandStack().evaluate(add);
    }

    @Override
    public Long visitSubtract(Subtract subtract, Environment environment) {
        return new OperandStack().evaluate(subtract);
    }

    /**
     * Evaluates one expression: literals push their value, operators replace the top two operands with the result.
     */
    private static final class OperandStack implements Expression.Visitor<Void> {
        private final Deque<Long> operands = new ArrayDeque<>();

        long evaluate(Expression expression) {
            for (Expression node : PostOrder.expressions(expression)) {
                node.accept(this);
            }
            return operands.pop();
        }

        @Override
        public Void visitIntLiteral(IntLiteral literal) {
            operands.push(literal.getValue());
            return null;
        }

        @Override
        public Void visitAdd(Add add) {
            long right = operands.pop();
            long left = operands.pop();
            operands.push(Math.addExact(left, right));
            return null;
        }

        @Override
        public Void visitSubtract(Subtract subtract) {
            long right = operands.pop();
            long left = operands.pop();
            operands.push(Math.subtractExact(left, right));
            return null;
        }
    }
}
