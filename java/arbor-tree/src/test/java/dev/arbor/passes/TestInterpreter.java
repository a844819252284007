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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dev.arbor.api.Expression;
import dev.arbor.api.Statement;
import dev.arbor.api.expressions.*;
import dev.arbor.api.statements.*;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

public final class TestInterpreter {
    @RegisterExtension
    final LogCapture logs = new LogCapture(Interpreter.class, Level.DEBUG);

    private static final Expression OVERFLOW = Add.of(IntLiteral.of(Long.MAX_VALUE), IntLiteral.of(1));

    @Test
    public void testRun() {
        List<Statement> program = ImmutableList.of(
                Binding.of("a", Subtract.of(Add.of(IntLiteral.of(1), IntLiteral.of(2)), IntLiteral.of(3))),
                ExpressionStatement.of(Add.of(IntLiteral.of(4), IntLiteral.of(5))),
                Binding.of("b", IntLiteral.of(6)),
                ExpressionStatement.of(Subtract.of(IntLiteral.of(1), IntLiteral.of(8))));

        Environment environment = Interpreter.run(program);

        assertEquals(ImmutableMap.of("a", 0L, "b", 6L), environment.getBindings());
        assertEquals(ImmutableList.of(9L, -7L), environment.getResults());
        assertEquals(Optional.of(6L), environment.lookup("b"));
        assertEquals(Optional.empty(), environment.lookup("c"));
    }

    @Test
    public void testLaterBindingWins() {
        Environment environment = Interpreter.run(ImmutableList.of(
                Binding.of("a", IntLiteral.of(1)),
                Binding.of("b", IntLiteral.of(2)),
                Binding.of("a", IntLiteral.of(3))));

        assertEquals(ImmutableList.of("a", "b"), ImmutableList.copyOf(environment.getBindings().keySet()));
        assertEquals(Optional.of(3L), environment.lookup("a"));
    }

    @Test
    public void testEvaluateIsLeftAssociative() {
        // (9 - 3) - 2, not 9 - (3 - 2)
        Expression expression = Subtract.of(Subtract.of(IntLiteral.of(9), IntLiteral.of(3)), IntLiteral.of(2));
        assertEquals(4L, Interpreter.evaluate(expression));
    }

    @Test
    public void testOverflowStopsTheRun() {
        Environment environment = new Environment();
        List<Statement> program = ImmutableList.of(
                Binding.of("ok", IntLiteral.of(1)),
                Binding.of("bad", OVERFLOW),
                Binding.of("never", IntLiteral.of(2)));

        assertThrows(ArithmeticException.class, () -> Interpreter.INSTANCE.visitStatements(program, environment));
        assertEquals(ImmutableMap.of("ok", 1L), environment.getBindings());
    }

    @Test
    public void testSubtractOverflow() {
        assertThrows(
                ArithmeticException.class,
                () -> Interpreter.evaluate(Subtract.of(IntLiteral.of(Long.MIN_VALUE), IntLiteral.of(1))));
    }

    @Test
    public void testEveryBindingIsLogged() {
        Interpreter.run(ImmutableList.of(
                Binding.of("a", IntLiteral.of(1)),
                ExpressionStatement.of(IntLiteral.of(5)),
                Binding.of("b", Add.of(IntLiteral.of(2), IntLiteral.of(3))),
                Binding.of("a", IntLiteral.of(4))));

        assertEquals(
                ImmutableList.of("Bound a to 1", "Bound b to 5", "Rebound a from 1 to 4"),
                logs.messages(Level.DEBUG));
    }

    @Test
    public void testDeepLeftChain() {
        assertEquals(100_000L, Interpreter.evaluate(chainOfOnes(100_000)));
        Environment environment = Interpreter.run(ImmutableList.of(Binding.of("n", chainOfOnes(100_000))));
        assertEquals(Optional.of(100_000L), environment.lookup("n"));
    }

    private static Expression chainOfOnes(int terms) {
        Expression expression = IntLiteral.of(1);
        for (int i = 1; i < terms; i++) {
            expression = Add.of(expression, IntLiteral.of(1));
        }
        return expression;
    }
}
