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
package dev.arbor.postfix;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.arbor.api.Expression;
import dev.arbor.api.expressions.*;
import dev.arbor.passes.ConstantFolder;
import dev.arbor.passes.Interpreter;
import dev.arbor.passes.PostfixPrinter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public final class TestExpressionParser {
    @Test
    public void testLeftAssociative() {
        assertEquals(
                Add.of(Subtract.of(IntLiteral.of(1), IntLiteral.of(2)), IntLiteral.of(3)),
                ExpressionParser.parse("1-2+3"));
        assertEquals(IntLiteral.of(7), ExpressionParser.parse("7"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"5", "2+3", "1-2+3-4", "9-9-9", "0+1+2+3+4+5+6+7+8+9"})
    public void testAgreesWithTranslator(String input) {
        Expression expression = ExpressionParser.parse(input);
        assertEquals(PostfixTranslator.translate(input), PostfixPrinter.print(expression));
    }

    @Test
    public void testLongInput() {
        int terms = 100_000;
        String input = "1" + "+1".repeat(terms - 1);

        Expression expression = ExpressionParser.parse(input);

        assertEquals(PostfixTranslator.translate(input), PostfixPrinter.print(expression));
        assertEquals(terms, Interpreter.evaluate(expression));
        assertEquals(IntLiteral.of(terms), ConstantFolder.simplify(expression));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "2-34", "2+5-", "+", "1++2", "1 +2", "a", "1-2*3"})
    public void testFailsWhereTranslatorFails(String input) {
        GrammarException parserFailure = assertThrows(GrammarException.class, () -> ExpressionParser.parse(input));
        GrammarException translatorFailure =
                assertThrows(GrammarException.class, () -> PostfixTranslator.translate(input));
        assertEquals(translatorFailure.getMessage(), parserFailure.getMessage());
        assertEquals(translatorFailure.getPosition(), parserFailure.getPosition());
    }

    @ParameterizedTest
    @ValueSource(strings = {"9-3+1", "0-9-9-9", "1+2+3", "5"})
    public void testParsedTreesEvaluate(String input) {
        Expression expression = ExpressionParser.parse(input);
        long expected = leftToRight(input);

        assertEquals(expected, Interpreter.evaluate(expression));
        assertEquals(IntLiteral.of(expected), ConstantFolder.simplify(expression));
    }

    private static long leftToRight(String input) {
        long value = input.charAt(0) - '0';
        for (int i = 1; i < input.length(); i += 2) {
            long term = input.charAt(i + 1) - '0';
            value = input.charAt(i) == '+' ? value + term : value - term;
        }
        return value;
    }
}
