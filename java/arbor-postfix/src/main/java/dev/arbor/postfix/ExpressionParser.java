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

import dev.arbor.api.Expression;
import dev.arbor.api.expressions.Add;
import dev.arbor.api.expressions.IntLiteral;
import dev.arbor.api.expressions.Subtract;

/**
 * Parses the grammar accepted by {@link PostfixTranslator} into an expression tree instead of postfix text.
 * <p>
 * Operators associate to the left: {@code 1-2+3} parses as {@code ((1 - 2) + 3)}. Malformed input fails with the same
 * {@link GrammarException} the translator raises for it.
 */
public final class ExpressionParser {
    private ExpressionParser() {}

    public static Expression parse(CharSequence input) {
        return parse(CharStream.of(input));
    }

    public static Expression parse(CharStream input) {
        Expression expression = literal(Grammar.term(input));
        while (true) {
            int position = input.position();
            int c = input.next();
            if (c == CharStream.EOF) {
                return expression;
            }
            if (!Grammar.isOperator(c)) {
                throw GrammarException.unexpected(position, c, Grammar.OPERATOR_OR_END);
            }
            Expression right = literal(Grammar.term(input));
            expression = c == '+' ? Add.of(expression, right) : Subtract.of(expression, right);
        }
    }

    private static IntLiteral literal(char digit) {
        return IntLiteral.of(digit - '0');
    }
}
