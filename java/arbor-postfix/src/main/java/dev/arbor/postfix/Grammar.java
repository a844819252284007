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

/**
 * Terminals of the expression grammar.
 *
 * <pre>
 * exp  -&gt; exp '+' term | exp '-' term | term
 * term -&gt; '0' | '1' | ... | '9'
 * </pre>
 */
final class Grammar {
    static final String TERM = "digit";
    static final String OPERATOR_OR_END = "'+', '-' or end of input";

    private Grammar() {}

    static boolean isTerm(int c) {
        return c >= '0' && c <= '9';
    }

    static boolean isOperator(int c) {
        return c == '+' || c == '-';
    }

    /**
     * Consume one term.
     *
     * @throws GrammarException if the next character is not a digit
     */
    static char term(CharStream input) {
        int position = input.position();
        int c = input.next();
        if (!isTerm(c)) {
            throw GrammarException.unexpected(position, c, TERM);
        }
        return (char) c;
    }
}
