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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates single-digit infix sums and differences into postfix notation, e.g. {@code 1-2+3} into {@code 12-3+}.
 * <p>
 * The left-recursive {@code exp} rule is scanned as one term followed by any number of (operator, term) pairs. Each
 * digit is written as soon as it is read and each operator right after its right operand, so the output follows the
 * left-associative evaluation order. The translator keeps no state between calls.
 */
public final class PostfixTranslator {
    private static final Logger logger = LoggerFactory.getLogger(PostfixTranslator.class);

    private PostfixTranslator() {}

    enum State {
        EXPECT_TERM,
        EXPECT_OPERATOR_OR_END,
    }

    /**
     * @throws GrammarException if {@code input} is empty or does not match the grammar. No output is produced then.
     */
    public static String translate(CharSequence input) {
        return translate(CharStream.of(input));
    }

    /**
     * Translate the rest of {@code input}, reading it to the end.
     *
     * @throws GrammarException at the first character that does not match the grammar
     */
    public static String translate(CharStream input) {
        StringBuilder output = new StringBuilder();
        State state = State.EXPECT_TERM;
        char operator = 0;

        while (true) {
            switch (state) {
                case EXPECT_TERM: {
                    output.append(Grammar.term(input));
                    if (operator != 0) {
                        output.append(operator);
                    }
                    state = State.EXPECT_OPERATOR_OR_END;
                    break;
                }
                case EXPECT_OPERATOR_OR_END: {
                    int position = input.position();
                    int c = input.next();
                    if (c == CharStream.EOF) {
                        logger.debug("Translated {} input characters to {}", position, output);
                        return output.toString();
                    }
                    if (!Grammar.isOperator(c)) {
                        throw GrammarException.unexpected(position, c, Grammar.OPERATOR_OR_END);
                    }
                    operator = (char) c;
                    state = State.EXPECT_TERM;
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown translator state: " + state);
            }
        }
    }
}
