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

import java.util.Optional;

/**
 * Input does not match the expression grammar. Carries where the scan stopped and what it found there.
 */
public final class GrammarException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int position;
    private final int found;
    private final String expected;

    private GrammarException(int position, int found, String expected) {
        super(message(position, found, expected));
        this.position = position;
        this.found = found;
        this.expected = expected;
    }

    static GrammarException unexpected(int position, int found, String expected) {
        return new GrammarException(position, found, expected);
    }

    /**
     * Zero-based index of the offending character, or the input length if the input ended too early.
     */
    public int getPosition() {
        return position;
    }

    /**
     * The offending character, empty if the input ended where more was expected.
     */
    public Optional<Character> getFound() {
        return found == CharStream.EOF ? Optional.empty() : Optional.of((char) found);
    }

    public String getExpected() {
        return expected;
    }

    private static String message(int position, int found, String expected) {
        String actual = found == CharStream.EOF ? "reached end of input" : "found '" + (char) found + "'";
        return "Expected " + expected + " at position " + position + " but " + actual;
    }
}
