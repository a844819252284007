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

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;

/**
 * Single-pass sequence of characters. There is no lookahead and no way back: every call to {@link #next()} consumes
 * one character.
 * <p>
 * The stream does not close the reader it was created from.
 */
public final class CharStream {
    public static final int EOF = -1;

    private final Reader reader;
    private int position = 0;
    private boolean exhausted = false;

    private CharStream(Reader reader) {
        this.reader = reader;
    }

    public static CharStream of(CharSequence input) {
        return new CharStream(new StringReader(checkNotNull(input, "input").toString()));
    }

    public static CharStream of(Reader reader) {
        return new CharStream(checkNotNull(reader, "reader"));
    }

    /**
     * Consume the next character.
     *
     * @return the character, or {@link #EOF} once the input is exhausted
     */
    public int next() {
        if (exhausted) {
            return EOF;
        }
        int c;
        try {
            c = reader.read();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input at position " + position, e);
        }
        if (c == EOF) {
            exhausted = true;
        } else {
            position++;
        }
        return c;
    }

    /**
     * Zero-based index of the character the next call to {@link #next()} returns. At the end of the input this is the
     * input's length.
     */
    public int position() {
        return position;
    }
}
