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

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;

public final class TestCharStream {
    @Test
    public void testSinglePass() {
        CharStream stream = CharStream.of("ab");
        assertEquals(0, stream.position());
        assertEquals('a', stream.next());
        assertEquals(1, stream.position());
        assertEquals('b', stream.next());
        assertEquals(CharStream.EOF, stream.next());
        assertEquals(CharStream.EOF, stream.next());
        assertEquals(2, stream.position());
    }

    @Test
    public void testReadFailure() {
        Reader failing = new Reader() {
            @Override
            public int read(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("disk on fire");
            }

            @Override
            public void close() {}
        };

        UncheckedIOException e = assertThrows(UncheckedIOException.class, () -> CharStream.of(failing).next());
        assertEquals("disk on fire", e.getCause().getMessage());
        assertThrows(UncheckedIOException.class, () -> PostfixTranslator.translate(CharStream.of(failing)));
    }
}
