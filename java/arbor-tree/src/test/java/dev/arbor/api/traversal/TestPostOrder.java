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
package dev.arbor.api.traversal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.google.common.collect.ImmutableList;
import dev.arbor.api.Expression;
import dev.arbor.api.expressions.*;
import java.util.List;
import org.junit.jupiter.api.Test;

public final class TestPostOrder {
    @Test
    public void testOperandsBeforeOperator() {
        IntLiteral one = IntLiteral.of(1);
        IntLiteral two = IntLiteral.of(2);
        IntLiteral three = IntLiteral.of(3);
        Subtract inner = Subtract.of(two, three);
        Add root = Add.of(one, inner);

        List<Expression> order = PostOrder.expressions(root);

        assertEquals(5, order.size());
        List<Expression> expected = ImmutableList.of(one, two, three, inner, root);
        for (int i = 0; i < expected.size(); i++) {
            assertSame(expected.get(i), order.get(i));
        }
    }

    @Test
    public void testLeaf() {
        IntLiteral leaf = IntLiteral.of(7);
        assertEquals(ImmutableList.of(leaf), PostOrder.expressions(leaf));
    }

    @Test
    public void testDeepLeftSpine() {
        int terms = 100_000;
        Expression expression = IntLiteral.of(0);
        for (int i = 1; i < terms; i++) {
            expression = Add.of(expression, IntLiteral.of(i));
        }

        List<Expression> order = PostOrder.expressions(expression);

        assertEquals(2 * terms - 1, order.size());
        assertEquals(IntLiteral.of(0), order.get(0));
        assertEquals(IntLiteral.of(1), order.get(1));
        assertSame(expression, order.get(order.size() - 1));
    }
}
