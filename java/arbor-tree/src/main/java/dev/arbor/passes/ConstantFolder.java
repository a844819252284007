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
import dev.arbor.api.FoldOptions;
import dev.arbor.api.expressions.Add;
import dev.arbor.api.expressions.IntLiteral;
import dev.arbor.api.expressions.Subtract;
import dev.arbor.api.traversal.TreeFolder;

/**
 * Collapses arithmetic on literals into a single literal.
 * <p>
 * Operands are evaluated by {@link Interpreter#evaluate(Expression)}, without recursion through the fold.
 * <p>
 * Overflow throws {@link ArithmeticException} and abandons the whole fold.
 */
public final class ConstantFolder extends TreeFolder<Void> {
    public ConstantFolder() {
        super();
    }

    public ConstantFolder(FoldOptions options) {
        super(options);
    }

    public static Expression simplify(Expression expression) {
        return new ConstantFolder().foldExpression(expression, null);
    }

    // Any Add or Subtract has only literals below it, so the whole node folds to the interpreter's value.
    @Override
    public Expression onAdd(Add add, Void context) {
        return IntLiteral.of(Interpreter.evaluate(add));
    }

    @Override
    public Expression onSubtract(Subtract subtract, Void context) {
        return IntLiteral.of(Interpreter.evaluate(subtract));
    }
}
