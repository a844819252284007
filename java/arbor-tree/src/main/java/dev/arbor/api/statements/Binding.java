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
package dev.arbor.api.statements;

import static com.google.common.base.Preconditions.checkNotNull;

import dev.arbor.api.Expression;
import dev.arbor.api.Identifier;
import dev.arbor.api.Statement;
import java.util.Objects;

/**
 * Binds the value of an expression to a name: {@code let name = value;}.
 */
public final class Binding implements Statement {
    private final Identifier name;
    private final Expression value;

    private Binding(Identifier name, Expression value) {
        this.name = name;
        this.value = value;
    }

    public static Binding of(Identifier name, Expression value) {
        return new Binding(checkNotNull(name, "name"), checkNotNull(value, "value"));
    }

    public static Binding of(String name, Expression value) {
        return of(Identifier.of(name), value);
    }

    public Identifier getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public String type() {
        return "binding";
    }

    @Override
    public Binding copy() {
        return new Binding(name.copy(), value.copy());
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitBinding(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Binding)) return false;
        Binding other = (Binding) o;
        return Objects.equals(name, other.name) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        return "let " + name + " = " + value + ";";
    }
}
