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

import com.google.common.collect.ImmutableList;
import dev.arbor.api.Identifier;
import dev.arbor.api.Statement;
import dev.arbor.api.traversal.TreeVisitor;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends the value of every identifier to the context list, in traversal order.
 */
public final class IdentifierCollector extends TreeVisitor<Void, List<String>> {
    public static final IdentifierCollector INSTANCE = new IdentifierCollector();

    private IdentifierCollector() {}

    public static ImmutableList<String> collect(List<? extends Statement> statements) {
        List<String> names = new ArrayList<>();
        INSTANCE.visitStatements(statements, names);
        return ImmutableList.copyOf(names);
    }

    @Override
    protected Void defaultResult() {
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier identifier, List<String> names) {
        names.add(identifier.getValue());
        return null;
    }
}
