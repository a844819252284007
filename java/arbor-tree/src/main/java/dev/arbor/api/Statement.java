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
package dev.arbor.api;

import dev.arbor.api.statements.*;

/**
 * Top-level statements. A program is an ordered list of statements.
 */
public interface Statement extends Node {
    @Override
    Statement copy();

    <T> T accept(Visitor<T> visitor);

    interface Visitor<T> {
        T visitExpressionStatement(ExpressionStatement statement);

        T visitBinding(Binding binding);
    }
}
