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

import java.util.function.UnaryOperator;

/**
 * How a fold holds the tree it reads from, and therefore what the tree it produces may share with it.
 * <p>
 * Every policy produces structurally equal results for the same fold. They differ in which node instances the result
 * shares with the source, and in whether the source is still readable afterwards:
 * <ul>
 *   <li>{@link #EXCLUSIVE}: the fold owns the source. Unchanged nodes are moved into the result and the source
 *   {@link Tree} handle is consumed.</li>
 *   <li>{@link #BORROWED}: the fold only reads the source. Every node of the result is a fresh instance, including
 *   the ones that did not change.</li>
 *   <li>{@link #SHARED}: the source stays readable and unchanged sub-trees are referenced from the result as they are.
 *   Only rebuilt nodes are new.</li>
 * </ul>
 */
public enum Ownership {
    EXCLUSIVE(true, false),
    BORROWED(false, true),
    SHARED(false, false),
    ;

    private final boolean consumesSource;
    private final boolean copiesUnchanged;

    Ownership(boolean consumesSource, boolean copiesUnchanged) {
        this.consumesSource = consumesSource;
        this.copiesUnchanged = copiesUnchanged;
    }

    /**
     * Whether the source handle is unusable once a fold has read it.
     */
    public boolean consumesSource() {
        return consumesSource;
    }

    /**
     * Whether an interior node whose children all came back unchanged may be reused instead of rebuilt.
     */
    public boolean reusesUnchanged() {
        return !copiesUnchanged;
    }

    /**
     * Reads the root out of a handle, consuming the handle if this policy owns its source.
     */
    public <N extends Node> N acquire(Tree<N> tree) {
        return consumesSource ? tree.take() : tree.get();
    }

    /**
     * The instance that stands for {@code node} in a result tree when a fold returned it unchanged.
     *
     * @param copier deep copy for the node's family, e.g. {@code Expression::copy}
     */
    public <N extends Node> N retain(N node, UnaryOperator<N> copier) {
        return copiesUnchanged ? copier.apply(node) : node;
    }
}
