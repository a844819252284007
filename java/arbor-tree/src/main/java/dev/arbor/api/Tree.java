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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle on the root of a tree.
 * <p>
 * A handle gives out its root any number of times through {@link #get()} until {@link #take()} moves the root out.
 * After that the handle is consumed and every further read fails. Folds running under {@link Ownership#EXCLUSIVE}
 * take their source; the other policies only read it.
 * <p>
 * Handles are not thread-safe.
 */
public final class Tree<N extends Node> {
    private static final Logger logger = LoggerFactory.getLogger(Tree.class);

    private Optional<N> root;

    private Tree(N root) {
        this.root = Optional.of(root);
    }

    public static <N extends Node> Tree<N> of(N root) {
        return new Tree<>(checkNotNull(root, "root"));
    }

    public N get() {
        checkState(root.isPresent(), "Tree was consumed by a previous fold");
        return root.get();
    }

    public N take() {
        N taken = get();
        root = Optional.empty();
        logger.debug("Moved {} root out of its tree handle", taken.type());
        return taken;
    }

    public boolean isConsumed() {
        return root.isEmpty();
    }

    @Override
    public String toString() {
        return root.map(node -> "Tree(" + node + ")").orElse("Tree(<consumed>)");
    }
}
