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

import static com.google.common.base.Preconditions.checkNotNull;

import dev.arbor.api.FoldOptions;
import dev.arbor.api.Identifier;
import dev.arbor.api.traversal.TreeFolder;
import java.util.function.Function;

/**
 * Renames identifiers and leaves everything else as it is.
 */
public final class Renamer extends TreeFolder<Void> {
    private final Function<String, String> rename;

    public Renamer(Function<String, String> rename) {
        this(rename, FoldOptions.of());
    }

    public Renamer(Function<String, String> rename, FoldOptions options) {
        super(options);
        this.rename = checkNotNull(rename, "rename");
    }

    /**
     * Replace the text of every identifier with {@code text}.
     */
    public static Renamer constant(String text) {
        checkNotNull(text, "text");
        return new Renamer(ignored -> text);
    }

    @Override
    public Identifier onIdentifier(Identifier identifier, Void context) {
        String renamed = rename.apply(identifier.getValue());
        if (renamed.equals(identifier.getValue())) {
            return identifier;
        }
        return Identifier.of(renamed);
    }
}
