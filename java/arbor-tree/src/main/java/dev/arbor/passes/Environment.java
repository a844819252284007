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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable record of what a run of the {@link Interpreter} produced: the value bound to each name, in the order the
 * names were first bound, and the values of bare expression statements.
 */
public final class Environment {
    private final Map<String, Long> bindings = new LinkedHashMap<>();
    private final List<Long> results = new ArrayList<>();

    /**
     * Bind {@code name}, replacing any earlier binding of the same name.
     *
     * @return the value previously bound to the name, if any
     */
    public Optional<Long> bind(String name, long value) {
        return Optional.ofNullable(bindings.put(checkNotNull(name, "name"), value));
    }

    public Optional<Long> lookup(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    void recordResult(long value) {
        results.add(value);
    }

    public Map<String, Long> getBindings() {
        return Collections.unmodifiableMap(bindings);
    }

    public List<Long> getResults() {
        return Collections.unmodifiableList(results);
    }

    @Override
    public String toString() {
        return "Environment{bindings=" + bindings + ", results=" + results + "}";
    }
}
