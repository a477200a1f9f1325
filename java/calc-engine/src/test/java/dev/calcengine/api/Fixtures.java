/**
 * (c) Copyright 2025 SpiralDB Inc. All rights reserved.
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
package dev.calcengine.api;

import dev.calcengine.api.functions.Arity;
import dev.calcengine.api.functions.Descriptors;
import dev.calcengine.api.functions.EvaluableFunction;
import dev.calcengine.api.functions.FunctionDescriptor;
import java.util.Objects;

/**
 * Descriptors and node kinds shared by tests.
 */
public final class Fixtures {
    private Fixtures() {}

    public static final FunctionDescriptor EQ = Descriptors.of("==", Arity.exactly(2));
    public static final FunctionDescriptor AND = Descriptors.of("and", Arity.exactly(2));
    public static final FunctionDescriptor PLUS = Descriptors.of("+", Arity.exactly(2));
    public static final FunctionDescriptor SUM = Descriptors.of("SUM", Arity.any());
    public static final FunctionDescriptor UNNAMED = Descriptors.of(null, Arity.any());

    public static final EvaluableFunction ADD = Descriptors.evaluable(
            "+", Arity.exactly(2), args -> ((Number) args.get(0)).doubleValue() + ((Number) args.get(1)).doubleValue());
    public static final EvaluableFunction MAX = Descriptors.evaluable("max", Arity.atLeast(1), args -> args.stream()
            .mapToDouble(arg -> ((Number) arg).doubleValue())
            .max()
            .getAsDouble());

    /**
     * Node kind with no visitor interface of its own, printing a fixed label.
     */
    public static final class LabelNode extends Node {
        private final String label;

        public LabelNode(String label) {
            this.label = label;
        }

        @Override
        public <R, S> R accept(NodeVisitor<R, S> visitor, S sessionData) {
            return visitor.visit(this, sessionData);
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            return label.equals(((LabelNode) o).label);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(label);
        }

        @Override
        public String toString() {
            return label;
        }
    }

    /**
     * A different node kind that carries a name and children just like a function node.
     */
    public static final class NamedNode extends Node {
        private final String name;

        public NamedNode(String name, Iterable<? extends Node> children) {
            super(children);
            this.name = name;
        }

        @Override
        public <R, S> R accept(NodeVisitor<R, S> visitor, S sessionData) {
            return visitor.visit(this, sessionData);
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            NamedNode other = (NamedNode) o;
            return name.equalsIgnoreCase(other.name) && childrenEqual(this, other);
        }

        @Override
        public int hashCode() {
            return name.toLowerCase(java.util.Locale.ROOT).hashCode();
        }
    }
}
