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
package dev.calcengine.api.nodes;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import dev.calcengine.api.Node;
import dev.calcengine.api.NodeTypes;
import dev.calcengine.api.NodeVisitor;
import dev.calcengine.api.functions.FunctionDescriptor;
import java.util.Arrays;
import java.util.Locale;

/**
 * Application of a {@link FunctionDescriptor} to the child expressions, which are its arguments in
 * call order.
 * <p>
 * The number of children is not checked against {@link FunctionDescriptor#arity()}. A mismatch is
 * reported by whichever visitor consumes the arguments, e.g. an evaluator.
 */
public final class FunctionNode extends Node {
    private final String name;
    private final FunctionDescriptor descriptor;

    private FunctionNode(FunctionDescriptor descriptor, String name, Iterable<? extends Node> children) {
        super(children);
        checkArgument(descriptor != null, "descriptor cannot be null");
        checkArgument(!Strings.isNullOrEmpty(name), "function name cannot be empty");
        this.descriptor = descriptor;
        this.name = name;
    }

    /**
     * Create a node with an explicit name and no children.
     */
    public static FunctionNode of(FunctionDescriptor descriptor, String name) {
        return new FunctionNode(descriptor, name, ImmutableList.of());
    }

    /**
     * Create a node named after the descriptor's symbol.
     */
    public static FunctionNode of(FunctionDescriptor descriptor, Iterable<? extends Node> children) {
        checkArgument(descriptor != null, "descriptor cannot be null");
        return new FunctionNode(descriptor, descriptor.symbol(), children);
    }

    public static FunctionNode of(FunctionDescriptor descriptor, Node... children) {
        return of(descriptor, Arrays.asList(children));
    }

    public static Builder builder(FunctionDescriptor descriptor) {
        return new Builder(descriptor);
    }

    /**
     * Name as given at construction, case preserved.
     */
    public String name() {
        return name;
    }

    public FunctionDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public int classify() {
        String symbol = descriptor.symbol();
        if (symbol == null) {
            return NodeTypes.GENERIC;
        }
        switch (symbol) {
            case "==":
                return NodeTypes.EQUALITY;
            case "and":
                return NodeTypes.LOGICAL_AND;
            default:
                return NodeTypes.GENERIC;
        }
    }

    /**
     * Calls {@link FunctionNodeVisitor#visitFunction(FunctionNode, Object)} if the visitor implements
     * it, otherwise {@link NodeVisitor#visit(Node, Object)}.
     */
    @Override
    public <R, S> R accept(NodeVisitor<R, S> visitor, S sessionData) {
        checkArgument(visitor != null, "visitor cannot be null");
        if (visitor instanceof FunctionNodeVisitor) {
            return ((FunctionNodeVisitor<R, S>) visitor).visitFunction(this, sessionData);
        }
        return visitor.visit(this, sessionData);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        FunctionNode other = (FunctionNode) o;
        return foldedName().equals(other.foldedName()) && childrenEqual(this, other);
    }

    /**
     * Children are combined with XOR, so nodes whose children are permutations of each other may
     * collide even though they are not equal.
     */
    @Override
    public int hashCode() {
        int result = foldedName().hashCode();
        for (Node child : children()) {
            result ^= child.hashCode();
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder("( Function \"").append(name).append("\" ");
        for (Node child : children()) {
            out.append(child);
        }
        return out.append(") ").toString();
    }

    private String foldedName() {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Collects the children of a {@link FunctionNode} before sealing them into the node.
     */
    public static final class Builder {
        private final FunctionDescriptor descriptor;
        private final ImmutableList.Builder<Node> children;
        private String name;

        private Builder(FunctionDescriptor descriptor) {
            checkArgument(descriptor != null, "descriptor cannot be null");
            this.descriptor = descriptor;
            this.name = descriptor.symbol();
            this.children = ImmutableList.builder();
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder addChild(Node child) {
            this.children.add(child);
            return this;
        }

        public Builder addAllChildren(Iterable<? extends Node> children) {
            this.children.addAll(children);
            return this;
        }

        public FunctionNode build() {
            return new FunctionNode(descriptor, name, children.build());
        }
    }
}
