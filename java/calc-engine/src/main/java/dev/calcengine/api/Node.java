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

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import java.util.Objects;

/**
 * One element of the expression syntax tree.
 * <p>
 * A node owns an ordered list of children, which for a function application are its arguments
 * in call order. The list is copied into an immutable list when the node is constructed, so a node
 * is sealed as soon as it exists and may be traversed from several threads at once.
 */
public abstract class Node {
    private final ImmutableList<Node> children;

    protected Node() {
        this.children = ImmutableList.of();
    }

    protected Node(Iterable<? extends Node> children) {
        this.children = ImmutableList.copyOf(children);
    }

    public final int childCount() {
        return children.size();
    }

    /**
     * Get the child at the given position.
     *
     * @throws IndexOutOfBoundsException if {@code index} is negative or not less than {@link #childCount()}
     */
    public final Node childAt(int index) {
        checkElementIndex(index, children.size(), "child index");
        return children.get(index);
    }

    public final ImmutableList<Node> children() {
        return children;
    }

    /**
     * Integer discriminant consumed by optimizers and evaluators. See {@link NodeTypes}.
     */
    public int classify() {
        return NodeTypes.GENERIC;
    }

    /**
     * Double-dispatch entry point. Implementations call the most specific callback the visitor
     * instance supports, falling back to {@link NodeVisitor#visit(Node, Object)}.
     */
    public abstract <R, S> R accept(NodeVisitor<R, S> visitor, S sessionData);

    /**
     * Order-sensitive comparison of the children of two nodes.
     */
    protected static boolean childrenEqual(Node a, Node b) {
        if (a.childCount() != b.childCount()) return false;
        for (int i = 0; i < a.childCount(); i++) {
            if (!Objects.equals(a.children.get(i), b.children.get(i))) return false;
        }
        return true;
    }
}
