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
package dev.calcengine.api.visitors;

import com.google.common.collect.Iterables;
import com.google.common.graph.Traverser;
import dev.calcengine.api.Node;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Traversals driven by an explicit work list rather than recursion, for trees too deep to walk
 * with {@link Node#accept}.
 */
public final class NodeTraversal {
    private static final Traverser<Node> TREE = Traverser.forTree(Node::children);

    private NodeTraversal() {}

    /**
     * Each node before its children, children in argument order.
     */
    public static Iterable<Node> preOrder(Node root) {
        return TREE.depthFirstPreOrder(root);
    }

    /**
     * Each node after its children, children in argument order.
     */
    public static Iterable<Node> postOrder(Node root) {
        return TREE.depthFirstPostOrder(root);
    }

    public static Iterable<Node> breadthFirst(Node root) {
        return TREE.breadthFirst(root);
    }

    public static int size(Node root) {
        return Iterables.size(preOrder(root));
    }

    /**
     * Number of nodes on the longest path from {@code root} to a leaf. A single leaf has depth 1.
     */
    public static int depth(Node root) {
        Deque<Node> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(1);

        int max = 0;
        while (!nodes.isEmpty()) {
            Node node = nodes.pop();
            int depth = depths.pop();
            max = Math.max(max, depth);
            for (Node child : node.children()) {
                nodes.push(child);
                depths.push(depth + 1);
            }
        }
        return max;
    }

    /**
     * Whether a subtree structurally equal to {@code node} occurs anywhere under {@code root}.
     */
    public static boolean contains(Node root, Node node) {
        return Iterables.any(preOrder(root), node::equals);
    }
}
