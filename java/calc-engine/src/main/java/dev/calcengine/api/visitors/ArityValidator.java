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

import com.google.common.collect.ImmutableList;
import dev.calcengine.api.Node;
import dev.calcengine.api.nodes.FunctionNode;
import dev.calcengine.api.nodes.FunctionNodeVisitor;
import org.tinylog.Logger;

/**
 * Find every function node whose number of children is not accepted by its descriptor, without
 * evaluating anything.
 */
public final class ArityValidator implements FunctionNodeVisitor<Void, ImmutableList.Builder<FunctionNode>> {
    public static final ArityValidator INSTANCE = new ArityValidator();

    private ArityValidator() {}

    /**
     * Mismatched nodes in pre-order. Empty when the whole tree is consistent.
     */
    public static ImmutableList<FunctionNode> validate(Node root) {
        ImmutableList.Builder<FunctionNode> mismatches = ImmutableList.builder();
        for (Node node : NodeTraversal.preOrder(root)) {
            node.accept(INSTANCE, mismatches);
        }
        return mismatches.build();
    }

    public static boolean isValid(Node root) {
        return validate(root).isEmpty();
    }

    @Override
    public Void visitFunction(FunctionNode node, ImmutableList.Builder<FunctionNode> mismatches) {
        if (!node.descriptor().arity().accepts(node.childCount())) {
            Logger.debug("Function " + node.name() + " expects " + node.descriptor().arity() + " arguments, has "
                    + node.childCount());
            mismatches.add(node);
        }
        return null;
    }

    @Override
    public Void visit(Node node, ImmutableList.Builder<FunctionNode> mismatches) {
        return null;
    }
}
