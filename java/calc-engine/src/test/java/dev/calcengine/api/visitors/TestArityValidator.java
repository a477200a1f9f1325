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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import dev.calcengine.api.Fixtures;
import dev.calcengine.api.Node;
import dev.calcengine.api.nodes.ConstantNode;
import dev.calcengine.api.nodes.FunctionNode;
import dev.calcengine.api.nodes.VariableNode;
import org.junit.jupiter.api.Test;

public final class TestArityValidator {
    @Test
    public void testConsistentTree() {
        Node expression = FunctionNode.of(
                Fixtures.AND,
                FunctionNode.of(Fixtures.EQ, VariableNode.of("x"), ConstantNode.of(1)),
                FunctionNode.of(Fixtures.SUM));
        assertTrue(ArityValidator.isValid(expression));
    }

    @Test
    public void testReportsMismatchesInPreOrder() {
        FunctionNode unary = FunctionNode.of(Fixtures.PLUS, ConstantNode.of(1));
        FunctionNode ternary = FunctionNode.of(Fixtures.EQ, ConstantNode.of(1), ConstantNode.of(2), ConstantNode.of(3));
        FunctionNode root = FunctionNode.of(Fixtures.AND, unary, ternary, ConstantNode.of(true));

        assertEquals(ImmutableList.of(root, unary, ternary), ArityValidator.validate(root));
    }
}
