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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.calcengine.api.Fixtures.NamedNode;
import dev.calcengine.api.nodes.ConstantNode;
import java.util.List;
import org.junit.jupiter.api.Test;

public final class TestNode {
    @Test
    public void testChildAccess() {
        Node a = ConstantNode.of(1);
        Node b = ConstantNode.of(2);
        Node node = new NamedNode("pair", List.of(a, b));

        assertEquals(2, node.childCount());
        assertSame(a, node.childAt(0));
        assertSame(b, node.childAt(1));
        assertThrows(IndexOutOfBoundsException.class, () -> node.childAt(2));
        assertThrows(IndexOutOfBoundsException.class, () -> node.childAt(-1));
    }

    @Test
    public void testChildrenAreSealed() {
        Node node = new NamedNode("pair", List.of(ConstantNode.of(1)));
        assertThrows(UnsupportedOperationException.class, () -> node.children().add(ConstantNode.of(2)));
        assertEquals(1, node.childCount());
    }

    @Test
    public void testChildrenEqualIsOrderSensitive() {
        Node a = ConstantNode.of(1);
        Node b = ConstantNode.of(2);

        assertTrue(Node.childrenEqual(new NamedNode("x", List.of(a, b)), new NamedNode("y", List.of(a, b))));
        assertFalse(Node.childrenEqual(new NamedNode("x", List.of(a, b)), new NamedNode("x", List.of(b, a))));
        assertFalse(Node.childrenEqual(new NamedNode("x", List.of(a)), new NamedNode("x", List.of(a, b))));
    }

    @Test
    public void testDefaultClassification() {
        assertEquals(NodeTypes.GENERIC, ConstantNode.of(1).classify());
    }
}
