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

import dev.calcengine.api.Node;
import dev.calcengine.api.NodeVisitor;
import java.util.Objects;

/**
 * Leaf holding a constant value. The value may be {@code null}.
 */
public final class ConstantNode extends Node {
    private final Object value;

    private ConstantNode(Object value) {
        this.value = value;
    }

    public static ConstantNode of(Object value) {
        return new ConstantNode(value);
    }

    public Object getValue() {
        return value;
    }

    @Override
    public <R, S> R accept(NodeVisitor<R, S> visitor, S sessionData) {
        checkArgument(visitor != null, "visitor cannot be null");
        if (visitor instanceof ConstantNodeVisitor) {
            return ((ConstantNodeVisitor<R, S>) visitor).visitConstant(this, sessionData);
        }
        return visitor.visit(this, sessionData);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ConstantNode other = (ConstantNode) o;
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return "( Constant " + value + ") ";
    }
}
