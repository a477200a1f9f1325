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
import dev.calcengine.api.Node;
import dev.calcengine.api.NodeVisitor;
import java.util.Locale;

/**
 * Leaf referring to a variable by name. Names compare case-insensitively.
 */
public final class VariableNode extends Node {
    private final String name;

    private VariableNode(String name) {
        checkArgument(!Strings.isNullOrEmpty(name), "variable name cannot be empty");
        this.name = name;
    }

    public static VariableNode of(String name) {
        return new VariableNode(name);
    }

    public String name() {
        return name;
    }

    @Override
    public <R, S> R accept(NodeVisitor<R, S> visitor, S sessionData) {
        checkArgument(visitor != null, "visitor cannot be null");
        if (visitor instanceof VariableNodeVisitor) {
            return ((VariableNodeVisitor<R, S>) visitor).visitVariable(this, sessionData);
        }
        return visitor.visit(this, sessionData);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        VariableNode other = (VariableNode) o;
        return name.toLowerCase(Locale.ROOT).equals(other.name.toLowerCase(Locale.ROOT));
    }

    @Override
    public int hashCode() {
        return name.toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public String toString() {
        return "( Variable \"" + name + "\") ";
    }
}
