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

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import dev.calcengine.api.Node;
import dev.calcengine.api.nodes.ConstantNode;
import dev.calcengine.api.nodes.ConstantNodeVisitor;
import dev.calcengine.api.nodes.FunctionNode;
import dev.calcengine.api.nodes.FunctionNodeVisitor;
import dev.calcengine.api.nodes.VariableNode;
import dev.calcengine.api.nodes.VariableNodeVisitor;
import java.util.ArrayList;
import java.util.List;

/**
 * Render an expression tree as human readable infix text.
 * <p>
 * Binary operators are printed as {@code (a op b)}, any other function as {@code name(a, b, ...)}.
 * String constants are double-quoted with {@code "} and {@code \} escaped by a backslash.
 */
public final class ExpressionPrinter
        implements FunctionNodeVisitor<String, Void>, ConstantNodeVisitor<String, Void>, VariableNodeVisitor<String, Void> {
    public static final ExpressionPrinter INSTANCE = new ExpressionPrinter();

    private static final Joiner ARGUMENTS = Joiner.on(", ");
    private static final Escaper STRING_ESCAPER = Escapers.builder()
            .addEscape('\\', "\\\\")
            .addEscape('"', "\\\"")
            .build();

    private ExpressionPrinter() {}

    public static String print(Node node) {
        return node.accept(INSTANCE, null);
    }

    @Override
    public String visitFunction(FunctionNode node, Void unused) {
        List<String> arguments = new ArrayList<>(node.childCount());
        for (Node child : node.children()) {
            arguments.add(child.accept(this, unused));
        }
        if (arguments.size() == 2 && isOperator(node)) {
            return "(" + arguments.get(0) + " " + node.name() + " " + arguments.get(1) + ")";
        }
        return node.name() + "(" + ARGUMENTS.join(arguments) + ")";
    }

    @Override
    public String visitConstant(ConstantNode node, Void unused) {
        Object value = node.getValue();
        if (value instanceof String) {
            return "\"" + STRING_ESCAPER.escape((String) value) + "\"";
        }
        return String.valueOf(value);
    }

    @Override
    public String visitVariable(VariableNode node, Void unused) {
        return node.name();
    }

    @Override
    public String visit(Node node, Void unused) {
        return node.toString();
    }

    // Decided from the printed name, not the descriptor.
    private static boolean isOperator(FunctionNode node) {
        String name = node.name();
        return Ascii.equalsIgnoreCase(name, "and") || name.chars().noneMatch(Character::isLetterOrDigit);
    }
}
