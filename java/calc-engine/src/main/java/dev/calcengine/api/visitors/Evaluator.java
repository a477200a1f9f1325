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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import dev.calcengine.api.Node;
import dev.calcengine.api.functions.Arity;
import dev.calcengine.api.functions.EvaluableFunction;
import dev.calcengine.api.functions.FunctionDescriptor;
import dev.calcengine.api.nodes.ConstantNode;
import dev.calcengine.api.nodes.ConstantNodeVisitor;
import dev.calcengine.api.nodes.FunctionNode;
import dev.calcengine.api.nodes.FunctionNodeVisitor;
import dev.calcengine.api.nodes.VariableNode;
import dev.calcengine.api.nodes.VariableNodeVisitor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.tinylog.Logger;

/**
 * Evaluates an expression tree against a set of variable bindings.
 * <p>
 * Function arguments are evaluated left to right and handed to
 * {@link EvaluableFunction#invoke(List)}. This is where a node whose child count does not match its
 * descriptor's {@link Arity} is rejected, since nodes accept any number of children when built.
 */
public final class Evaluator
        implements FunctionNodeVisitor<Object, Evaluator.Scope>,
                ConstantNodeVisitor<Object, Evaluator.Scope>,
                VariableNodeVisitor<Object, Evaluator.Scope> {
    private final EvaluationOptions options;

    private Evaluator(EvaluationOptions options) {
        this.options = options;
    }

    public static Evaluator create() {
        return new Evaluator(EvaluationOptions.of());
    }

    public static Evaluator create(EvaluationOptions options) {
        return new Evaluator(checkNotNull(options, "options"));
    }

    public Object evaluate(Node root) {
        return evaluate(root, Collections.emptyMap());
    }

    /**
     * Evaluate {@code root}. Variable names are looked up case-insensitively in {@code bindings}.
     *
     * @throws IllegalArgumentException if two bindings differ only by case
     * @throws EvaluationException if the tree cannot be evaluated
     */
    public Object evaluate(Node root, Map<String, ?> bindings) {
        checkNotNull(root, "root");
        checkNotNull(bindings, "bindings");
        return root.accept(this, new Scope(bindings));
    }

    @Override
    public Object visitFunction(FunctionNode node, Scope scope) {
        FunctionDescriptor descriptor = node.descriptor();
        if (!descriptor.arity().accepts(node.childCount())) {
            throw fail(
                    node,
                    "Function " + node.name() + " expects " + descriptor.arity() + " arguments, got "
                            + node.childCount());
        }
        if (!(descriptor instanceof EvaluableFunction)) {
            throw fail(node, "Function " + node.name() + " cannot be evaluated");
        }

        List<Object> arguments = new ArrayList<>(node.childCount());
        scope.enter(node);
        try {
            for (Node child : node.children()) {
                arguments.add(child.accept(this, scope));
            }
        } finally {
            scope.depth--;
        }

        Object result;
        try {
            result = ((EvaluableFunction) descriptor).invoke(Collections.unmodifiableList(arguments));
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            Logger.error(e, "Function " + node.name() + " failed on " + arguments);
            throw new EvaluationException(node, "Function " + node.name() + " failed: " + e.getMessage(), e);
        }

        if (options.traceEvaluation()) {
            Logger.trace(node.name() + arguments + " -> " + result);
        }
        return result;
    }

    @Override
    public Object visitConstant(ConstantNode node, Scope scope) {
        return node.getValue();
    }

    @Override
    public Object visitVariable(VariableNode node, Scope scope) {
        String key = node.name().toLowerCase(Locale.ROOT);
        if (!scope.variables.containsKey(key)) {
            throw fail(node, "Variable " + node.name() + " is not bound");
        }
        return scope.variables.get(key);
    }

    @Override
    public Object visit(Node node, Scope scope) {
        throw fail(node, "Cannot evaluate node of type " + node.getClass().getSimpleName());
    }

    private static EvaluationException fail(Node node, String message) {
        Logger.error("(eval) -> " + message);
        return new EvaluationException(node, message);
    }

    /**
     * Per-evaluation state. Not shared between evaluations.
     */
    public final class Scope {
        private final Map<String, Object> variables;
        private int depth;

        private Scope(Map<String, ?> bindings) {
            this.variables = new HashMap<>();
            for (Map.Entry<String, ?> binding : bindings.entrySet()) {
                String name = binding.getKey();
                checkArgument(name != null, "variable name cannot be null");
                String key = name.toLowerCase(Locale.ROOT);
                checkArgument(!variables.containsKey(key), "variable %s is bound more than once, ignoring case", name);
                variables.put(key, binding.getValue());
            }
        }

        private void enter(FunctionNode node) {
            if (depth >= options.maxDepth()) {
                throw fail(node, "Expression nesting exceeds " + options.maxDepth() + " levels");
            }
            depth++;
        }
    }
}
