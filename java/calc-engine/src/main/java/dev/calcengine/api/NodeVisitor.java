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

/**
 * Generic callback accepted by every {@link Node}.
 * <p>
 * Behaviour specific to one kind of node is added by also implementing that kind's visitor
 * interface, e.g. {@link dev.calcengine.api.nodes.FunctionNodeVisitor}. Nodes probe the visitor
 * instance for those interfaces at runtime, so new traversals never require changes to the node
 * classes.
 *
 * @param <R> result of a visit
 * @param <S> session data threaded through one traversal
 */
public interface NodeVisitor<R, S> {
    R visit(Node node, S sessionData);
}
