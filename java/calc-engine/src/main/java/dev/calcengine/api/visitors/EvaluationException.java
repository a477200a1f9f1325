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

import dev.calcengine.api.Node;

/**
 * Raised when an expression tree cannot be evaluated.
 */
public final class EvaluationException extends RuntimeException {
    private final transient Node node;

    public EvaluationException(Node node, String message) {
        super(message);
        this.node = node;
    }

    public EvaluationException(Node node, String message, Throwable cause) {
        super(message, cause);
        this.node = node;
    }

    /**
     * The node being evaluated when the failure happened.
     */
    public Node getNode() {
        return node;
    }
}
