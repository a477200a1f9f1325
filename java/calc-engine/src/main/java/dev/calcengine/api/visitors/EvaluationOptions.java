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

import static com.google.common.base.Preconditions.checkState;

import org.immutables.value.Value;

/**
 * Settings for an {@link Evaluator}.
 */
@Value.Immutable
public interface EvaluationOptions {
    /**
     * Deepest function nesting the evaluator will descend into before failing. Bounds the Java
     * stack used by recursive evaluation.
     */
    @Value.Default
    default int maxDepth() {
        return 1024;
    }

    /**
     * Log every evaluated function node at trace level.
     */
    @Value.Default
    default boolean traceEvaluation() {
        return false;
    }

    @Value.Check
    default void check() {
        checkState(maxDepth() > 0, "maxDepth must be positive, was %s", maxDepth());
    }

    static EvaluationOptions of() {
        return ImmutableEvaluationOptions.builder().build();
    }

    static ImmutableEvaluationOptions.Builder builder() {
        return ImmutableEvaluationOptions.builder();
    }
}
