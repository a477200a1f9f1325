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
package dev.calcengine.api.functions;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import java.util.Objects;

/**
 * Factories for value-typed {@link FunctionDescriptor}s.
 */
public final class Descriptors {
    private Descriptors() {}

    /**
     * Create a descriptor which only carries a symbol and an arity.
     *
     * @param symbol operator symbol or function name, may be {@code null}
     */
    public static FunctionDescriptor of(String symbol, Arity arity) {
        return new SimpleDescriptor(symbol, checkNotNull(arity, "arity"));
    }

    /**
     * Create a descriptor that evaluates its arguments with {@code body}.
     */
    public static EvaluableFunction evaluable(String symbol, Arity arity, Body body) {
        return new EvaluableDescriptor(symbol, checkNotNull(arity, "arity"), checkNotNull(body, "body"));
    }

    @FunctionalInterface
    public interface Body {
        Object apply(List<Object> arguments);
    }

    static class SimpleDescriptor implements FunctionDescriptor {
        private final String symbol;
        private final Arity arity;

        SimpleDescriptor(String symbol, Arity arity) {
            this.symbol = symbol;
            this.arity = arity;
        }

        @Override
        public String symbol() {
            return symbol;
        }

        @Override
        public Arity arity() {
            return arity;
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            SimpleDescriptor other = (SimpleDescriptor) o;
            return Objects.equals(symbol, other.symbol) && arity.equals(other.arity);
        }

        @Override
        public int hashCode() {
            return Objects.hash(symbol, arity);
        }

        @Override
        public String toString() {
            return symbol + "/" + arity;
        }
    }

    static final class EvaluableDescriptor extends SimpleDescriptor implements EvaluableFunction {
        private final Body body;

        EvaluableDescriptor(String symbol, Arity arity, Body body) {
            super(symbol, arity);
            this.body = body;
        }

        @Override
        public Object invoke(List<Object> arguments) {
            return body.apply(arguments);
        }

        // Bodies are opaque, so two evaluable descriptors are only equal when identical.
        @Override
        public boolean equals(Object o) {
            return this == o;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(this);
        }
    }
}
