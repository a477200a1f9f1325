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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

/**
 * Inclusive range of argument counts accepted by a function.
 */
public final class Arity {
    static final int UNBOUNDED = -1;

    private static final Arity ANY = new Arity(0, UNBOUNDED);

    private final int min;
    private final int max;

    private Arity(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public static Arity exactly(int count) {
        checkArgument(count >= 0, "arity cannot be negative: %s", count);
        return new Arity(count, count);
    }

    public static Arity atLeast(int min) {
        checkArgument(min >= 0, "arity cannot be negative: %s", min);
        return new Arity(min, UNBOUNDED);
    }

    public static Arity between(int min, int max) {
        checkArgument(min >= 0, "arity cannot be negative: %s", min);
        checkArgument(max >= min, "max arity %s is less than min arity %s", max, min);
        return new Arity(min, max);
    }

    public static Arity any() {
        return ANY;
    }

    public int getMin() {
        return min;
    }

    public boolean isVariadic() {
        return max == UNBOUNDED;
    }

    /**
     * Upper bound of the range. Only meaningful when {@link #isVariadic()} is false.
     */
    public int getMax() {
        return max;
    }

    public boolean accepts(int count) {
        return count >= min && (isVariadic() || count <= max);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Arity)) return false;
        Arity arity = (Arity) o;
        return min == arity.min && max == arity.max;
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }

    @Override
    public String toString() {
        if (isVariadic()) {
            return min + "..";
        }
        if (min == max) {
            return Integer.toString(min);
        }
        return min + ".." + max;
    }
}
