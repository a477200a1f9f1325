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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

public final class TestDescriptors {
    @Test
    public void testValueDescriptors() {
        FunctionDescriptor eq = Descriptors.of("==", Arity.exactly(2));
        assertEquals("==", eq.symbol());
        assertEquals(Arity.exactly(2), eq.arity());
        assertEquals(eq, Descriptors.of("==", Arity.exactly(2)));
        assertEquals(eq.hashCode(), Descriptors.of("==", Arity.exactly(2)).hashCode());
        assertNotEquals(eq, Descriptors.of("==", Arity.atLeast(2)));
        assertEquals("==/2", eq.toString());
    }

    @Test
    public void testAbsentSymbol() {
        FunctionDescriptor unnamed = Descriptors.of(null, Arity.any());
        assertNull(unnamed.symbol());
        assertEquals(unnamed, Descriptors.of(null, Arity.any()));
    }

    @Test
    public void testEvaluable() {
        EvaluableFunction concat = Descriptors.evaluable("concat", Arity.atLeast(0), args -> String.valueOf(args));
        assertEquals("[a, 1]", concat.invoke(List.of("a", 1)));
        assertEquals(concat, concat);
        assertNotEquals(concat, Descriptors.evaluable("concat", Arity.atLeast(0), args -> String.valueOf(args)));
        assertNotEquals(concat, Descriptors.of("concat", Arity.atLeast(0)));
    }

    @Test
    public void testRequiredArguments() {
        assertThrows(NullPointerException.class, () -> Descriptors.of("f", null));
        assertThrows(NullPointerException.class, () -> Descriptors.evaluable("f", Arity.any(), null));
    }
}
