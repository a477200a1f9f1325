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
 * Discriminants returned by {@link Node#classify()}.
 * <p>
 * The numeric values are shared with downstream optimizers and must not change.
 */
public final class NodeTypes {
    private NodeTypes() {}

    public static final int GENERIC = 0;
    public static final int EQUALITY = 4;
    public static final int LOGICAL_AND = 7;
}
