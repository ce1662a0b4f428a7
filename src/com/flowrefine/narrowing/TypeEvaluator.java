/*
 * Copyright 2026 The Flowrefine Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.flowrefine.narrowing;

import com.flowrefine.ast.Node;
import com.flowrefine.types.Type;

/**
 * Computes the currently known type of an expression at the point a test is being evaluated.
 *
 * <p>Implementations must be synchronous and must return the same answer when asked twice about
 * the same expression within one call into {@link NarrowingFactBuilder}.
 */
@FunctionalInterface
public interface TypeEvaluator {
  Type evaluate(Node expression);
}
