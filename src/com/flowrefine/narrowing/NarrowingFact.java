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
import com.flowrefine.types.ClassType;
import com.flowrefine.types.Type;
import com.flowrefine.types.Types;
import com.google.auto.value.AutoValue;

/**
 * Records that, along some branch, an expression has a narrower type than the one it was declared
 * with. The expression is the tree node the fact was derived from, not a copy.
 *
 * <p>A conditional fact describes only one of the ways the value could have been produced, so it
 * widens the current type instead of replacing it.
 */
@AutoValue
public abstract class NarrowingFact {

  /** The narrowed name or property chain. */
  public abstract Node getExpression();

  public abstract Type getNarrowedType();

  public abstract boolean isConditional();

  public static NarrowingFact create(Node expression, Type narrowedType) {
    return new AutoValue_NarrowingFact(expression, narrowedType, false);
  }

  /** Returns a conditional version of this fact, or this fact if it already is conditional. */
  public NarrowingFact asConditional() {
    if (isConditional()) {
      return this;
    }
    return new AutoValue_NarrowingFact(getExpression(), getNarrowedType(), true);
  }

  /** Whether {@code expression} is spelled the same way as the narrowed expression. */
  public boolean matches(Node expression) {
    return NarrowableExpressions.pathsMatch(expression, getExpression());
  }

  /**
   * Returns the type of {@code expression} once this fact is taken into account, given that its
   * type without the fact is {@code type}.
   */
  public Type applyTo(Node expression, Type type) {
    if (!matches(expression)) {
      return type;
    }

    // Special built-in classes are synthesized by the evaluator; only an unbound symbol may
    // receive one through a fact.
    ClassType narrowedClass = getNarrowedType().toMaybeClassType();
    if (narrowedClass != null && narrowedClass.isSpecialBuiltIn() && !type.isUnbound()) {
      return type;
    }

    if (isConditional()) {
      return Types.combine(getNarrowedType(), type);
    }
    return getNarrowedType();
  }
}
