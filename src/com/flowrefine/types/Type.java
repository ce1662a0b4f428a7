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

package com.flowrefine.types;

import org.jspecify.annotations.Nullable;

/**
 * Base class of every type the narrowing engine reasons about.
 *
 * <p>The family is closed: every subclass lives in this package and reports exactly one {@link
 * TypeCategory}, so callers can switch over {@link #getCategory} instead of testing classes.
 * Instances are immutable.
 */
public abstract class Type {

  // All subclasses must be defined in this package.
  Type() {}

  public abstract TypeCategory getCategory();

  public final boolean isUnbound() {
    return getCategory() == TypeCategory.UNBOUND;
  }

  public final boolean isUnknown() {
    return getCategory() == TypeCategory.UNKNOWN;
  }

  public final boolean isAny() {
    return getCategory() == TypeCategory.ANY;
  }

  public final boolean isNever() {
    return getCategory() == TypeCategory.NEVER;
  }

  public final boolean isNone() {
    return getCategory() == TypeCategory.NONE;
  }

  public final boolean isClass() {
    return getCategory() == TypeCategory.CLASS;
  }

  public final boolean isObject() {
    return getCategory() == TypeCategory.OBJECT;
  }

  public final boolean isUnion() {
    return getCategory() == TypeCategory.UNION;
  }

  /** Downcasts this to a ClassType, or returns null if this is not a class. */
  public @Nullable ClassType toMaybeClassType() {
    return null;
  }

  /** Downcasts this to an ObjectType, or returns null if this is not an instance type. */
  public @Nullable ObjectType toMaybeObjectType() {
    return null;
  }

  /** Downcasts this to a UnionType, or returns null if this is not a union. */
  public @Nullable UnionType toMaybeUnionType() {
    return null;
  }

  @Override
  public abstract boolean equals(@Nullable Object other);

  @Override
  public abstract int hashCode();

  /** Returns the type as it would be written in an annotation. */
  @Override
  public abstract String toString();
}
