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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.jspecify.annotations.Nullable;

/**
 * A disjunction of at least two distinct, non-union alternates, in the order they were first seen.
 *
 * <p>Unions are only created by {@link Types#combine}, which keeps them canonical. Two unions are
 * equal when they have the same alternates, regardless of order.
 */
public final class UnionType extends Type {

  private final ImmutableList<Type> alternates;

  UnionType(ImmutableList<Type> alternates) {
    checkArgument(alternates.size() > 1, "a union needs at least two alternates");
    this.alternates = alternates;
  }

  @Override
  public TypeCategory getCategory() {
    return TypeCategory.UNION;
  }

  @Override
  public UnionType toMaybeUnionType() {
    return this;
  }

  public ImmutableList<Type> getAlternates() {
    return alternates;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    return other instanceof UnionType
        && ImmutableSet.copyOf(alternates)
            .equals(ImmutableSet.copyOf(((UnionType) other).alternates));
  }

  @Override
  public int hashCode() {
    return ImmutableSet.copyOf(alternates).hashCode();
  }

  @Override
  public String toString() {
    return "Union[" + Joiner.on(", ").join(alternates) + "]";
  }
}
