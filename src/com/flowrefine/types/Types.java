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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import java.util.Arrays;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/** Factory for the payload-free types, plus the type-level helpers narrowing is built on. */
public final class Types {

  private static final Type UNBOUND = new NativeType(TypeCategory.UNBOUND, "Unbound");
  private static final Type UNKNOWN = new NativeType(TypeCategory.UNKNOWN, "Unknown");
  private static final Type ANY = new NativeType(TypeCategory.ANY, "Any");
  private static final Type NEVER = new NativeType(TypeCategory.NEVER, "Never");
  private static final Type NONE = new NativeType(TypeCategory.NONE, "None");

  private Types() {}

  public static Type unbound() {
    return UNBOUND;
  }

  public static Type unknown() {
    return UNKNOWN;
  }

  public static Type any() {
    return ANY;
  }

  public static Type never() {
    return NEVER;
  }

  public static Type none() {
    return NONE;
  }

  /** @see #combine(Iterable) */
  public static Type combine(Type... types) {
    return combine(Arrays.asList(types));
  }

  /**
   * Combines types into their union. Unions among the inputs are flattened, duplicates keep their
   * first position, and {@code Never} is dropped when anything else remains. An empty input yields
   * {@code Never} and a single surviving type is returned as is.
   */
  public static Type combine(Iterable<? extends Type> types) {
    ImmutableSet.Builder<Type> members = ImmutableSet.builder();
    boolean sawOther = false;
    for (Type type : types) {
      checkNotNull(type);
      UnionType union = type.toMaybeUnionType();
      if (union != null) {
        members.addAll(union.getAlternates());
        sawOther = true;
      } else {
        members.add(type);
        sawOther |= !type.isNever();
      }
    }
    ImmutableSet<Type> combined = members.build();
    if (combined.isEmpty()) {
      return NEVER;
    }
    if (sawOther && combined.contains(NEVER)) {
      combined = ImmutableSet.copyOf(Iterables.filter(combined, t -> !t.isNever()));
    }
    if (combined.size() == 1) {
      return Iterables.getOnlyElement(combined);
    }
    return new UnionType(combined.asList());
  }

  /** Returns the alternates of a union, or a single-element list holding any other type. */
  public static ImmutableList<Type> subtypesOf(Type type) {
    UnionType union = type.toMaybeUnionType();
    return union != null ? union.getAlternates() : ImmutableList.of(type);
  }

  /**
   * Applies {@code transform} to every subtype of {@code type} and combines the results. A null
   * result removes the subtype. A non-union type whose transform yields null becomes {@code
   * Never}.
   */
  public static Type mapSubtypes(Type type, Function<Type, @Nullable Type> transform) {
    ImmutableList.Builder<Type> survivors = ImmutableList.builder();
    for (Type subtype : subtypesOf(type)) {
      Type mapped = transform.apply(subtype);
      if (mapped != null) {
        survivors.add(mapped);
      }
    }
    return combine(survivors.build());
  }

  public static boolean isAnyOrUnknown(Type type) {
    return type.isAny() || type.isUnknown();
  }

  public static boolean isNoneOrNever(Type type) {
    return type.isNone() || type.isNever();
  }

  /** Returns true if a value of this type could evaluate to true in a boolean context. */
  public static boolean canBeTruthy(Type type) {
    switch (type.getCategory()) {
      case NONE:
      case NEVER:
        return false;
      case OBJECT:
        ClassType classType = type.toMaybeObjectType().getClassType();
        return !isEmptyTuple(classType) && !classType.isAlwaysFalsy();
      case UNION:
        for (Type alternate : type.toMaybeUnionType().getAlternates()) {
          if (canBeTruthy(alternate)) {
            return true;
          }
        }
        return false;
      default:
        return true;
    }
  }

  /** Returns true if a value of this type could evaluate to false in a boolean context. */
  public static boolean canBeFalsy(Type type) {
    switch (type.getCategory()) {
      case UNBOUND:
      case UNKNOWN:
      case ANY:
      case NONE:
      case NEVER:
        return true;
      case FUNCTION:
      case MODULE:
      case CLASS:
        return false;
      case OBJECT:
        ClassType classType = type.toMaybeObjectType().getClassType();
        if (classType.isBuiltIn(ClassType.TUPLE) && classType.getTypeArguments() != null) {
          return classType.getTypeArguments().isEmpty();
        }
        return classType.isAlwaysFalsy()
            || classType.hasMember("__bool__")
            || classType.hasMember("__len__");
      case UNION:
        for (Type alternate : type.toMaybeUnionType().getAlternates()) {
          if (canBeFalsy(alternate)) {
            return true;
          }
        }
        return false;
    }
    throw new AssertionError("Unhandled category: " + type.getCategory());
  }

  private static boolean isEmptyTuple(ClassType classType) {
    ImmutableList<Type> typeArguments = classType.getTypeArguments();
    return classType.isBuiltIn(ClassType.TUPLE) && typeArguments != null && typeArguments.isEmpty();
  }
}
