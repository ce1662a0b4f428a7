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

import com.flowrefine.types.ClassType;
import com.flowrefine.types.ObjectType;
import com.flowrefine.types.Type;
import com.flowrefine.types.Types;
import com.flowrefine.types.UnionType;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CheckReturnValue;
import java.util.List;

/**
 * Computes the type an expression must have given the outcome of a test on it.
 *
 * <p>Each transform takes the type before the test and whether the test held ({@code outcome}),
 * and never looks at the tree. {@code Never} means the branch cannot be reached.
 */
@CheckReturnValue
final class TypeTransforms {

  private TypeTransforms() {}

  /** Narrows for the test {@code if x:}. */
  static Type narrowForTruthiness(Type type, boolean outcome) {
    if (Types.isAnyOrUnknown(type)) {
      return type;
    }
    ImmutableList.Builder<Type> survivors = ImmutableList.builder();
    for (Type subtype : Types.subtypesOf(type)) {
      if (outcome ? Types.canBeTruthy(subtype) : Types.canBeFalsy(subtype)) {
        survivors.add(subtype);
      }
    }
    return Types.combine(survivors.build());
  }

  /** Narrows for the test {@code if x is None:}. */
  static Type narrowForIsNone(Type type, boolean outcome) {
    UnionType union = type.toMaybeUnionType();
    if (union != null) {
      ImmutableList.Builder<Type> survivors = ImmutableList.builder();
      for (Type alternate : union.getAlternates()) {
        // Any is both None and not None.
        if (Types.isAnyOrUnknown(alternate) || Types.isNoneOrNever(alternate) == outcome) {
          survivors.add(alternate);
        }
      }
      return Types.combine(survivors.build());
    }
    if (Types.isNoneOrNever(type) && !outcome) {
      return Types.never();
    }
    return type;
  }

  /** Narrows for the test {@code if type(x) is classType:}. */
  static Type narrowForIsType(Type type, ClassType classType, boolean outcome) {
    return Types.mapSubtypes(
        type,
        subtype -> {
          ObjectType objectType = subtype.toMaybeObjectType();
          if (objectType != null) {
            boolean matches = objectType.getClassType().isSameGenericClass(classType);
            return matches == outcome ? subtype : null;
          }
          if (Types.isNoneOrNever(subtype)) {
            return outcome ? null : subtype;
          }
          return subtype;
        });
  }

  /** Narrows for the test {@code if isinstance(x, (A, B, ...)):}. */
  static Type narrowForIsInstance(Type type, List<ClassType> filters, boolean outcome) {
    ObjectType objectType = type.toMaybeObjectType();
    if (objectType != null) {
      return Types.combine(filterInstance(objectType, filters, outcome));
    }

    UnionType union = type.toMaybeUnionType();
    if (union == null) {
      return type;
    }
    ImmutableList.Builder<Type> survivors = ImmutableList.builder();
    for (Type alternate : union.getAlternates()) {
      if (Types.isAnyOrUnknown(alternate)) {
        survivors.add(alternate);
      } else if (alternate.isObject()) {
        survivors.addAll(filterInstance(alternate.toMaybeObjectType(), filters, outcome));
      } else if (!outcome) {
        // Nothing but an instance passes isinstance.
        survivors.add(alternate);
      }
    }
    return Types.combine(survivors.build());
  }

  /** Returns what an instance of {@code instanceType} can be after the isinstance test. */
  private static ImmutableList<Type> filterInstance(
      ObjectType instanceType, List<ClassType> filters, boolean outcome) {
    ClassType varClass = instanceType.getClassType();
    ImmutableList.Builder<Type> filtered = ImmutableList.builder();
    boolean foundSuperclass = false;
    for (ClassType filter : filters) {
      boolean filterIsSuperclass = varClass.isDerivedFrom(filter);
      boolean filterIsSubclass = filter.isDerivedFrom(varClass);
      foundSuperclass |= filterIsSuperclass;

      if (outcome) {
        if (filterIsSuperclass) {
          filtered.add(instanceType);
        } else if (filterIsSubclass) {
          filtered.add(filter.instance());
        }
      }
    }

    // An instance of a class that some filter always matches cannot reach the negative branch.
    if (!outcome && !foundSuperclass) {
      filtered.add(instanceType);
    }
    return filtered.build();
  }
}
