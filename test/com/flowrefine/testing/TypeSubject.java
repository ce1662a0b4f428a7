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

package com.flowrefine.testing;

import static com.google.common.truth.Truth.assertAbout;

import com.flowrefine.types.Type;
import com.flowrefine.types.TypeCategory;
import com.google.common.truth.FailureMetadata;
import com.google.common.truth.Subject;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * A Truth Subject for {@link Type}. Usage:
 *
 * <pre>
 *   import static com.flowrefine.testing.TypeSubject.assertType;
 *   ...
 *   assertType(type).isEqualTo(expected);
 *   assertType(type).isNever();
 * </pre>
 */
public final class TypeSubject extends Subject {

  private final @Nullable Type actual;

  public static TypeSubject assertType(@Nullable Type type) {
    return assertAbout(types()).that(type);
  }

  public static Subject.Factory<TypeSubject, Type> types() {
    return TypeSubject::new;
  }

  private TypeSubject(FailureMetadata metadata, @Nullable Type actual) {
    super(metadata, actual);
    this.actual = actual;
  }

  public void hasCategory(TypeCategory category) {
    isNotNull();
    check("getCategory()").that(actual.getCategory()).isEqualTo(category);
  }

  public void isNever() {
    hasCategory(TypeCategory.NEVER);
  }

  /** Asserts that the type is a union of exactly the given alternates, in this order. */
  public void isUnionOf(Type... alternates) {
    hasCategory(TypeCategory.UNION);
    check("getAlternates()")
        .that(actual.toMaybeUnionType().getAlternates())
        .containsExactlyElementsIn(Arrays.asList(alternates))
        .inOrder();
  }
}
