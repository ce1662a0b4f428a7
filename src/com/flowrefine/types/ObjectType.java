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

import org.jspecify.annotations.Nullable;

/** An instance of a class. */
public final class ObjectType extends Type {

  private final ClassType classType;

  private ObjectType(ClassType classType) {
    this.classType = checkNotNull(classType);
  }

  public static ObjectType create(ClassType classType) {
    return new ObjectType(classType);
  }

  @Override
  public TypeCategory getCategory() {
    return TypeCategory.OBJECT;
  }

  @Override
  public ObjectType toMaybeObjectType() {
    return this;
  }

  public ClassType getClassType() {
    return classType;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    return other instanceof ObjectType && ((ObjectType) other).classType.equals(classType);
  }

  @Override
  public int hashCode() {
    return 17 + classType.hashCode();
  }

  @Override
  public String toString() {
    return classType.getDisplayName();
  }
}
