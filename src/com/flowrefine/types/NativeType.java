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

import org.jspecify.annotations.Nullable;

/**
 * The payload-free types. There is exactly one instance per category, handed out by {@link Types},
 * so identity is equality.
 */
final class NativeType extends Type {

  private final TypeCategory category;
  private final String displayName;

  NativeType(TypeCategory category, String displayName) {
    checkArgument(
        category == TypeCategory.UNBOUND
            || category == TypeCategory.UNKNOWN
            || category == TypeCategory.ANY
            || category == TypeCategory.NEVER
            || category == TypeCategory.NONE,
        "%s carries a payload",
        category);
    this.category = category;
    this.displayName = displayName;
  }

  @Override
  public TypeCategory getCategory() {
    return category;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    return this == other;
  }

  @Override
  public int hashCode() {
    return category.hashCode();
  }

  @Override
  public String toString() {
    return displayName;
  }
}
