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

/** A callable value. Only its name matters here; signatures belong to the evaluator. */
public final class FunctionType extends Type {

  private final String name;

  private FunctionType(String name) {
    this.name = checkNotNull(name);
  }

  public static FunctionType create(String name) {
    return new FunctionType(name);
  }

  public String getName() {
    return name;
  }

  @Override
  public TypeCategory getCategory() {
    return TypeCategory.FUNCTION;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    return other instanceof FunctionType && ((FunctionType) other).name.equals(name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return "function " + name;
  }
}
