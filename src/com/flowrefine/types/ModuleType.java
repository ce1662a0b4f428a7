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

/** An imported module value. */
public final class ModuleType extends Type {

  private final String moduleName;

  private ModuleType(String moduleName) {
    this.moduleName = checkNotNull(moduleName);
  }

  public static ModuleType create(String moduleName) {
    return new ModuleType(moduleName);
  }

  public String getModuleName() {
    return moduleName;
  }

  @Override
  public TypeCategory getCategory() {
    return TypeCategory.MODULE;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    return other instanceof ModuleType && ((ModuleType) other).moduleName.equals(moduleName);
  }

  @Override
  public int hashCode() {
    return moduleName.hashCode();
  }

  @Override
  public String toString() {
    return "Module(\"" + moduleName + "\")";
  }
}
