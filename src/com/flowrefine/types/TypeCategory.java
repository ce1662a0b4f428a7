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

/** Discriminant of the closed family of {@link Type}s. */
public enum TypeCategory {
  /** A symbol that has no value yet at the point of the query. */
  UNBOUND,
  UNKNOWN,
  ANY,
  /** The empty type. A value of this type can never be observed. */
  NEVER,
  NONE,
  FUNCTION,
  MODULE,
  /** The class object itself, as opposed to one of its instances. */
  CLASS,
  OBJECT,
  UNION
}
