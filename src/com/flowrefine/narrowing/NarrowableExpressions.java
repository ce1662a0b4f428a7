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

import com.flowrefine.ast.Node;

/**
 * Recognizes the expressions whose types can be narrowed.
 *
 * <p>Only expressions whose value cannot change within a straight-line block qualify: simple names
 * and property chains made of simple names ({@code a.b.c}). Two such expressions denote the same
 * value when they are spelled the same way.
 */
public final class NarrowableExpressions {

  private NarrowableExpressions() {}

  public static boolean isSupportedExpression(Node expression) {
    switch (expression.getToken()) {
      case NAME:
        return true;
      case GETPROP:
        return isSupportedExpression(expression.getFirstChild());
      default:
        return false;
    }
  }

  /** Returns true if both expressions are the same name or the same property chain. */
  public static boolean pathsMatch(Node a, Node b) {
    if (a.getToken() != b.getToken()) {
      return false;
    }
    switch (a.getToken()) {
      case NAME:
        return a.getString().equals(b.getString());
      case GETPROP:
        return a.getString().equals(b.getString())
            && pathsMatch(a.getFirstChild(), b.getFirstChild());
      default:
        return false;
    }
  }
}
