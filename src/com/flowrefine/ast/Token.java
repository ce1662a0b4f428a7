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

package com.flowrefine.ast;

/**
 * The kinds of expression nodes the narrowing engine can see.
 *
 * <p>Only a handful of these are ever narrowed; the rest exist so that callers can hand the engine
 * any expression and get a well-defined "no information" answer back.
 */
public enum Token {
  // Stable paths.
  NAME,
  GETPROP,

  // Calls and their argument wrappers.
  CALL,
  KEYWORD_ARG,
  STAR_ARG,
  DOUBLE_STAR_ARG,

  // Literals.
  NONE,
  TRUE,
  FALSE,
  NUMBER,
  STRINGLIT,
  TUPLE,

  // Comparisons.
  IS,
  IS_NOT,
  EQ,
  NE,
  LT,
  LE,
  GT,
  GE,
  IN,
  NOT_IN,

  // Boolean operators.
  AND,
  OR,
  NOT,

  // Arithmetic.
  NEG,
  ADD,
  SUB,
  MUL,
  DIV,

  GETELEM,

  // Assignment targets.
  ANNOTATED;

  /** Whether this token is a binary comparison operator. */
  public boolean isComparison() {
    switch (this) {
      case IS:
      case IS_NOT:
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case IN:
      case NOT_IN:
        return true;
      default:
        return false;
    }
  }
}
