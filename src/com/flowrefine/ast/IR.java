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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/** An AST construction helper class that validates the shape of what it builds. */
public class IR {

  private IR() {}

  public static Node name(String name) {
    checkState(
        !name.isEmpty() && name.indexOf('.') == -1,
        "Invalid name '%s'. Did you mean to use IR.getprop?",
        name);
    return Node.newString(Token.NAME, name);
  }

  /** Builds {@code target.prop.moreProps...}. */
  public static Node getprop(Node target, String prop, String... moreProps) {
    checkState(mayBeExpression(target), target);
    Node result = getpropNode(target, prop);
    for (String moreProp : moreProps) {
      result = getpropNode(result, moreProp);
    }
    return result;
  }

  private static Node getpropNode(Node target, String prop) {
    checkArgument(!prop.isEmpty(), "empty property name");
    Node getprop = Node.newString(Token.GETPROP, prop);
    getprop.addChildToBack(target);
    return getprop;
  }

  /** Builds a qualified name such as {@code a.b.c} from its dotted form. */
  public static Node qname(String qualifiedName) {
    String[] parts = qualifiedName.split("\\.", -1);
    Node result = name(parts[0]);
    for (int i = 1; i < parts.length; i++) {
      result = getpropNode(result, parts[i]);
    }
    return result;
  }

  public static Node call(Node target, Node... args) {
    checkState(mayBeExpression(target), target);
    Node call = new Node(Token.CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg) || arg.isArgumentWrapper(), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node keywordArg(String keyword, Node value) {
    checkState(mayBeExpression(value), value);
    Node arg = Node.newString(Token.KEYWORD_ARG, keyword);
    arg.addChildToBack(value);
    return arg;
  }

  public static Node starArg(Node value) {
    checkState(mayBeExpression(value), value);
    return new Node(Token.STAR_ARG, value);
  }

  public static Node doubleStarArg(Node value) {
    checkState(mayBeExpression(value), value);
    return new Node(Token.DOUBLE_STAR_ARG, value);
  }

  public static Node none() {
    return new Node(Token.NONE);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node string(String s) {
    return Node.newString(Token.STRINGLIT, s);
  }

  public static Node tuple(Node... elements) {
    Node tuple = new Node(Token.TUPLE);
    for (Node element : elements) {
      checkState(mayBeExpression(element), element);
      tuple.addChildToBack(element);
    }
    return tuple;
  }

  public static Node is(Node left, Node right) {
    return binaryOp(Token.IS, left, right);
  }

  public static Node isNot(Node left, Node right) {
    return binaryOp(Token.IS_NOT, left, right);
  }

  public static Node eq(Node left, Node right) {
    return binaryOp(Token.EQ, left, right);
  }

  public static Node ne(Node left, Node right) {
    return binaryOp(Token.NE, left, right);
  }

  public static Node lt(Node left, Node right) {
    return binaryOp(Token.LT, left, right);
  }

  public static Node in(Node left, Node right) {
    return binaryOp(Token.IN, left, right);
  }

  public static Node and(Node left, Node right) {
    return binaryOp(Token.AND, left, right);
  }

  public static Node or(Node left, Node right) {
    return binaryOp(Token.OR, left, right);
  }

  public static Node add(Node left, Node right) {
    return binaryOp(Token.ADD, left, right);
  }

  public static Node sub(Node left, Node right) {
    return binaryOp(Token.SUB, left, right);
  }

  public static Node getelem(Node target, Node index) {
    return binaryOp(Token.GETELEM, target, index);
  }

  public static Node not(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.NOT, expr);
  }

  public static Node neg(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.NEG, expr);
  }

  /** Builds the annotated assignment target {@code target: annotation}. */
  public static Node annotated(Node target, Node annotation) {
    checkState(mayBeExpression(target), target);
    checkState(mayBeExpression(annotation), annotation);
    return new Node(Token.ANNOTATED, target, annotation);
  }

  public static Node binaryOp(Token token, Node left, Node right) {
    checkArgument(isBinaryOperator(token), "%s is not a binary operator", token);
    checkState(mayBeExpression(left), left);
    checkState(mayBeExpression(right), right);
    return new Node(token, left, right);
  }

  private static boolean isBinaryOperator(Token token) {
    switch (token) {
      case AND:
      case OR:
      case ADD:
      case SUB:
      case MUL:
      case DIV:
      case GETELEM:
        return true;
      default:
        return token.isComparison();
    }
  }

  /**
   * It isn't possible to always determine if a detached node is an expression, so just reject the
   * known non-expression tokens.
   */
  static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case KEYWORD_ARG:
      case STAR_ARG:
      case DOUBLE_STAR_ARG:
      case ANNOTATED:
        return false;
      default:
        return true;
    }
  }
}
