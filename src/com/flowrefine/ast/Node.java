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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * An expression tree node.
 *
 * <p>Children are kept in a singly linked sibling list. Nodes are compared by identity; use {@link
 * #isEquivalentTo} for structural comparison. String-carrying nodes ({@code NAME}, {@code GETPROP},
 * {@code STRINGLIT}, {@code KEYWORD_ARG}) are created through {@link #newString}.
 */
public class Node {

  private final Token token;
  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node last;
  private @Nullable Node next;
  private int childCount;

  private static final class StringNode extends Node {
    private final String str;

    StringNode(Token token, String str) {
      super(token);
      this.str = checkNotNull(str);
    }

    @Override
    boolean isEquivalentToShallow(Node node) {
      return super.isEquivalentToShallow(node) && str.equals(((StringNode) node).str);
    }

    @Override
    void appendLabel(StringBuilder sb) {
      super.appendLabel(sb);
      sb.append(' ').append(str);
    }
  }

  private static final class NumberNode extends Node {
    private final double number;

    NumberNode(double number) {
      super(Token.NUMBER);
      this.number = number;
    }

    @Override
    boolean isEquivalentToShallow(Node node) {
      return super.isEquivalentToShallow(node)
          && Double.compare(number, ((NumberNode) node).number) == 0;
    }

    @Override
    void appendLabel(StringBuilder sb) {
      super.appendLabel(sb);
      sb.append(' ').append(number);
    }
  }

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public static Node newString(Token token, String str) {
    return new StringNode(token, str);
  }

  public static Node newNumber(double number) {
    return new NumberNode(number);
  }

  public final Token getToken() {
    return token;
  }

  public final String getString() {
    checkState(this instanceof StringNode, "%s does not carry a string", token);
    return ((StringNode) this).str;
  }

  public final double getDouble() {
    checkState(this instanceof NumberNode, "%s does not carry a number", token);
    return ((NumberNode) this).number;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getLastChild() {
    return last;
  }

  public final @Nullable Node getSecondChild() {
    return first != null ? first.next : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final Node getChildAtIndex(int i) {
    checkArgument(i >= 0 && i < childCount, "index %s out of range for %s", i, token);
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public final int getChildCount() {
    return childCount;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final boolean hasOneChild() {
    return childCount == 1;
  }

  public final boolean hasTwoChildren() {
    return childCount == 2;
  }

  /** Returns the children of this node in order. */
  public final Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node current = first;

          @Override
          public boolean hasNext() {
            return current != null;
          }

          @Override
          public Node next() {
            if (current == null) {
              throw new NoSuchElementException();
            }
            Node result = current;
            current = current.next;
            return result;
          }
        };
  }

  public final void addChildToBack(Node child) {
    child.checkDetached();
    child.parent = this;
    if (last == null) {
      first = child;
    } else {
      last.next = child;
    }
    last = child;
    childCount++;
  }

  private void checkDetached() {
    checkState(parent == null, "node is already attached to %s", parent);
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isNone() {
    return token == Token.NONE;
  }

  public final boolean isNot() {
    return token == Token.NOT;
  }

  public final boolean isAnnotated() {
    return token == Token.ANNOTATED;
  }

  /** Whether this node wraps a call argument that is not a plain positional value. */
  public final boolean isArgumentWrapper() {
    return token == Token.KEYWORD_ARG
        || token == Token.STAR_ARG
        || token == Token.DOUBLE_STAR_ARG;
  }

  /** Returns true if this node and {@code node} have the same shape, tokens and payloads. */
  public final boolean isEquivalentTo(Node node) {
    if (!isEquivalentToShallow(node)) {
      return false;
    }
    Node a = first;
    Node b = node.first;
    while (a != null) {
      if (!a.isEquivalentTo(b)) {
        return false;
      }
      a = a.next;
      b = b.next;
    }
    return true;
  }

  boolean isEquivalentToShallow(Node node) {
    return token == node.token
        && childCount == node.childCount
        && getClass() == node.getClass();
  }

  void appendLabel(StringBuilder sb) {
    sb.append(token);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendLabel(sb);
    return sb.toString();
  }

  /** Returns a multi-line, indented rendering of this subtree. */
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendTree(sb, 0);
    return sb.toString();
  }

  private void appendTree(StringBuilder sb, int depth) {
    for (int i = 0; i < depth; i++) {
      sb.append("    ");
    }
    appendLabel(sb);
    sb.append('\n');
    for (Node c = first; c != null; c = c.next) {
      c.appendTree(sb, depth + 1);
    }
  }
}
