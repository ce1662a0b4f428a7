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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeTest {

  @Test
  public void testChildren() {
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node c = IR.name("c");
    Node tuple = IR.tuple(a, b, c);

    assertThat(tuple.children()).containsExactly(a, b, c).inOrder();
    assertThat(tuple.getChildAtIndex(1)).isSameInstanceAs(b);
    assertThat(a.getNext()).isSameInstanceAs(b);
    assertThat(c.getNext()).isNull();
    assertThat(tuple.getLastChild()).isSameInstanceAs(c);
  }

  @Test
  public void testChildAtIndexOutOfRange() {
    Node tuple = IR.tuple(IR.name("a"));
    assertThrows(IllegalArgumentException.class, () -> tuple.getChildAtIndex(1));
  }

  @Test
  public void testGetStringOnNonStringNode() {
    assertThrows(IllegalStateException.class, () -> IR.none().getString());
  }

  @Test
  public void testEquivalence() {
    assertThat(IR.is(IR.name("x"), IR.none()).isEquivalentTo(IR.is(IR.name("x"), IR.none())))
        .isTrue();
    assertThat(IR.is(IR.name("x"), IR.none()).isEquivalentTo(IR.isNot(IR.name("x"), IR.none())))
        .isFalse();
    assertThat(IR.number(1).isEquivalentTo(IR.number(2))).isFalse();
    assertThat(IR.string("a").isEquivalentTo(IR.name("a"))).isFalse();
  }

  @Test
  public void testToStringTree() {
    Node test = IR.not(IR.getprop(IR.name("a"), "b"));
    assertThat(test.toStringTree()).isEqualTo("NOT\n    GETPROP b\n        NAME a\n");
  }
}
