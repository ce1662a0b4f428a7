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

import static com.flowrefine.narrowing.NarrowableExpressions.isSupportedExpression;
import static com.flowrefine.narrowing.NarrowableExpressions.pathsMatch;
import static com.google.common.truth.Truth.assertThat;

import com.flowrefine.ast.IR;
import com.flowrefine.ast.Node;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NarrowableExpressionsTest {

  @Test
  public void testNamesAndPropertyChainsAreSupported() {
    assertThat(isSupportedExpression(IR.name("x"))).isTrue();
    assertThat(isSupportedExpression(IR.qname("a.b"))).isTrue();
    assertThat(isSupportedExpression(IR.qname("a.b.c.d"))).isTrue();
  }

  @Test
  public void testComputedExpressionsAreNotSupported() {
    assertThat(isSupportedExpression(IR.call(IR.name("f")))).isFalse();
    assertThat(isSupportedExpression(IR.getprop(IR.call(IR.name("f")), "x"))).isFalse();
    assertThat(isSupportedExpression(IR.getelem(IR.name("a"), IR.number(0)))).isFalse();
    assertThat(isSupportedExpression(IR.getprop(IR.getelem(IR.name("a"), IR.number(0)), "b")))
        .isFalse();
    assertThat(isSupportedExpression(IR.add(IR.name("a"), IR.name("b")))).isFalse();
    assertThat(isSupportedExpression(IR.none())).isFalse();
    assertThat(isSupportedExpression(IR.string("x"))).isFalse();
    assertThat(isSupportedExpression(IR.not(IR.name("x")))).isFalse();
  }

  @Test
  public void testPathsMatchIsReflexive() {
    for (Node expression : ImmutableList.of(IR.name("x"), IR.qname("a.b"), IR.qname("a.b.c"))) {
      assertThat(pathsMatch(expression, expression)).isTrue();
    }
  }

  @Test
  public void testPathsMatchComparesSpelling() {
    assertThat(pathsMatch(IR.name("x"), IR.name("x"))).isTrue();
    assertThat(pathsMatch(IR.qname("a.b.c"), IR.qname("a.b.c"))).isTrue();

    assertThat(pathsMatch(IR.name("x"), IR.name("y"))).isFalse();
    assertThat(pathsMatch(IR.qname("a.b"), IR.qname("a.c"))).isFalse();
    assertThat(pathsMatch(IR.qname("a.b"), IR.qname("c.b"))).isFalse();
    assertThat(pathsMatch(IR.qname("a.b"), IR.name("b"))).isFalse();
    assertThat(pathsMatch(IR.name("a"), IR.qname("a.b"))).isFalse();
    assertThat(pathsMatch(IR.qname("a.b.c"), IR.qname("a.b"))).isFalse();
  }

  @Test
  public void testPathsMatchRejectsUnsupportedExpressions() {
    assertThat(pathsMatch(IR.call(IR.name("f")), IR.call(IR.name("f")))).isFalse();
  }
}
