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

import static com.flowrefine.testing.TypeSubject.assertType;
import static com.google.common.truth.Truth.assertThat;

import com.flowrefine.ast.IR;
import com.flowrefine.ast.Node;
import com.flowrefine.testing.FakeTypeEvaluator;
import com.flowrefine.testing.TypeTestBase;
import com.flowrefine.types.Type;
import com.flowrefine.types.Types;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NarrowingScopeTest extends TypeTestBase {

  private static final int LONG_CHAIN_LENGTH = 1050;

  private final NarrowingFactBuilder builder = NarrowingFactBuilder.create();

  @Test
  public void testEmptyScopeKnowsNothing() {
    assertThat(NarrowingScope.empty().getFacts()).isEmpty();
    assertType(NarrowingScope.empty().getType(IR.name("x"), intType)).isEqualTo(intType);
  }

  @Test
  public void testFactsApplyInOrder() {
    Node x = IR.name("x");
    NarrowingFact first = NarrowingFact.create(x, union(dogType, catType));
    NarrowingFact second = NarrowingFact.create(x, catType);

    NarrowingScope scope = NarrowingScope.empty().withFact(first).withFact(second);

    assertThat(scope.getFacts()).containsExactly(first, second).inOrder();
    assertType(scope.getType(IR.name("x"), animalType)).isEqualTo(catType);
  }

  @Test
  public void testConditionalFactAfterNarrowing() {
    Node x = IR.name("x");
    NarrowingScope scope =
        NarrowingScope.empty()
            .withFacts(
                ImmutableList.of(
                    NarrowingFact.create(x, dogType),
                    NarrowingFact.create(x, catType).asConditional()));

    assertType(scope.getType(IR.name("x"), animalType)).isUnionOf(catType, dogType);
  }

  @Test
  public void testOnlyMatchingFactsApply() {
    NarrowingScope scope =
        NarrowingScope.empty()
            .withFact(NarrowingFact.create(IR.qname("a.b"), intType))
            .withFact(NarrowingFact.create(IR.name("a"), dogType));

    assertType(scope.getType(IR.qname("a.b"), Types.unknown())).isEqualTo(intType);
    assertType(scope.getType(IR.name("a"), Types.unknown())).isEqualTo(dogType);
    assertType(scope.getType(IR.qname("a.c"), strType)).isEqualTo(strType);
  }

  @Test
  public void testNoInformationLeavesScopeUnchanged() {
    NarrowingScope scope =
        NarrowingScope.empty().withFact(NarrowingFact.create(IR.name("x"), intType));
    assertThat(scope.withOutcome(null, true)).isSameInstanceAs(scope);
    assertThat(scope.withFacts(ImmutableList.of())).isSameInstanceAs(scope);
  }

  @Test
  public void testBranchesOfAnIfStatement() {
    // if x is not None and y: ... else: ...
    FakeTypeEvaluator evaluator =
        new FakeTypeEvaluator()
            .declare("x", union(strType, Types.none()))
            .declare("y", union(intType, Types.none()));
    Node test = IR.and(IR.isNot(IR.name("x"), IR.none()), IR.name("y"));
    ConditionalNarrowingResults results = builder.buildForConditional(test, evaluator);

    NarrowingScope entry = NarrowingScope.empty();
    NarrowingScope thenScope = entry.withOutcome(results, true);
    NarrowingScope elseScope = entry.withOutcome(results, false);

    assertType(thenScope.getType(IR.name("x"), union(strType, Types.none())))
        .isEqualTo(strType);
    assertType(thenScope.getType(IR.name("y"), union(intType, Types.none())))
        .isEqualTo(intType);
    assertThat(elseScope).isSameInstanceAs(entry);
    assertType(elseScope.getType(IR.name("x"), union(strType, Types.none())))
        .isUnionOf(strType, Types.none());
  }

  @Test
  public void testSiblingBranchesShareTheirParent() {
    Node x = IR.name("x");
    NarrowingScope parent =
        NarrowingScope.empty().withFact(NarrowingFact.create(x, union(dogType, catType)));

    NarrowingScope left = parent.withFact(NarrowingFact.create(x, dogType));
    NarrowingScope right = parent.withFact(NarrowingFact.create(x, catType));

    assertType(left.getType(IR.name("x"), animalType)).isEqualTo(dogType);
    assertType(right.getType(IR.name("x"), animalType)).isEqualTo(catType);
    assertType(parent.getType(IR.name("x"), animalType)).isUnionOf(dogType, catType);
  }

  @Test
  public void testAssignedSpecialBuiltInIsKept() {
    NarrowingScope scope =
        NarrowingScope.empty()
            .withFact(builder.buildForAssignment(IR.name("Callable"), callableClass));

    assertType(scope.getType(IR.name("Callable"), Types.unbound())).isEqualTo(callableClass);
    assertType(scope.getType(IR.name("Callable"), intType)).isEqualTo(intType);
  }

  @Test
  public void testLongChain() {
    Node x = IR.name("x");
    NarrowingScope scope = NarrowingScope.empty();
    Type last = null;
    for (int i = 0; i < LONG_CHAIN_LENGTH; i++) {
      last = i % 2 == 0 ? dogType : catType;
      scope = scope.withFact(NarrowingFact.create(x, last));
    }

    assertThat(scope.getFacts()).hasSize(LONG_CHAIN_LENGTH);
    assertType(scope.getType(IR.name("x"), animalType)).isEqualTo(last);
  }
}
